/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.testbridge.cli;

import io.testbridge.host.BridgeSettings;
import io.testbridge.host.TestHost;
import io.testbridge.output.Console;
import io.testbridge.output.LogCategories;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * Options shared by the commands that start a host.
 */
class HostOptions {

    @Option(
            names = {"-w", "--workdir"},
            description = "Workspace folder (default: current directory)"
    )
    String workingDir;

    @Option(
            names = {"-s", "--settings"},
            description = "Settings file (default: testbridge.json in the workspace folder)"
    )
    String settingsFile;

    @Option(
            names = {"-r", "--runner"},
            description = "Runner executable or command line, overrides the settings"
    )
    String runner;

    @Option(
            names = {"-g", "--log-level"},
            description = "Log level: trace, debug, info, warn, error"
    )
    String logLevel;

    Path workspaceFolder() {
        return Path.of(workingDir != null ? workingDir : "").toAbsolutePath().normalize();
    }

    BridgeSettings loadSettings() {
        BridgeSettings settings = settingsFile != null
                ? BridgeSettings.load(workspaceFolder().resolve(settingsFile))
                : BridgeSettings.forWorkspace(workspaceFolder());
        if (runner != null) {
            settings.setRunnerPath(runner);
        }
        String level = logLevel != null ? logLevel : settings.getLogLevel();
        if (level != null) {
            LogCategories.setRuntimeLogLevel(level);
        }
        return settings;
    }

    /**
     * Start a host and run the initial discovery, printing its warnings.
     */
    TestHost startHost() {
        TestHost host = new TestHost(List.of(workspaceFolder().toString()), loadSettings());
        for (String warning : host.rebuild()) {
            Console.warn(warning);
        }
        return host;
    }

}
