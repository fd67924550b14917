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
package io.testbridge.process;

import io.testbridge.common.PathUtils;

import java.nio.file.Path;

/**
 * One runner invocation context: the workspace folder, a located config file
 * and the runner that serves it. Immutable once discovered.
 */
public record TestConfig(String workspaceFolder, String configFile, RunnerInfo runner) {

    public TestConfig {
        workspaceFolder = PathUtils.canonicalize(workspaceFolder);
        configFile = PathUtils.canonicalize(configFile);
    }

    public String configFolder() {
        return PathUtils.parent(configFile);
    }

    public String configFileName() {
        return PathUtils.fileName(configFile);
    }

    public Path configFolderPath() {
        return Path.of(configFolder());
    }

    /**
     * Config folder relative to the workspace, as shown in command log lines.
     */
    public String relativeConfigFolder() {
        return PathUtils.relativize(workspaceFolder, configFolder());
    }

}
