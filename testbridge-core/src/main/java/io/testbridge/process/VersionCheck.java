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

import java.nio.file.Path;
import java.util.List;

/**
 * Runs {@code <command> --version} and returns what it printed.
 */
@FunctionalInterface
public interface VersionCheck {

    String readVersion(List<String> command, Path workingDir);

    long DEFAULT_TIMEOUT_MILLIS = 30000;

    VersionCheck PROCESS = (command, workingDir) -> {
        ProcessConfig config = ProcessBuilder.create()
                .args(command)
                .arg("--version")
                .workingDir(workingDir)
                .redirectErrorStream(true)
                .timeoutMillis(DEFAULT_TIMEOUT_MILLIS)
                .logOutput(false)
                .build();
        ProcessHandle handle = ProcessHandle.start(config);
        handle.waitForOutput(DEFAULT_TIMEOUT_MILLIS);
        return handle.getSysOut();
    };

}
