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
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Immutable process configuration, built with {@link ProcessBuilder}.
 *
 * @param removeEnv inherited variables to drop from the child environment,
 *                  applied before {@code env} is added
 * @param logOutput copy every output line to the testbridge.runner logger
 */
public record ProcessConfig(
        List<String> args,
        Path workingDir,
        Map<String, String> env,
        Set<String> removeEnv,
        boolean redirectErrorStream,
        Duration timeout,
        Consumer<ProcessEvent> listener,
        boolean logOutput
) {

    public ProcessConfig {
        args = List.copyOf(args);
        env = Map.copyOf(env);
        removeEnv = Set.copyOf(removeEnv);
    }

    public String commandLine() {
        return String.join(" ", args);
    }

}
