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

import java.util.List;

/**
 * Per-run options.
 *
 * @param grep    title filter for parametrized tests, regex-escaped before use
 * @param workers null for the runner default
 * @param trace   trace mode, null for the runner default
 */
public record RunOptions(List<String> projects, String grep, boolean headed, Integer workers, String trace) {

    public static final RunOptions DEFAULT = new RunOptions(List.of(), null, false, null, null);

    public RunOptions {
        projects = projects == null ? List.of() : List.copyOf(projects);
    }

    public static RunOptions forProjects(List<String> projects) {
        return new RunOptions(projects, null, false, null, null);
    }

    public RunOptions withGrep(String grep) {
        return new RunOptions(projects, grep, headed, workers, trace);
    }

}
