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

import io.testbridge.common.CancellationToken;
import io.testbridge.reporter.RunOutcome;
import io.testbridge.reporter.TestListener;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Operations against the external runner for one config at a time.
 * Streaming operations report through the listener and complete once the
 * side channel has closed; they never complete exceptionally for a crashed
 * child, which shows up as {@link RunOutcome#TERMINATED}.
 */
public interface TestRunner {

    ListFilesReport listFiles(TestConfig config);

    /**
     * @param locations absolute file paths, optionally with {@code :line}; empty for everything
     */
    CompletableFuture<RunOutcome> listTests(TestConfig config, List<String> locations,
                                            TestListener listener, CancellationToken token);

    CompletableFuture<RunOutcome> runTests(TestConfig config, List<String> locations, RunOptions options,
                                           TestListener listener, CancellationToken token);

    CompletableFuture<RunOutcome> debugTests(TestConfig config, List<String> locations, RunOptions options,
                                             TestListener listener, CancellationToken token);

    /**
     * Never fails: when the runner cannot answer, every input file is
     * considered related and the failure is returned as an error.
     */
    RelatedFilesReport findRelatedTestFiles(TestConfig config, List<String> files);

}
