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
package io.testbridge.host;

import io.testbridge.reporter.RunOutcome;
import io.testbridge.reporter.TestError;
import io.testbridge.tree.TestItem;

import java.util.List;

/**
 * Sink for the results of one run, the way a UI shows them. Calls arrive on
 * the host event loop.
 */
public interface TestRunView {

    default void enqueued(TestItem item) {
    }

    default void started(TestItem item) {
    }

    default void passed(TestItem item, long duration) {
    }

    default void failed(TestItem item, List<TestMessage> messages, long duration) {
    }

    default void skipped(TestItem item) {
    }

    /**
     * Output of the runner process.
     */
    default void appendOutput(String text) {
    }

    /**
     * A global error outside any test.
     */
    default void appendError(TestError error) {
    }

    default void end(RunOutcome outcome) {
    }

}
