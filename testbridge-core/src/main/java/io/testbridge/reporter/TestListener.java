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
package io.testbridge.reporter;

/**
 * Receives run events, one method per event kind.
 * <p>
 * Per test id, {@code onTestBegin} precedes {@code onTestEnd}; per step id,
 * {@code onStepBegin} precedes {@code onStepEnd}. Events of tests running in
 * parallel interleave, so implementations key their state by id.
 * Exactly one of {@link #onEnd()} or {@link #onTerminated()} ends every run.
 */
public interface TestListener {

    default void onBegin(BeginParams params) {
    }

    default void onTestBegin(TestBeginParams params) {
    }

    default void onTestEnd(TestEndParams params) {
    }

    default void onStepBegin(StepBeginParams params) {
    }

    default void onStepEnd(StepEndParams params) {
    }

    default void onError(ErrorParams params) {
    }

    /**
     * The runner reported a graceful end.
     */
    default void onEnd() {
    }

    /**
     * The side channel closed without a graceful end: the child crashed, was
     * force-closed after a stop request, or never connected.
     */
    default void onTerminated() {
    }

    default void onStdOut(String text) {
    }

    default void onStdErr(String text) {
    }

}
