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
package io.testbridge.common;

/**
 * Cooperative cancellation signal threaded through long-lived operations.
 * Cancellation is never an exception: operations check the token, stop
 * propagating events and wind down.
 */
public interface CancellationToken {

    boolean isCancellationRequested();

    /**
     * Register a callback for when cancellation is requested. Runs
     * immediately on the calling thread if it was already requested.
     *
     * @return a handle that unregisters the callback
     */
    Registration onCancellationRequested(Runnable callback);

    @FunctionalInterface
    interface Registration extends AutoCloseable {

        @Override
        void close();

    }

    CancellationToken NONE = new CancellationToken() {

        @Override
        public boolean isCancellationRequested() {
            return false;
        }

        @Override
        public Registration onCancellationRequested(Runnable callback) {
            return () -> {
            };
        }

    };

}
