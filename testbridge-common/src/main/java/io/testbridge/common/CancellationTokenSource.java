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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owner side of a {@link CancellationToken}.
 */
public class CancellationTokenSource {

    private static final Logger logger = LoggerFactory.getLogger(CancellationTokenSource.class);

    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    private final CancellationToken token = new CancellationToken() {

        @Override
        public boolean isCancellationRequested() {
            return cancelled;
        }

        @Override
        public Registration onCancellationRequested(Runnable callback) {
            synchronized (CancellationTokenSource.this) {
                if (!cancelled) {
                    callbacks.add(callback);
                    return () -> callbacks.remove(callback);
                }
            }
            invoke(callback);
            return () -> {
            };
        }

    };

    public CancellationToken getToken() {
        return token;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Request cancellation. Callbacks run once, on the calling thread.
     */
    public void cancel() {
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
        }
        for (Runnable callback : callbacks) {
            invoke(callback);
        }
        callbacks.clear();
    }

    private static void invoke(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            logger.error("cancellation callback failed: {}", e.getMessage(), e);
        }
    }

}
