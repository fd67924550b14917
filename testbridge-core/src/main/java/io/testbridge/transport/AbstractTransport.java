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
package io.testbridge.transport;

import io.testbridge.output.LogCategories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Handler bookkeeping shared by the transport variants: guarded dispatch and
 * the exactly-once close callback.
 */
public abstract class AbstractTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(AbstractTransport.class);

    private final AtomicBoolean closeFired = new AtomicBoolean(false);
    private final Object handlerLock = new Object();
    private final List<ProtocolMessage> backlog = new ArrayList<>();
    private Consumer<ProtocolMessage> messageHandler;
    private Runnable closeHandler;

    @Override
    public void onMessage(Consumer<ProtocolMessage> handler) {
        List<ProtocolMessage> queued;
        synchronized (handlerLock) {
            this.messageHandler = handler;
            if (handler == null || backlog.isEmpty()) {
                return;
            }
            queued = new ArrayList<>(backlog);
            backlog.clear();
        }
        for (ProtocolMessage message : queued) {
            deliver(handler, message);
        }
    }

    @Override
    public void onClose(Runnable handler) {
        boolean runNow;
        synchronized (handlerLock) {
            this.closeHandler = handler;
            runNow = closeFired.get();
        }
        if (runNow && handler != null) {
            runCloseHandler(handler);
        }
    }

    protected boolean isCloseFired() {
        return closeFired.get();
    }

    protected void dispatch(ProtocolMessage message) {
        if (closeFired.get()) {
            return;
        }
        if (LogCategories.PROTOCOL_LOGGER.isTraceEnabled()) {
            LogCategories.PROTOCOL_LOGGER.trace("<< {}", message.toJson());
        }
        Consumer<ProtocolMessage> handler;
        synchronized (handlerLock) {
            handler = messageHandler;
            if (handler == null) {
                backlog.add(message);
                return;
            }
        }
        deliver(handler, message);
    }

    private static void deliver(Consumer<ProtocolMessage> handler, ProtocolMessage message) {
        try {
            handler.accept(message);
        } catch (Exception e) {
            logger.error("message handler error for {}: {}", message.method(), e.getMessage(), e);
        }
    }

    /**
     * Run the close handler unless it already ran. Safe to call from any thread,
     * any number of times.
     */
    protected void fireClose() {
        Runnable handler;
        synchronized (handlerLock) {
            if (!closeFired.compareAndSet(false, true)) {
                return;
            }
            handler = closeHandler;
        }
        if (handler != null) {
            runCloseHandler(handler);
        }
    }

    private static void runCloseHandler(Runnable handler) {
        try {
            handler.run();
        } catch (Exception e) {
            logger.error("close handler error: {}", e.getMessage(), e);
        }
    }

}
