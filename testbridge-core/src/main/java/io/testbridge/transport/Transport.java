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

import java.util.function.Consumer;

/**
 * Bidirectional channel of discrete JSON messages.
 * <p>
 * Contract: calling {@link #close()} always leads to the close handler being
 * run, exactly once, also when the peer disconnects first or a malformed frame
 * forced the close. Callers waiting for a run to finish rely on this.
 */
public interface Transport {

    /**
     * @throws TransportException of type CLOSED if the transport is already closed
     */
    void send(ProtocolMessage message);

    void close();

    boolean isClosed();

    /**
     * Set the inbound message handler. Messages that arrived before a handler
     * was set are delivered to it first, in arrival order.
     */
    void onMessage(Consumer<ProtocolMessage> handler);

    /**
     * Set the close handler. If the transport is already closed the handler
     * runs immediately on the calling thread.
     */
    void onClose(Runnable handler);

}
