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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport pair for tests. Each end delivers inbound messages on
 * its own thread, in order, the way a reader thread would. Closing either end
 * closes both, after the messages already in flight.
 */
public class LinkedTransport extends AbstractTransport {

    private static final AtomicInteger COUNTER = new AtomicInteger();

    private final ExecutorService inbound;
    private LinkedTransport peer;
    private volatile boolean closed;

    private LinkedTransport(String name) {
        this.inbound = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name + "-" + COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @return {@code [host side, runner side]}
     */
    public static LinkedTransport[] pair() {
        LinkedTransport host = new LinkedTransport("host-end");
        LinkedTransport runner = new LinkedTransport("runner-end");
        host.peer = runner;
        runner.peer = host;
        return new LinkedTransport[]{host, runner};
    }

    @Override
    public void send(ProtocolMessage message) {
        if (closed) {
            throw new TransportException(TransportException.Type.CLOSED, "transport closed");
        }
        peer.enqueue(() -> peer.dispatch(message));
    }

    @Override
    public void close() {
        closeLocal();
        peer.closeLocal();
    }

    private void closeLocal() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        enqueue(this::fireClose);
        inbound.shutdown();
    }

    private void enqueue(Runnable task) {
        try {
            inbound.execute(task);
        } catch (RejectedExecutionException e) {
            // closed, late messages are dropped
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

}
