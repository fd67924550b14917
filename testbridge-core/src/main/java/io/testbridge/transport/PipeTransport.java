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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport over a byte stream pair. Each message is one JSON document
 * followed by a single NUL byte. A daemon thread reads the input until EOF.
 */
public class PipeTransport extends AbstractTransport {

    private static final Logger logger = LoggerFactory.getLogger(PipeTransport.class);

    private static final AtomicInteger COUNTER = new AtomicInteger();

    private final InputStream in;
    private final OutputStream out;
    private final Object writeLock = new Object();
    private final FrameDecoder decoder = new FrameDecoder();
    private final Thread readerThread;
    private volatile boolean closed;

    public PipeTransport(InputStream in, OutputStream out) {
        this.in = in;
        this.out = out;
        readerThread = new Thread(this::readLoop, "pipe-transport-" + COUNTER.incrementAndGet());
        readerThread.setDaemon(true);
        readerThread.start();
    }

    @Override
    public void send(ProtocolMessage message) {
        if (closed) {
            throw new TransportException(TransportException.Type.CLOSED, "pipe has been closed");
        }
        String json = message.toJson();
        if (LogCategories.PROTOCOL_LOGGER.isTraceEnabled()) {
            LogCategories.PROTOCOL_LOGGER.trace(">> {}", json);
        }
        try {
            synchronized (writeLock) {
                out.write(FrameDecoder.encode(json));
                out.flush();
            }
        } catch (IOException e) {
            throw new TransportException(TransportException.Type.SEND_FAILED, "pipe write failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /**
     * Ends the output stream and stops reading. The close handler runs right
     * away: a reader blocked on some stream types is not woken by closing them.
     */
    @Override
    public void close() {
        if (closed) {
            fireClose();
            return;
        }
        closed = true;
        synchronized (writeLock) {
            try {
                out.close();
            } catch (IOException e) {
                logger.debug("error closing pipe output: {}", e.getMessage());
            }
        }
        try {
            in.close();
        } catch (IOException e) {
            logger.debug("error closing pipe input: {}", e.getMessage());
        }
        fireClose();
    }

    private void readLoop() {
        byte[] buffer = new byte[8192];
        try {
            int count;
            while (!closed && (count = in.read(buffer)) != -1) {
                for (String frame : decoder.feed(buffer, 0, count)) {
                    ProtocolMessage message;
                    try {
                        message = ProtocolMessage.parse(frame);
                    } catch (TransportException e) {
                        logger.warn("closing pipe: {}", e.getMessage());
                        close();
                        return;
                    }
                    dispatch(message);
                }
            }
            if (decoder.getPendingLength() > 0) {
                logger.debug("pipe ended with {} bytes of an incomplete frame", decoder.getPendingLength());
            }
        } catch (IOException e) {
            if (!closed) {
                logger.debug("pipe read failed: {}", e.getMessage());
            }
        }
        closed = true;
        fireClose();
    }

}
