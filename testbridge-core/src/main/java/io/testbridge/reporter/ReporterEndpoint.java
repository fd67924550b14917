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

import io.testbridge.transport.Transport;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Host side of the reporter side channel. The child learns where to connect
 * from {@link #env()} and connects out exactly once.
 */
public interface ReporterEndpoint extends AutoCloseable {

    /** Reporter module the runner should load. */
    String REPORTER_ENV = "TESTBRIDGE_REPORTER";

    /** Pipe path or {@code ws://} URL of the side channel. */
    String ENDPOINT_ENV = "TESTBRIDGE_REPORTER_ENDPOINT";

    /**
     * Address the child connects to.
     */
    String endpoint();

    Map<String, String> env();

    /**
     * Completes with the transport of the first inbound connection. Completes
     * exceptionally if the endpoint is abandoned or closed before that.
     */
    CompletableFuture<Transport> transport();

    /**
     * Give up waiting for a connection, for example because the child exited.
     * Has no effect once connected.
     */
    void abandon();

    /**
     * Stop listening and close the connected transport, if any.
     */
    @Override
    void close();

}
