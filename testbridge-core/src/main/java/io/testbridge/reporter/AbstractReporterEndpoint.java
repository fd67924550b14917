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
import io.testbridge.transport.TransportException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

abstract class AbstractReporterEndpoint implements ReporterEndpoint {

    protected final String reporterModule;
    protected final CompletableFuture<Transport> transportFuture = new CompletableFuture<>();

    protected AbstractReporterEndpoint(String reporterModule) {
        this.reporterModule = reporterModule;
    }

    @Override
    public Map<String, String> env() {
        Map<String, String> env = new LinkedHashMap<>();
        if (reporterModule != null) {
            env.put(REPORTER_ENV, reporterModule);
        }
        env.put(ENDPOINT_ENV, endpoint());
        return env;
    }

    @Override
    public CompletableFuture<Transport> transport() {
        return transportFuture;
    }

    @Override
    public void abandon() {
        if (transportFuture.completeExceptionally(new TransportException(
                TransportException.Type.CONNECT_FAILED, "runner did not connect to " + endpoint()))) {
            stopListening();
        }
    }

    @Override
    public void close() {
        abandon();
        stopListening();
        if (transportFuture.isDone() && !transportFuture.isCompletedExceptionally()) {
            transportFuture.join().close();
        }
    }

    protected abstract void stopListening();

}
