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

import io.testbridge.transport.ProtocolMessage;
import io.testbridge.transport.Transport;
import io.testbridge.transport.TransportException;
import io.testbridge.transport.WebSocketTransport;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketReporterEndpointTest {

    @Test
    void testEndpointIsLoopbackWithRandomPath() {
        try (WebSocketReporterEndpoint endpoint = new WebSocketReporterEndpoint("reporter.js")) {
            URI uri = URI.create(endpoint.endpoint());
            assertEquals("ws", uri.getScheme());
            assertEquals("127.0.0.1", uri.getHost());
            assertEquals(endpoint.getPort(), uri.getPort());
            assertTrue(uri.getPath().length() > 10);
            assertEquals("reporter.js", endpoint.env().get(ReporterEndpoint.REPORTER_ENV));
        }
    }

    @Test
    void testChildConnectsAndExchangesMessages() throws Exception {
        WebSocketReporterEndpoint endpoint = new WebSocketReporterEndpoint(null);
        WebSocketTransport child = WebSocketTransport.connect(URI.create(endpoint.endpoint()), Duration.ofSeconds(5));
        try {
            Transport host = endpoint.transport().get(5, TimeUnit.SECONDS);
            List<ProtocolMessage> atHost = new CopyOnWriteArrayList<>();
            CountDownLatch hostLatch = new CountDownLatch(1);
            host.onMessage(message -> {
                atHost.add(message);
                hostLatch.countDown();
            });
            List<ProtocolMessage> atChild = new CopyOnWriteArrayList<>();
            CountDownLatch childLatch = new CountDownLatch(1);
            child.onMessage(message -> {
                atChild.add(message);
                childLatch.countDown();
            });
            child.send(ProtocolMessage.notification("onBegin", Map.of("projects", List.of())));
            assertTrue(hostLatch.await(5, TimeUnit.SECONDS));
            assertTrue(atHost.get(0).hasMethod("onBegin"));
            host.send(ProtocolMessage.notification("stop", Map.of()));
            assertTrue(childLatch.await(5, TimeUnit.SECONDS));
            assertTrue(atChild.get(0).hasMethod("stop"));
        } finally {
            child.close();
            endpoint.close();
        }
    }

    @Test
    void testCloseFromHostReachesChild() throws Exception {
        WebSocketReporterEndpoint endpoint = new WebSocketReporterEndpoint(null);
        WebSocketTransport child = WebSocketTransport.connect(URI.create(endpoint.endpoint()), Duration.ofSeconds(5));
        CountDownLatch closed = new CountDownLatch(1);
        child.onClose(closed::countDown);
        endpoint.transport().get(5, TimeUnit.SECONDS);
        endpoint.close();
        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertTrue(child.isClosed());
    }

    @Test
    void testMalformedFrameClosesChannelOnce() throws Exception {
        WebSocketReporterEndpoint endpoint = new WebSocketReporterEndpoint(null);
        CountDownLatch childClosed = new CountDownLatch(1);
        WebSocket child = HttpClient.newHttpClient().newWebSocketBuilder()
                .buildAsync(URI.create(endpoint.endpoint()), new WebSocket.Listener() {
                    @Override
                    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                        childClosed.countDown();
                        return null;
                    }

                    @Override
                    public void onError(WebSocket webSocket, Throwable error) {
                        childClosed.countDown();
                    }
                })
                .get(5, TimeUnit.SECONDS);
        try {
            Transport host = endpoint.transport().get(5, TimeUnit.SECONDS);
            List<ProtocolMessage> atHost = new CopyOnWriteArrayList<>();
            host.onMessage(atHost::add);
            AtomicInteger closes = new AtomicInteger();
            CountDownLatch hostClosed = new CountDownLatch(1);
            host.onClose(() -> {
                closes.incrementAndGet();
                hostClosed.countDown();
            });
            child.sendText("not json", true).get(5, TimeUnit.SECONDS);
            assertTrue(hostClosed.await(5, TimeUnit.SECONDS));
            assertTrue(host.isClosed());
            assertTrue(childClosed.await(5, TimeUnit.SECONDS));
            host.close();
            Thread.sleep(100);
            assertEquals(1, closes.get());
            assertTrue(atHost.isEmpty());
        } finally {
            child.abort();
            endpoint.close();
        }
    }

    @Test
    void testWrongPathIsRejected() {
        try (WebSocketReporterEndpoint endpoint = new WebSocketReporterEndpoint(null)) {
            URI wrong = URI.create("ws://127.0.0.1:" + endpoint.getPort() + "/guess");
            assertThrows(TransportException.class, () -> WebSocketTransport.connect(wrong, Duration.ofSeconds(2)));
            assertFalse(endpoint.transport().isDone());
        }
    }

    @Test
    void testAbandonFailsTransport() {
        WebSocketReporterEndpoint endpoint = new WebSocketReporterEndpoint(null);
        endpoint.abandon();
        CompletionException e = assertThrows(CompletionException.class, () -> endpoint.transport().join());
        assertInstanceOf(TransportException.class, e.getCause());
        endpoint.close();
    }

}
