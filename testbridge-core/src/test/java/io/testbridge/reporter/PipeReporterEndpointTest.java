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

import io.testbridge.transport.FrameDecoder;
import io.testbridge.transport.ProtocolMessage;
import io.testbridge.transport.Transport;
import io.testbridge.transport.TransportException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class PipeReporterEndpointTest {

    @Test
    void testEnvCarriesReporterAndEndpoint() {
        try (PipeReporterEndpoint endpoint = new PipeReporterEndpoint("/opt/reporter.js")) {
            Map<String, String> env = endpoint.env();
            assertEquals("/opt/reporter.js", env.get(ReporterEndpoint.REPORTER_ENV));
            assertEquals(endpoint.endpoint(), env.get(ReporterEndpoint.ENDPOINT_ENV));
            assertTrue(Files.exists(Path.of(endpoint.endpoint())));
        }
    }

    @Test
    void testChildConnectsAndExchangesFrames() throws Exception {
        PipeReporterEndpoint endpoint = new PipeReporterEndpoint(null);
        try (SocketChannel child = SocketChannel.open(StandardProtocolFamily.UNIX)) {
            child.connect(UnixDomainSocketAddress.of(endpoint.endpoint()));
            Transport transport = endpoint.transport().get(5, TimeUnit.SECONDS);
            List<ProtocolMessage> received = new CopyOnWriteArrayList<>();
            CountDownLatch latch = new CountDownLatch(1);
            transport.onMessage(message -> {
                received.add(message);
                latch.countDown();
            });
            child.write(ByteBuffer.wrap(FrameDecoder.encode("{\"id\":0,\"method\":\"onEnd\",\"params\":{}}")));
            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertTrue(received.get(0).hasMethod("onEnd"));

            transport.send(ProtocolMessage.notification("stop", Map.of()));
            ByteBuffer buffer = ByteBuffer.allocate(256);
            FrameDecoder decoder = new FrameDecoder();
            List<String> frames = List.of();
            while (frames.isEmpty()) {
                buffer.clear();
                int n = child.read(buffer);
                assertTrue(n > 0);
                frames = decoder.feed(buffer.array(), 0, n);
            }
            assertEquals("stop", ProtocolMessage.parse(frames.get(0)).method());
        } finally {
            endpoint.close();
        }
        assertFalse(Files.exists(Path.of(endpoint.endpoint())));
    }

    @Test
    void testAbandonFailsTransport() {
        PipeReporterEndpoint endpoint = new PipeReporterEndpoint(null);
        endpoint.abandon();
        CompletionException e = assertThrows(CompletionException.class, () -> endpoint.transport().join());
        assertInstanceOf(TransportException.class, e.getCause());
        assertEquals(TransportException.Type.CONNECT_FAILED, ((TransportException) e.getCause()).getType());
        endpoint.close();
    }

    @Test
    void testAbandonAfterConnectHasNoEffect() throws Exception {
        PipeReporterEndpoint endpoint = new PipeReporterEndpoint(null);
        try (SocketChannel child = SocketChannel.open(StandardProtocolFamily.UNIX)) {
            child.connect(UnixDomainSocketAddress.of(endpoint.endpoint()));
            Transport transport = endpoint.transport().get(5, TimeUnit.SECONDS);
            endpoint.abandon();
            assertFalse(transport.isClosed());
        } finally {
            endpoint.close();
        }
    }

}
