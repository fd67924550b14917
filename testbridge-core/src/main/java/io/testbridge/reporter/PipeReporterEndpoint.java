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

import io.testbridge.common.StringUtils;
import io.testbridge.transport.PipeTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Side channel over a local Unix-domain socket: the "pipe path" handed to the
 * child. The one accepted connection carries NUL-terminated frames.
 */
public class PipeReporterEndpoint extends AbstractReporterEndpoint {

    private static final Logger logger = LoggerFactory.getLogger(PipeReporterEndpoint.class);

    private final Path socketPath;
    private final ServerSocketChannel server;
    private volatile boolean listening;

    public PipeReporterEndpoint(String reporterModule) {
        super(reporterModule);
        try {
            Path dir = Files.createTempDirectory("testbridge-");
            socketPath = dir.resolve(StringUtils.createGuid().substring(0, 12) + ".sock");
            server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            server.bind(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException e) {
            throw new IllegalStateException("failed to create reporter pipe: " + e.getMessage(), e);
        }
        listening = true;
        Thread acceptor = new Thread(this::acceptOne, "reporter-pipe-accept");
        acceptor.setDaemon(true);
        acceptor.start();
        logger.debug("reporter pipe listening: {}", socketPath);
    }

    @Override
    public String endpoint() {
        return socketPath.toString();
    }

    private void acceptOne() {
        try {
            SocketChannel channel = server.accept();
            PipeTransport transport = new PipeTransport(inputStream(channel), outputStream(channel));
            if (!transportFuture.complete(transport)) {
                transport.close();
            }
        } catch (ClosedChannelException e) {
            logger.debug("reporter pipe closed before a connection");
        } catch (IOException e) {
            logger.warn("reporter pipe accept failed: {}", e.getMessage());
            abandon();
        } finally {
            stopListening();
        }
    }

    @Override
    protected void stopListening() {
        if (!listening) {
            return;
        }
        listening = false;
        try {
            server.close();
        } catch (IOException e) {
            logger.debug("error closing reporter pipe: {}", e.getMessage());
        }
        try {
            Files.deleteIfExists(socketPath);
            Files.deleteIfExists(socketPath.getParent());
        } catch (IOException e) {
            logger.debug("could not remove {}: {}", socketPath, e.getMessage());
        }
    }

    // Channels.newInputStream and newOutputStream share one lock on a blocking
    // channel, so a pending read would block every send. Reads and writes go
    // to the channel directly instead.

    private static InputStream inputStream(SocketChannel channel) {
        return new InputStream() {

            @Override
            public int read() throws IOException {
                byte[] one = new byte[1];
                int n = read(one, 0, 1);
                return n == -1 ? -1 : one[0] & 0xff;
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                if (len == 0) {
                    return 0;
                }
                return channel.read(ByteBuffer.wrap(b, off, len));
            }

            @Override
            public void close() throws IOException {
                channel.close();
            }

        };
    }

    private static OutputStream outputStream(SocketChannel channel) {
        return new OutputStream() {

            @Override
            public void write(int b) throws IOException {
                write(new byte[]{(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                ByteBuffer buffer = ByteBuffer.wrap(b, off, len);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            }

            @Override
            public void close() throws IOException {
                channel.close();
            }

        };
    }

}
