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

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.testbridge.common.StringUtils;
import io.testbridge.transport.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Side channel over a WebSocket served on {@code 127.0.0.1} at a random port
 * and a random path. Used whenever the runner cannot inherit a pipe, always
 * in debug mode. Only the first upgraded connection is kept; later ones are
 * closed.
 */
public class WebSocketReporterEndpoint extends AbstractReporterEndpoint {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketReporterEndpoint.class);

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final Channel serverChannel;
    private final String path;
    private final int port;
    private final AtomicBoolean accepted = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public WebSocketReporterEndpoint(String reporterModule) {
        super(reporterModule);
        path = "/" + StringUtils.createGuid();
        bossGroup = new MultiThreadIoEventLoopGroup(1, daemonThreadFactory("reporter-ws-boss-"), NioIoHandler.newFactory());
        workerGroup = new MultiThreadIoEventLoopGroup(1, daemonThreadFactory("reporter-ws-worker-"), NioIoHandler.newFactory());
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<>() {
                        @Override
                        protected void initChannel(Channel c) {
                            ChannelPipeline p = c.pipeline();
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(65536));
                            p.addLast(new WebSocketServerProtocolHandler(path, null, false, WebSocketTransport.MAX_FRAME_SIZE));
                            p.addLast(new HandshakeHandler());
                        }
                    });
            serverChannel = bootstrap.bind("127.0.0.1", 0).sync().channel();
            port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdownGroups();
            throw new IllegalStateException("interrupted binding reporter socket", e);
        } catch (Exception e) {
            shutdownGroups();
            throw new IllegalStateException("could not bind reporter socket: " + e.getMessage(), e);
        }
        logger.debug("reporter websocket listening: {}", endpoint());
    }

    @Override
    public String endpoint() {
        return "ws://127.0.0.1:" + port + path;
    }

    public int getPort() {
        return port;
    }

    /**
     * Stops accepting. The worker group stays up while the accepted connection
     * is open and shuts down when it closes.
     */
    @Override
    protected void stopListening() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        serverChannel.close();
        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        if (!accepted.get()) {
            workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }

    private void shutdownGroups() {
        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private class HandshakeHandler extends ChannelInboundHandlerAdapter {

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
                ctx.pipeline().remove(this);
                if (!accepted.compareAndSet(false, true) || transportFuture.isDone()) {
                    logger.debug("refusing extra reporter connection from {}", ctx.channel().remoteAddress());
                    ctx.close();
                    return;
                }
                WebSocketTransport transport = WebSocketTransport.attach(ctx.channel());
                ctx.channel().closeFuture().addListener(f -> workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS));
                transportFuture.complete(transport);
                stopListening();
                logger.debug("reporter connected: {}", ctx.channel().remoteAddress());
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            logger.debug("reporter websocket error: {}", cause.getMessage());
            ctx.close();
        }

    }

}
