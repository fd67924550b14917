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

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.testbridge.output.LogCategories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport over a Netty WebSocket channel, one JSON document per text frame.
 * Server side code attaches to an already upgraded channel; {@link #connect}
 * is the client side.
 */
public class WebSocketTransport extends AbstractTransport {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketTransport.class);

    public static final int MAX_FRAME_SIZE = 64 * 1024 * 1024;

    private final Channel channel;
    private final EventLoopGroup ownedGroup;
    private volatile boolean closed;

    private WebSocketTransport(Channel channel, EventLoopGroup ownedGroup) {
        this.channel = channel;
        this.ownedGroup = ownedGroup;
    }

    /**
     * Wrap a channel whose WebSocket handshake has completed. Must be called on
     * the channel's event loop so that no frame slips past before the handler
     * is in the pipeline.
     */
    public static WebSocketTransport attach(Channel channel) {
        return attach(channel, null);
    }

    private static WebSocketTransport attach(Channel channel, EventLoopGroup ownedGroup) {
        WebSocketTransport transport = new WebSocketTransport(channel, ownedGroup);
        channel.pipeline().addLast(new WebSocketFrameAggregator(MAX_FRAME_SIZE));
        channel.pipeline().addLast(transport.new FrameHandler());
        channel.closeFuture().addListener(future -> transport.handleChannelClosed());
        return transport;
    }

    public static WebSocketTransport connect(URI uri, Duration timeout) {
        EventLoopGroup group = new MultiThreadIoEventLoopGroup(1, daemonThreadFactory("ws-transport-"), NioIoHandler.newFactory());
        CompletableFuture<WebSocketTransport> handshake = new CompletableFuture<>();
        int port = uri.getPort() == -1 ? 80 : uri.getPort();
        try {
            Bootstrap bootstrap = new Bootstrap();
            bootstrap.group(group)
                    .channel(NioSocketChannel.class)
                    .handler(new ChannelInitializer<>() {
                        @Override
                        protected void initChannel(Channel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new HttpClientCodec());
                            p.addLast(new HttpObjectAggregator(65536));
                            p.addLast(new WebSocketClientProtocolHandler(WebSocketClientHandshakerFactory.newHandshaker(
                                    uri, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), MAX_FRAME_SIZE)));
                            p.addLast(new ChannelInboundHandlerAdapter() {
                                @Override
                                public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
                                    if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                                        ctx.pipeline().remove(this);
                                        handshake.complete(attach(ctx.channel(), group));
                                    } else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                                        handshake.completeExceptionally(new TransportException(
                                                TransportException.Type.CONNECT_FAILED, "websocket handshake timed out"));
                                    }
                                    super.userEventTriggered(ctx, evt);
                                }

                                @Override
                                public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
                                    handshake.completeExceptionally(cause);
                                    ctx.close();
                                }
                            });
                        }
                    });
            bootstrap.connect(uri.getHost(), port).sync();
            return handshake.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            group.shutdownGracefully();
            throw new TransportException(TransportException.Type.CONNECT_FAILED, "connection interrupted", e);
        } catch (ExecutionException e) {
            group.shutdownGracefully();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TransportException te) {
                throw te;
            }
            throw new TransportException(TransportException.Type.CONNECT_FAILED, "websocket handshake failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            group.shutdownGracefully();
            throw new TransportException(TransportException.Type.CONNECT_FAILED, "websocket handshake timed out: " + uri, e);
        } catch (Exception e) {
            group.shutdownGracefully();
            throw new TransportException(TransportException.Type.CONNECT_FAILED, "connection failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void send(ProtocolMessage message) {
        if (closed || !channel.isActive()) {
            throw new TransportException(TransportException.Type.CLOSED, "websocket is not open");
        }
        String json = message.toJson();
        if (LogCategories.PROTOCOL_LOGGER.isTraceEnabled()) {
            LogCategories.PROTOCOL_LOGGER.trace(">> {}", json);
        }
        channel.writeAndFlush(new TextWebSocketFrame(json)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                logger.error("send failed: {}", future.cause().getMessage());
            }
        });
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    private void handleChannelClosed() {
        closed = true;
        fireClose();
        if (ownedGroup != null) {
            ownedGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private class FrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
            ProtocolMessage message;
            try {
                message = ProtocolMessage.parse(frame.text());
            } catch (TransportException e) {
                logger.warn("closing websocket: {}", e.getMessage());
                closed = true;
                ctx.close();
                return;
            }
            dispatch(message);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            logger.debug("websocket error: {}", cause.getMessage());
            ctx.close();
        }

    }

}
