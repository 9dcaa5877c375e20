/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.oocsi.client.async.tcp;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.oocsi.exception.OocsiNotConnectedException;
import org.oocsi.protocol.OocsiLineDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Async TCP connection using Netty for non-blocking I/O.
 *
 * <p>Each connection runs on its own single-threaded event loop, which decodes lines and dispatches them in
 * arrival order.
 */
public class AsyncTcpConnection {
    private static final Logger log = LoggerFactory.getLogger(AsyncTcpConnection.class);

    private final String host;
    private final int port;
    private final Duration connectTimeout;
    private final int maxLineLength;
    private final EventLoopGroup eventLoopGroup;
    private final Bootstrap bootstrap;
    private final InboundLineHandler lineHandler;
    private volatile Channel channel;

    /**
     * Creates an unconnected connection.
     *
     * @param host           the server host
     * @param port           the server port
     * @param maxLineLength  the longest line accepted from the server
     * @param connectTimeout the connect timeout
     * @param handle         the client handle, used in log messages
     * @param lineConsumer   receives every line after the handshake response
     * @param onClose        notified with this connection when its channel closes
     */
    public AsyncTcpConnection(
            String host,
            int port,
            int maxLineLength,
            Duration connectTimeout,
            String handle,
            Consumer<String> lineConsumer,
            Consumer<AsyncTcpConnection> onClose) {
        this.host = host;
        this.port = port;
        this.connectTimeout = connectTimeout;
        this.maxLineLength = maxLineLength;
        this.eventLoopGroup = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();
        this.lineHandler = new InboundLineHandler(handle, lineConsumer, () -> onClose.accept(this));
        configureBootstrap();
    }

    private void configureBootstrap() {
        bootstrap
                .group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast("lineDecoder", new OocsiLineDecoder(maxLineLength));
                        pipeline.addLast("lineHandler", lineHandler);
                    }
                });
    }

    /**
     * Connects to the server asynchronously.
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> future = new CompletableFuture<>();

        bootstrap.connect(host, port).addListener((ChannelFutureListener) channelFuture -> {
            if (channelFuture.isSuccess()) {
                channel = channelFuture.channel();
                future.complete(null);
            } else {
                future.completeExceptionally(channelFuture.cause());
            }
        });

        return future;
    }

    /**
     * Sends the handshake line and returns the first line the server answers with.
     *
     * @param handshake the handshake line
     * @param timeout   how long to wait for the answer
     * @return a future completed with the server response, or failed on timeout or close
     */
    public CompletableFuture<String> handshake(String handshake, Duration timeout) {
        CompletableFuture<String> response = lineHandler.awaitFirstLine();
        send(handshake).whenComplete((v, error) -> {
            if (error != null) {
                response.completeExceptionally(error);
            }
        });
        return response.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Writes one line, appending the line terminator.
     */
    public CompletableFuture<Void> send(String line) {
        Channel current = channel;
        if (current == null || !current.isActive()) {
            return CompletableFuture.failedFuture(new OocsiNotConnectedException("Connection not established or closed"));
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        ByteBuf frame = ByteBufUtil.writeUtf8(current.alloc(), line + "\n");
        log.trace("Sending line of {} bytes to {}", frame.readableBytes(), current.remoteAddress());

        current.writeAndFlush(frame).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                result.complete(null);
            } else {
                log.error("Failed to send line: {}", future.cause().getMessage());
                result.completeExceptionally(future.cause());
            }
        });
        return result;
    }

    public boolean isActive() {
        Channel current = channel;
        return current != null && current.isActive();
    }

    /**
     * Closes the connection and releases resources.
     */
    public CompletableFuture<Void> close() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        Channel current = channel;

        if (current != null && current.isActive()) {
            current.close().addListener((ChannelFutureListener) channelFuture -> {
                eventLoopGroup.shutdownGracefully();
                if (channelFuture.isSuccess()) {
                    future.complete(null);
                } else {
                    future.completeExceptionally(channelFuture.cause());
                }
            });
        } else {
            eventLoopGroup.shutdownGracefully();
            future.complete(null);
        }

        return future;
    }
}
