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

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.oocsi.exception.OocsiNotConnectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Last handler of the async pipeline: completes the handshake with the first line and hands every later line to
 * the session, on the event loop of the channel.
 */
class InboundLineHandler extends SimpleChannelInboundHandler<String> {
    private static final Logger log = LoggerFactory.getLogger(InboundLineHandler.class);

    private final String handle;
    private final Consumer<String> lineConsumer;
    private final Runnable onClose;
    private volatile CompletableFuture<String> firstLine;

    InboundLineHandler(String handle, Consumer<String> lineConsumer, Runnable onClose) {
        this.handle = handle;
        this.lineConsumer = lineConsumer;
        this.onClose = onClose;
    }

    /**
     * Captures the next received line instead of dispatching it.
     *
     * @return a future completed with the next line, or failed if the channel closes first
     */
    CompletableFuture<String> awaitFirstLine() {
        CompletableFuture<String> future = new CompletableFuture<>();
        firstLine = future;
        return future;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        CompletableFuture<String> pending = firstLine;
        if (pending != null) {
            firstLine = null;
            pending.complete(line);
            return;
        }
        lineConsumer.accept(line);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        CompletableFuture<String> pending = firstLine;
        if (pending != null) {
            firstLine = null;
            pending.completeExceptionally(new OocsiNotConnectedException("Connection closed by server"));
        }
        onClose.run();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IOException) {
            log.warn("[{}]: connection error: {}", handle, cause.getMessage());
            ctx.close();
            return;
        }
        // Handler and responder failures end the dispatch of one event, not the connection
        log.error("[{}]: failed to dispatch event", handle, cause);
    }
}
