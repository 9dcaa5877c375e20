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

package org.oocsi.client.blocking.tcp;

import io.netty.channel.ChannelOption;
import org.oocsi.exception.OocsiNotConnectedException;
import org.oocsi.protocol.OocsiLineDecoder;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.tcp.TcpClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One TCP connection of the blocking client.
 *
 * <p>Lines are decoded on the Reactor Netty I/O thread and queued; the owner of the client drains the queue on its
 * own thread. The end of the connection is queued behind the lines received before it.
 */
final class InternalTcpClient {

    private final TcpClient client;
    private final Duration connectTimeout;
    private final BlockingQueue<InboundLine> lines = new LinkedBlockingQueue<>();
    private Connection connection;

    InternalTcpClient(String host, int port, int maxLineLength, Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        this.client = TcpClient.create()
                .host(host)
                .port(port)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .doOnConnected(conn -> conn.addHandlerLast(new OocsiLineDecoder(maxLineLength)));
    }

    void connect() {
        this.connection = client.connectNow(connectTimeout);
        this.connection
                .inbound()
                .receiveObject()
                .ofType(String.class)
                .subscribe(
                        line -> lines.add(InboundLine.of(line)),
                        error -> lines.add(InboundLine.closed(error)),
                        () -> lines.add(InboundLine.closed(null)));
    }

    void send(String line) {
        if (connection == null || connection.isDisposed()) {
            throw new OocsiNotConnectedException();
        }
        connection
                .outbound()
                .sendString(Mono.just(line + "\n"), StandardCharsets.UTF_8)
                .then()
                .block(connectTimeout);
    }

    /**
     * Takes the next queued line without waiting.
     *
     * @return the next line, or null when nothing was received
     */
    InboundLine poll() {
        return lines.poll();
    }

    InboundLine poll(long timeout, TimeUnit unit) throws InterruptedException {
        return lines.poll(timeout, unit);
    }

    void close() {
        if (connection != null && !connection.isDisposed()) {
            connection.disposeNow(connectTimeout);
        }
    }

    /**
     * A received line, or the end of the connection when {@code line} is null.
     */
    record InboundLine(String line, Throwable error) {

        static InboundLine of(String line) {
            return new InboundLine(line, null);
        }

        static InboundLine closed(Throwable error) {
            return new InboundLine(null, error);
        }

        boolean isClosed() {
            return line == null;
        }
    }
}
