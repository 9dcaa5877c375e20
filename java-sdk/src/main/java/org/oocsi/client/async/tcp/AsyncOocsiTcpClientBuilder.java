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

import org.apache.commons.lang3.StringUtils;
import org.oocsi.config.ReconnectPolicy;
import org.oocsi.exception.OocsiInvalidArgumentException;
import org.oocsi.message.EventHandler;
import org.oocsi.protocol.OocsiLineDecoder;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Builder for creating configured AsyncOocsiTcpClient instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Explicit connect
 * var client = AsyncOocsiTcpClient.builder()
 *     .host("oocsi.example.com")
 *     .handle("dashboard_###")
 *     .build();
 * client.connect().join();
 *
 * // Connect as part of building
 * var client = AsyncOocsiTcpClient.builder()
 *     .host("oocsi.example.com")
 *     .reconnectPolicy(ReconnectPolicy.fixedDelay(3, Duration.ofSeconds(1)))
 *     .buildAndConnect()
 *     .join();
 * }</pre>
 *
 * @see AsyncOocsiTcpClient#builder()
 */
public final class AsyncOocsiTcpClientBuilder {
    private String host = "localhost";
    private Integer port = 4444;
    private String handle;
    private EventHandler defaultHandler;
    private Duration handshakeTimeout = Duration.ofSeconds(5);
    private int maxLineLength = OocsiLineDecoder.DEFAULT_MAX_LINE_LENGTH;
    private ReconnectPolicy reconnectPolicy = ReconnectPolicy.noReconnect();
    private Clock clock = Clock.systemUTC();

    AsyncOocsiTcpClientBuilder() {}

    /**
     * Sets the host address of the OOCSI server.
     *
     * @param host the host address
     * @return this builder
     */
    public AsyncOocsiTcpClientBuilder host(String host) {
        this.host = host;
        return this;
    }

    /**
     * Sets the port of the OOCSI server.
     *
     * @param port the port number
     * @return this builder
     */
    public AsyncOocsiTcpClientBuilder port(Integer port) {
        this.port = port;
        return this;
    }

    /**
     * Sets the handle of the client. Every {@code #} is replaced with a random digit.
     *
     * @param handle the handle template
     * @return this builder
     */
    public AsyncOocsiTcpClientBuilder handle(String handle) {
        this.handle = handle;
        return this;
    }

    public AsyncOocsiTcpClientBuilder defaultHandler(EventHandler defaultHandler) {
        this.defaultHandler = defaultHandler;
        return this;
    }

    public AsyncOocsiTcpClientBuilder handshakeTimeout(Duration handshakeTimeout) {
        this.handshakeTimeout = handshakeTimeout;
        return this;
    }

    public AsyncOocsiTcpClientBuilder maxLineLength(int maxLineLength) {
        this.maxLineLength = maxLineLength;
        return this;
    }

    public AsyncOocsiTcpClientBuilder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
        this.reconnectPolicy = reconnectPolicy;
        return this;
    }

    AsyncOocsiTcpClientBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Builds and returns a configured AsyncOocsiTcpClient instance.
     * Note: You still need to call {@link AsyncOocsiTcpClient#connect()} on the returned client.
     *
     * @return a new AsyncOocsiTcpClient instance
     * @throws OocsiInvalidArgumentException if a setting is invalid
     */
    public AsyncOocsiTcpClient build() {
        if (host == null || host.isEmpty()) {
            throw new OocsiInvalidArgumentException("Host cannot be null or empty");
        }
        if (port == null || port <= 0) {
            throw new OocsiInvalidArgumentException("Port must be a positive integer");
        }
        if (StringUtils.containsWhitespace(handle)) {
            throw new OocsiInvalidArgumentException("Handle cannot contain whitespace: '" + handle + "'");
        }
        if (handshakeTimeout == null || handshakeTimeout.isZero() || handshakeTimeout.isNegative()) {
            throw new OocsiInvalidArgumentException("Handshake timeout must be positive");
        }
        if (maxLineLength <= 0) {
            throw new OocsiInvalidArgumentException("Max line length must be positive");
        }
        if (reconnectPolicy == null) {
            throw new OocsiInvalidArgumentException("Reconnect policy cannot be null");
        }
        return new AsyncOocsiTcpClient(
                host, port, handle, defaultHandler, handshakeTimeout, maxLineLength, reconnectPolicy, clock);
    }

    /**
     * Builds the client and connects it.
     *
     * @return a future completed with the client once its connection attempts are over
     */
    public CompletableFuture<AsyncOocsiTcpClient> buildAndConnect() {
        AsyncOocsiTcpClient client = build();
        return client.connect().thenApply(state -> client);
    }
}
