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

import org.apache.commons.lang3.StringUtils;
import org.oocsi.config.ReconnectPolicy;
import org.oocsi.exception.OocsiInvalidArgumentException;
import org.oocsi.message.EventHandler;
import org.oocsi.protocol.OocsiLineDecoder;

import java.time.Clock;
import java.time.Duration;

/**
 * Builder for creating configured OocsiTcpClient instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Explicit connect
 * var client = OocsiTcpClient.builder()
 *     .host("oocsi.example.com")
 *     .handle("lamp_##")
 *     .build();
 * client.connect();
 *
 * // Connect right away, retrying every two seconds
 * var client = OocsiTcpClient.builder()
 *     .host("oocsi.example.com")
 *     .reconnectPolicy(ReconnectPolicy.fixedDelay(5, Duration.ofSeconds(2)))
 *     .autoReconnect(true)
 *     .buildAndConnect();
 * }</pre>
 *
 * @see OocsiTcpClient#builder()
 */
public final class OocsiTcpClientBuilder {
    private String host = "localhost";
    private Integer port = 4444;
    private String handle;
    private EventHandler defaultHandler;
    private Duration handshakeTimeout = Duration.ofSeconds(5);
    private int maxLineLength = OocsiLineDecoder.DEFAULT_MAX_LINE_LENGTH;
    private ReconnectPolicy reconnectPolicy = ReconnectPolicy.noReconnect();
    private boolean autoReconnect = false;
    private Clock clock = Clock.systemUTC();

    OocsiTcpClientBuilder() {}

    /**
     * Sets the host address of the OOCSI server.
     *
     * @param host the host address
     * @return this builder
     */
    public OocsiTcpClientBuilder host(String host) {
        this.host = host;
        return this;
    }

    /**
     * Sets the port of the OOCSI server.
     *
     * @param port the port number
     * @return this builder
     */
    public OocsiTcpClientBuilder port(Integer port) {
        this.port = port;
        return this;
    }

    /**
     * Sets the handle of the client. Every {@code #} is replaced with a random digit.
     *
     * @param handle the handle template
     * @return this builder
     */
    public OocsiTcpClientBuilder handle(String handle) {
        this.handle = handle;
        return this;
    }

    /**
     * Sets the handler receiving events sent directly to the client handle.
     *
     * @param defaultHandler the handler
     * @return this builder
     */
    public OocsiTcpClientBuilder defaultHandler(EventHandler defaultHandler) {
        this.defaultHandler = defaultHandler;
        return this;
    }

    /**
     * Sets how long connecting and waiting for the handshake response may take.
     *
     * @param handshakeTimeout the timeout
     * @return this builder
     */
    public OocsiTcpClientBuilder handshakeTimeout(Duration handshakeTimeout) {
        this.handshakeTimeout = handshakeTimeout;
        return this;
    }

    /**
     * Sets the longest line accepted from the server; longer lines are discarded.
     *
     * @param maxLineLength the maximum line length in bytes
     * @return this builder
     */
    public OocsiTcpClientBuilder maxLineLength(int maxLineLength) {
        this.maxLineLength = maxLineLength;
        return this;
    }

    /**
     * Sets the reconnect policy applied by {@link OocsiTcpClient#connect()}.
     *
     * @param reconnectPolicy the policy
     * @return this builder
     */
    public OocsiTcpClientBuilder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
        this.reconnectPolicy = reconnectPolicy;
        return this;
    }

    /**
     * Makes {@link OocsiTcpClient#pump()} connect again when the connection was lost.
     *
     * @param autoReconnect whether to reconnect automatically
     * @return this builder
     */
    public OocsiTcpClientBuilder autoReconnect(boolean autoReconnect) {
        this.autoReconnect = autoReconnect;
        return this;
    }

    OocsiTcpClientBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Builds and returns a configured OocsiTcpClient instance.
     * Note: You still need to call {@link OocsiTcpClient#connect()} on the returned client.
     *
     * @return a new OocsiTcpClient instance
     * @throws OocsiInvalidArgumentException if a setting is invalid
     */
    public OocsiTcpClient build() {
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
        return new OocsiTcpClient(
                host,
                port,
                handle,
                defaultHandler,
                handshakeTimeout,
                maxLineLength,
                reconnectPolicy,
                autoReconnect,
                clock);
    }

    /**
     * Builds the client and connects it.
     * Connection failures are logged; check {@link OocsiTcpClient#isConnected()} on the result.
     *
     * @return a new OocsiTcpClient instance after its connection attempts
     */
    public OocsiTcpClient buildAndConnect() {
        OocsiTcpClient client = build();
        client.connect();
        return client;
    }
}
