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

import org.oocsi.call.PendingCall;
import org.oocsi.client.OocsiClient;
import org.oocsi.config.ReconnectPolicy;
import org.oocsi.message.EventHandler;
import org.oocsi.message.Responder;
import org.oocsi.protocol.Command;
import org.oocsi.protocol.HandshakeResponse;
import org.oocsi.session.ConnectionState;
import org.oocsi.session.Handles;
import org.oocsi.session.OocsiSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Blocking OOCSI client.
 *
 * <p>The owning thread drives the client: {@link #connect()} blocks until the handshake completes or fails, and
 * {@link #pump()} dispatches the lines received since the previous call. Handlers and responders run on the thread
 * that calls {@code pump()} or {@link #callAndWait(String, String, Map, Duration)}.
 *
 * <pre>{@code
 * var client = OocsiTcpClient.builder()
 *     .host("localhost")
 *     .handle("sensor_###")
 *     .buildAndConnect();
 * client.subscribe("temperature", (sender, channel, event) -> log.info("{}: {}", sender, event));
 * while (client.isConnected()) {
 *     client.pump();
 *     Thread.sleep(100);
 * }
 * }</pre>
 */
public class OocsiTcpClient implements OocsiClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OocsiTcpClient.class);

    private final String host;
    private final int port;
    private final Duration handshakeTimeout;
    private final int maxLineLength;
    private final ReconnectPolicy reconnectPolicy;
    private final boolean autoReconnect;
    private final OocsiSession session;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile InternalTcpClient transport;
    private volatile boolean reconnectEnabled = true;

    @SuppressWarnings("checkstyle:ParameterNumber")
    OocsiTcpClient(
            String host,
            int port,
            String handle,
            EventHandler defaultHandler,
            Duration handshakeTimeout,
            int maxLineLength,
            ReconnectPolicy reconnectPolicy,
            boolean autoReconnect,
            Clock clock) {
        this.host = host;
        this.port = port;
        this.handshakeTimeout = handshakeTimeout;
        this.maxLineLength = maxLineLength;
        this.reconnectPolicy = reconnectPolicy;
        this.autoReconnect = autoReconnect;
        this.session = new OocsiSession(Handles.resolve(handle), defaultHandler, clock, this::writeLine);
    }

    /**
     * Creates a new builder for configuring OocsiTcpClient.
     *
     * @return a new builder instance
     */
    public static OocsiTcpClientBuilder builder() {
        return new OocsiTcpClientBuilder();
    }

    /**
     * Connects to the server and performs the handshake, blocking until it succeeds or fails.
     *
     * <p>Failures are logged and leave the client disconnected; no exception is thrown. Attempts are repeated as
     * the reconnect policy allows, unless the server rejects the handshake. Calling this while connected keeps the
     * open connection.
     *
     * @return the connection state after the last attempt
     */
    public ConnectionState connect() {
        if (transport != null) {
            log.debug("[{}]: already connected", getHandle());
            return state;
        }
        reconnectEnabled = true;
        int attempt = 0;
        while (!attemptConnect()) {
            if (!reconnectEnabled || attempt >= reconnectPolicy.getMaxAttempts()) {
                break;
            }
            attempt++;
            log.info(
                    "[{}]: reconnecting in {} ms (attempt {}/{})",
                    getHandle(),
                    reconnectPolicy.getDelay().toMillis(),
                    attempt,
                    reconnectPolicy.getMaxAttempts());
            try {
                Thread.sleep(reconnectPolicy.getDelay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return state;
    }

    private boolean attemptConnect() {
        state = ConnectionState.CONNECTING;
        log.info("[{}]: connecting to {} port {}", getHandle(), host, port);
        var tcpClient = new InternalTcpClient(host, port, maxLineLength, handshakeTimeout);
        try {
            tcpClient.connect();
            tcpClient.send(Command.handshake(getHandle()));
            InternalTcpClient.InboundLine response = tcpClient.poll(handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS);
            String line = response == null ? null : response.line();

            switch (HandshakeResponse.of(line)) {
                case ACCEPTED -> {
                    transport = tcpClient;
                    session.replaySubscriptions();
                    if (transport == tcpClient) {
                        state = ConnectionState.CONNECTED;
                        log.info("[{}]: connection established", getHandle());
                        return true;
                    }
                    return false;
                }
                case REJECTED -> {
                    log.error("[{}]: handshake rejected by server: {}", getHandle(), line);
                    reconnectEnabled = false;
                }
                case UNEXPECTED -> log.warn(
                        "[{}]: no valid handshake response from {} port {}: {}", getHandle(), host, port, line);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.warn("[{}]: connection to {} port {} failed: {}", getHandle(), host, port, e.getMessage());
        }
        tcpClient.close();
        if (transport == tcpClient) {
            transport = null;
        }
        state = ConnectionState.DISCONNECTED;
        return false;
    }

    /**
     * Dispatches every line received since the previous call, without blocking.
     *
     * <p>An exception thrown by a handler or responder propagates to the caller; lines not yet dispatched stay
     * queued for the next call. When the server closed the connection, the client becomes disconnected and the
     * remaining lines of that connection are not dispatched.
     */
    public void pump() {
        session.calls().purgeExpired();
        InternalTcpClient tcpClient = transport;
        if (tcpClient == null) {
            reconnectIfEnabled();
            return;
        }
        InternalTcpClient.InboundLine next;
        while (transport == tcpClient && (next = tcpClient.poll()) != null) {
            if (next.isClosed()) {
                connectionLost(tcpClient, next.error());
                break;
            }
            session.receive(next.line());
        }
    }

    /**
     * Issues a call and waits for its response, dispatching received lines while waiting.
     *
     * <p>Returns when the call is fulfilled, the timeout elapses or the connection is lost. A call that is not
     * fulfilled on return is expired, so a late response is dropped.
     *
     * @param channel  the channel the responder listens on
     * @param callName the call name
     * @param data     the call arguments
     * @param timeout  how long to wait for the response
     * @return the call, fulfilled or expired
     */
    public PendingCall callAndWait(String channel, String callName, Map<String, ?> data, Duration timeout) {
        PendingCall call = call(channel, callName, data, timeout);
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (!call.isFulfilled()) {
                long remaining = deadline - System.nanoTime();
                InternalTcpClient tcpClient = transport;
                if (remaining <= 0 || tcpClient == null) {
                    break;
                }
                InternalTcpClient.InboundLine next = tcpClient.poll(remaining, TimeUnit.NANOSECONDS);
                if (next == null) {
                    break;
                }
                if (next.isClosed()) {
                    connectionLost(tcpClient, next.error());
                    break;
                }
                session.receive(next.line());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!call.isFulfilled()) {
            session.calls().expire(call.getId());
        }
        return call;
    }

    public PendingCall callAndWait(String channel, String callName, Map<String, ?> data) {
        return callAndWait(channel, callName, data, DEFAULT_CALL_TIMEOUT);
    }

    @Override
    public String getHandle() {
        return session.getHandle();
    }

    @Override
    public ConnectionState getState() {
        return state;
    }

    @Override
    public void publish(String channel, Map<String, ?> data) {
        session.publish(channel, data);
    }

    @Override
    public void subscribe(String channel, EventHandler handler) {
        session.subscribe(channel, handler);
    }

    @Override
    public void unsubscribe(String channel) {
        session.unsubscribe(channel);
    }

    @Override
    public void register(String channel, String callName, Responder responder) {
        session.register(channel, callName, responder);
    }

    @Override
    public PendingCall call(String channel, String callName, Map<String, ?> data, Duration timeout) {
        return session.call(channel, callName, data, timeout);
    }

    @Override
    public void stop() {
        reconnectEnabled = false;
        InternalTcpClient tcpClient = transport;
        if (tcpClient != null) {
            writeLine(Command.QUIT.format());
            transport = null;
            tcpClient.close();
            log.info("[{}]: disconnected", getHandle());
        }
        state = ConnectionState.DISCONNECTED;
    }

    @Override
    public void close() {
        stop();
    }

    OocsiSession session() {
        return session;
    }

    private void writeLine(String line) {
        InternalTcpClient tcpClient = transport;
        if (tcpClient == null) {
            log.debug("[{}]: not connected, dropping: {}", getHandle(), line);
            return;
        }
        try {
            tcpClient.send(line);
        } catch (RuntimeException e) {
            log.warn("[{}]: failed to send, closing connection: {}", getHandle(), e.getMessage());
            connectionLost(tcpClient, e);
        }
    }

    private void connectionLost(InternalTcpClient tcpClient, Throwable cause) {
        if (transport != tcpClient) {
            return;
        }
        transport = null;
        state = ConnectionState.DISCONNECTED;
        if (cause == null) {
            log.warn("[{}]: connection closed by server", getHandle());
        } else {
            log.warn("[{}]: connection lost: {}", getHandle(), cause.getMessage());
        }
        tcpClient.close();
    }

    private void reconnectIfEnabled() {
        if (autoReconnect && reconnectEnabled && state == ConnectionState.DISCONNECTED) {
            connect();
        }
    }
}
