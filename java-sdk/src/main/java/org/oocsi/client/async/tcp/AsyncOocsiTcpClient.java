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

import org.oocsi.call.PendingCall;
import org.oocsi.client.OocsiClient;
import org.oocsi.config.ReconnectPolicy;
import org.oocsi.exception.OocsiClientException;
import org.oocsi.exception.OocsiHandshakeException;
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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Async OOCSI client using Netty.
 *
 * <p>Received lines are dispatched on the single event-loop thread of the connection, so handlers and responders
 * never run concurrently with each other. Waiting operations return futures instead of blocking.
 *
 * <pre>{@code
 * var client = AsyncOocsiTcpClient.builder()
 *     .host("localhost")
 *     .handle("dashboard_###")
 *     .build();
 * client.connect().join();
 * client.subscribe("temperature", (sender, channel, event) -> log.info("{}: {}", sender, event));
 * client.callAndWait("clock", "time", Map.of(), Duration.ofSeconds(2))
 *     .thenAccept(call -> call.getResponse().ifPresent(response -> log.info("time: {}", response)));
 * }</pre>
 */
public class AsyncOocsiTcpClient implements OocsiClient {
    private static final Logger log = LoggerFactory.getLogger(AsyncOocsiTcpClient.class);

    private final String host;
    private final int port;
    private final Duration handshakeTimeout;
    private final int maxLineLength;
    private final ReconnectPolicy reconnectPolicy;
    private final OocsiSession session;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile AsyncTcpConnection connection;
    private volatile boolean reconnectEnabled = true;

    @SuppressWarnings("checkstyle:ParameterNumber")
    AsyncOocsiTcpClient(
            String host,
            int port,
            String handle,
            EventHandler defaultHandler,
            Duration handshakeTimeout,
            int maxLineLength,
            ReconnectPolicy reconnectPolicy,
            Clock clock) {
        this.host = host;
        this.port = port;
        this.handshakeTimeout = handshakeTimeout;
        this.maxLineLength = maxLineLength;
        this.reconnectPolicy = reconnectPolicy;
        this.session = new OocsiSession(Handles.resolve(handle), defaultHandler, clock, this::writeLine);
    }

    /**
     * Creates a new builder for configuring AsyncOocsiTcpClient.
     *
     * @return a new builder instance
     */
    public static AsyncOocsiTcpClientBuilder builder() {
        return new AsyncOocsiTcpClientBuilder();
    }

    /**
     * Connects to the server and performs the handshake.
     *
     * <p>The returned future never fails: connection errors are logged and complete it with
     * {@link ConnectionState#DISCONNECTED} once the reconnect policy gives up. Calling this while connected keeps
     * the open connection.
     *
     * @return a future completed with the connection state after the last attempt
     */
    public CompletableFuture<ConnectionState> connect() {
        if (connection != null) {
            log.debug("[{}]: already connected", getHandle());
            return CompletableFuture.completedFuture(state);
        }
        reconnectEnabled = true;
        return attempt(0);
    }

    private CompletableFuture<ConnectionState> attempt(int attempt) {
        state = ConnectionState.CONNECTING;
        log.info("[{}]: connecting to {} port {}", getHandle(), host, port);
        var conn = new AsyncTcpConnection(
                host, port, maxLineLength, handshakeTimeout, getHandle(), session::receive, this::connectionLost);
        return conn.connect()
                .thenCompose(v -> conn.handshake(Command.handshake(getHandle()), handshakeTimeout))
                .thenApply(response -> accept(conn, response))
                .exceptionallyCompose(error -> retry(conn, error, attempt));
    }

    private ConnectionState accept(AsyncTcpConnection conn, String response) {
        switch (HandshakeResponse.of(response)) {
            case ACCEPTED -> {
                connection = conn;
                session.replaySubscriptions();
                state = ConnectionState.CONNECTED;
                log.info("[{}]: connection established", getHandle());
                return state;
            }
            case REJECTED -> throw new OocsiHandshakeException(response);
            default -> throw new OocsiClientException("Unexpected handshake response: " + response);
        }
    }

    private CompletableFuture<ConnectionState> retry(AsyncTcpConnection conn, Throwable error, int attempt) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (connection == conn) {
            connection = null;
        }
        conn.close();
        state = ConnectionState.DISCONNECTED;

        if (cause instanceof OocsiHandshakeException rejection) {
            log.error("[{}]: {}", getHandle(), rejection.getMessage());
            reconnectEnabled = false;
            return CompletableFuture.completedFuture(state);
        }
        log.warn("[{}]: connection to {} port {} failed: {}", getHandle(), host, port, cause.toString());
        if (!reconnectEnabled || attempt >= reconnectPolicy.getMaxAttempts()) {
            return CompletableFuture.completedFuture(state);
        }

        int next = attempt + 1;
        log.info(
                "[{}]: reconnecting in {} ms (attempt {}/{})",
                getHandle(),
                reconnectPolicy.getDelay().toMillis(),
                next,
                reconnectPolicy.getMaxAttempts());
        Executor delayed =
                CompletableFuture.delayedExecutor(reconnectPolicy.getDelay().toMillis(), TimeUnit.MILLISECONDS);
        return CompletableFuture.supplyAsync(() -> next, delayed).thenCompose(this::attempt);
    }

    /**
     * Issues a call and completes when it is fulfilled or its timeout elapses.
     *
     * <p>The future completes normally in both cases; a call that is not fulfilled by then is expired, so a late
     * response is dropped.
     *
     * @param channel  the channel the responder listens on
     * @param callName the call name
     * @param data     the call arguments
     * @param timeout  how long to wait for the response
     * @return a future completed with the call, fulfilled or expired
     */
    public CompletableFuture<PendingCall> callAndWait(
            String channel, String callName, Map<String, ?> data, Duration timeout) {
        PendingCall call = call(channel, callName, data, timeout);
        return call.completion()
                .completeOnTimeout(call, timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, error) -> {
                    if (!call.isFulfilled()) {
                        session.calls().expire(call.getId());
                    }
                });
    }

    public CompletableFuture<PendingCall> callAndWait(String channel, String callName, Map<String, ?> data) {
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
        session.calls().purgeExpired();
        return session.call(channel, callName, data, timeout);
    }

    @Override
    public void stop() {
        close();
    }

    /**
     * Sends {@code quit}, closes the connection and releases its event loop.
     *
     * @return a future completed once the channel is closed
     */
    public CompletableFuture<Void> close() {
        reconnectEnabled = false;
        state = ConnectionState.DISCONNECTED;
        AsyncTcpConnection conn = connection;
        if (conn == null) {
            return CompletableFuture.completedFuture(null);
        }
        connection = null;
        conn.send(Command.QUIT.format());
        log.info("[{}]: disconnected", getHandle());
        return conn.close();
    }

    OocsiSession session() {
        return session;
    }

    private void writeLine(String line) {
        AsyncTcpConnection conn = connection;
        if (conn == null) {
            log.debug("[{}]: not connected, dropping: {}", getHandle(), line);
            return;
        }
        conn.send(line).exceptionally(error -> {
            log.warn("[{}]: failed to send, closing connection: {}", getHandle(), error.getMessage());
            connectionLost(conn);
            return null;
        });
    }

    private void connectionLost(AsyncTcpConnection conn) {
        if (connection != conn) {
            return;
        }
        connection = null;
        state = ConnectionState.DISCONNECTED;
        log.warn("[{}]: connection closed", getHandle());
        conn.close();
    }
}
