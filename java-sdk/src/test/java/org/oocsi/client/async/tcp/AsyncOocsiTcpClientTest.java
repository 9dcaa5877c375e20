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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.oocsi.call.CallState;
import org.oocsi.call.PendingCall;
import org.oocsi.config.ReconnectPolicy;
import org.oocsi.session.ConnectionState;
import org.oocsi.testing.FakeOocsiServer;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.oocsi.testing.Conditions.await;

class AsyncOocsiTcpClientTest {

    private static final Pattern MESSAGE_ID = Pattern.compile("\"_MESSAGE_ID\":\"([^\"]+)\"");

    private FakeOocsiServer server;
    private AsyncOocsiTcpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new FakeOocsiServer();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (client != null) {
            client.close().get(5, TimeUnit.SECONDS);
        }
        server.close();
    }

    private AsyncOocsiTcpClientBuilder clientBuilder() {
        return AsyncOocsiTcpClient.builder()
                .host("127.0.0.1")
                .port(server.port())
                .handle("dashboard_##")
                .handshakeTimeout(Duration.ofSeconds(2));
    }

    @Test
    void shouldConnectAndSubscribeToHandle() throws Exception {
        // given
        client = clientBuilder().build();

        // when
        ConnectionState state = client.connect().get(5, TimeUnit.SECONDS);

        // then
        assertThat(state).isEqualTo(ConnectionState.CONNECTED);
        assertThat(server.awaitHandshake()).isEqualTo(client.getHandle() + "(JSON)");
        assertThat(server.awaitLine()).isEqualTo("subscribe " + client.getHandle());
    }

    @Test
    void shouldCompleteDisconnectedWhenRejected() throws Exception {
        // given
        server.respondToHandshakeWith("error (name already in use)");
        client = clientBuilder()
                .reconnectPolicy(ReconnectPolicy.fixedDelay(3, Duration.ofMillis(10)))
                .build();

        // when
        ConnectionState state = client.connect().get(5, TimeUnit.SECONDS);

        // then
        assertThat(state).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(client.isConnected()).isFalse();
        assertThat(server.handshakeCount()).isEqualTo(1);
    }

    @Test
    void shouldKeepExistingConnectionWhenConnectingAgain() throws Exception {
        // given
        List<Map<String, Object>> events = new CopyOnWriteArrayList<>();
        client = clientBuilder().buildAndConnect().get(5, TimeUnit.SECONDS);
        client.subscribe("lamps", (sender, recipient, event) -> events.add(event));
        assertThat(server.awaitLineStartingWith("subscribe lamps")).isNotNull();

        // when
        ConnectionState state = client.connect().get(5, TimeUnit.SECONDS);
        server.send("{\"sender\":\"switch_1\",\"recipient\":\"lamps\",\"x\":1}");

        // then
        assertThat(state).isEqualTo(ConnectionState.CONNECTED);
        await(() -> !events.isEmpty());
        assertThat(events).containsExactly(Map.of("x", 1));
        assertThat(client.isConnected()).isTrue();
        assertThat(server.handshakeCount()).isEqualTo(1);
    }

    @Test
    void shouldRetryUntilPolicyIsExhausted() throws Exception {
        // given
        int port = server.port();
        server.close();
        client = AsyncOocsiTcpClient.builder()
                .host("127.0.0.1")
                .port(port)
                .handshakeTimeout(Duration.ofMillis(500))
                .reconnectPolicy(ReconnectPolicy.fixedDelay(2, Duration.ofMillis(20)))
                .build();

        // when
        ConnectionState state = client.connect().get(10, TimeUnit.SECONDS);

        // then
        assertThat(state).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void shouldDispatchEventsOnEventLoop() throws Exception {
        // given
        List<Map<String, Object>> events = new CopyOnWriteArrayList<>();
        client = clientBuilder().buildAndConnect().get(5, TimeUnit.SECONDS);
        client.subscribe("lamps", (sender, recipient, event) -> events.add(event));
        assertThat(server.awaitLineStartingWith("subscribe lamps")).isNotNull();

        // when
        server.send("{\"sender\":\"switch_1\",\"recipient\":\"lamps\",\"x\":1}");

        // then
        await(() -> !events.isEmpty());
        assertThat(events).containsExactly(Map.of("x", 1));
    }

    @Test
    void shouldAnswerKeepAlive() throws Exception {
        // given
        client = clientBuilder().buildAndConnect().get(5, TimeUnit.SECONDS);
        server.awaitLineStartingWith("subscribe");

        // when
        server.send(".");

        // then
        await(() -> server.hasReceived("."));
    }

    @Test
    void shouldBecomeDisconnectedWhenServerCloses() throws Exception {
        // given
        client = clientBuilder().buildAndConnect().get(5, TimeUnit.SECONDS);
        server.awaitLineStartingWith("subscribe");

        // when
        server.disconnectClient();

        // then
        await(() -> client.getState() == ConnectionState.DISCONNECTED);
    }

    @Test
    void shouldCompleteCallWithResponse() throws Exception {
        // given
        client = clientBuilder().buildAndConnect().get(5, TimeUnit.SECONDS);
        server.awaitLineStartingWith("subscribe");

        // when
        var pending = client.callAndWait("clock", "time", Map.of("tz", "CET"), Duration.ofSeconds(3));
        String request = server.awaitLineStartingWith("sendraw clock ");
        Matcher matcher = MESSAGE_ID.matcher(request);
        assertThat(matcher.find()).isTrue();
        server.send("{\"sender\":\"clock_srv\",\"recipient\":\"" + client.getHandle() + "\",\"_MESSAGE_ID\":\""
                + matcher.group(1) + "\",\"hour\":12}");

        // then
        PendingCall call = pending.get(5, TimeUnit.SECONDS);
        assertThat(call.isFulfilled()).isTrue();
        assertThat(call.getResponse()).contains(Map.of("hour", 12));
    }

    @Test
    void shouldExpireCallAfterTimeout() throws Exception {
        // given
        client = clientBuilder().buildAndConnect().get(5, TimeUnit.SECONDS);
        server.awaitLineStartingWith("subscribe");

        // when
        PendingCall call = client.callAndWait("clock", "time", Map.of(), Duration.ofMillis(200))
                .get(5, TimeUnit.SECONDS);

        // then
        assertThat(call.getState()).isEqualTo(CallState.EXPIRED);
    }

    @Test
    void shouldSendQuitOnClose() throws Exception {
        // given
        client = clientBuilder().buildAndConnect().get(5, TimeUnit.SECONDS);
        server.awaitLineStartingWith("subscribe");

        // when
        client.close().get(5, TimeUnit.SECONDS);

        // then
        assertThat(server.awaitLine()).isEqualTo("quit");
        assertThat(client.getState()).isEqualTo(ConnectionState.DISCONNECTED);
    }
}
