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

import org.junit.jupiter.api.Test;
import org.oocsi.exception.OocsiInvalidArgumentException;
import org.oocsi.session.ConnectionState;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsyncOocsiTcpClientBuilderTest {

    @Test
    void shouldBuildDisconnectedClient() {
        // when
        AsyncOocsiTcpClient client =
                AsyncOocsiTcpClient.builder().handle("dashboard_#").build();

        // then
        assertThat(client.getHandle()).matches("dashboard_\\d");
        assertThat(client.getState()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void shouldThrowExceptionForNullHost() {
        assertThatThrownBy(() -> AsyncOocsiTcpClient.builder().host(null).build())
                .isInstanceOf(OocsiInvalidArgumentException.class)
                .hasMessage("Host cannot be null or empty");
    }

    @Test
    void shouldThrowExceptionForNegativePort() {
        assertThatThrownBy(() -> AsyncOocsiTcpClient.builder().port(-1).build())
                .isInstanceOf(OocsiInvalidArgumentException.class)
                .hasMessage("Port must be a positive integer");
    }

    @Test
    void shouldThrowExceptionForHandleWithWhitespace() {
        assertThatThrownBy(() -> AsyncOocsiTcpClient.builder().handle("dash board").build())
                .isInstanceOf(OocsiInvalidArgumentException.class)
                .hasMessage("Handle cannot contain whitespace: 'dash board'");
    }

    @Test
    void shouldThrowExceptionForNegativeHandshakeTimeout() {
        assertThatThrownBy(() -> AsyncOocsiTcpClient.builder()
                        .handshakeTimeout(Duration.ofSeconds(-1))
                        .build())
                .isInstanceOf(OocsiInvalidArgumentException.class)
                .hasMessage("Handshake timeout must be positive");
    }

    @Test
    void shouldCompleteCloseOfUnconnectedClient() {
        AsyncOocsiTcpClient client = AsyncOocsiTcpClient.builder().build();

        assertThat(client.close()).isCompleted();
    }
}
