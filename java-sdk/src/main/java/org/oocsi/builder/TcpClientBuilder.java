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

package org.oocsi.builder;

import org.oocsi.client.async.tcp.AsyncOocsiTcpClient;
import org.oocsi.client.async.tcp.AsyncOocsiTcpClientBuilder;
import org.oocsi.client.blocking.tcp.OocsiTcpClient;
import org.oocsi.client.blocking.tcp.OocsiTcpClientBuilder;

/**
 * Entry point for building TCP clients.
 *
 * <p>Use this builder to choose between blocking and async TCP clients:
 * <pre>{@code
 * // Blocking TCP client, events are dispatched from pump()
 * var client = Oocsi.tcpClientBuilder().blocking()
 *     .host("localhost")
 *     .handle("sensor_##")
 *     .buildAndConnect();
 * client.subscribe("commands", (sender, channel, event) -> handle(event));
 * while (running) {
 *     client.pump(Duration.ofMillis(100));
 * }
 *
 * // Async TCP client, events are dispatched on the event loop
 * var asyncClient = Oocsi.tcpClientBuilder().async()
 *     .host("localhost")
 *     .buildAndConnect()
 *     .join();
 * }</pre>
 *
 * @see OocsiTcpClientBuilder
 * @see AsyncOocsiTcpClientBuilder
 */
public final class TcpClientBuilder {

    public TcpClientBuilder() {}

    /**
     * Returns a builder for creating a blocking TCP client.
     *
     * @return a new OocsiTcpClientBuilder instance
     */
    public OocsiTcpClientBuilder blocking() {
        return OocsiTcpClient.builder();
    }

    /**
     * Returns a builder for creating an async TCP client.
     *
     * @return a new AsyncOocsiTcpClientBuilder instance
     */
    public AsyncOocsiTcpClientBuilder async() {
        return AsyncOocsiTcpClient.builder();
    }
}
