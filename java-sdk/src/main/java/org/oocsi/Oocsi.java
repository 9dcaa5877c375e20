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

package org.oocsi;

import org.oocsi.builder.TcpClientBuilder;

/**
 * Main entry point for creating OOCSI clients.
 *
 * <h2>TCP Clients</h2>
 * <pre>{@code
 * // Blocking TCP client
 * var client = Oocsi.tcpClientBuilder().blocking()
 *     .host("localhost")
 *     .port(4444)
 *     .handle("lamp_##")
 *     .build();
 * client.connect();
 * client.publish("lamps", Map.of("brightness", 80));
 *
 * // Async TCP client
 * var asyncClient = Oocsi.tcpClientBuilder().async()
 *     .host("localhost")
 *     .build();
 * asyncClient.connect().join();
 * }</pre>
 *
 * <h2>Version Information</h2>
 * <pre>{@code
 * String version = Oocsi.version();           // e.g., "1.0.0"
 * OocsiVersion info = Oocsi.versionInfo();    // Full version details
 * }</pre>
 *
 * @see org.oocsi.builder.TcpClientBuilder
 * @see OocsiVersion
 */
public final class Oocsi {

    private Oocsi() {}

    /**
     * Creates a builder for TCP clients.
     *
     * @return a TCP client builder
     */
    public static TcpClientBuilder tcpClientBuilder() {
        return new TcpClientBuilder();
    }

    /**
     * Returns the SDK version string.
     *
     * @return the version string (e.g., "1.0.0")
     */
    public static String version() {
        return OocsiVersion.getInstance().getVersion();
    }

    /**
     * Returns detailed version information.
     *
     * @return the version information object
     */
    public static OocsiVersion versionInfo() {
        return OocsiVersion.getInstance();
    }
}
