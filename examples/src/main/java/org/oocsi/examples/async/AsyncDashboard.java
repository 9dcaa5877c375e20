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

package org.oocsi.examples.async;

import org.oocsi.Oocsi;
import org.oocsi.client.async.tcp.AsyncOocsiTcpClient;
import org.oocsi.device.LedType;
import org.oocsi.device.Spectrum;
import org.oocsi.variable.OocsiVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * AsyncDashboard demonstrates the async client: events are handled on the client's event loop while the main
 * thread issues calls and updates a shared variable.
 */
public final class AsyncDashboard {
    private static final Logger log = LoggerFactory.getLogger(AsyncDashboard.class);

    private static final String HOST = "localhost";
    private static final int PORT = 4444;

    private AsyncDashboard() {}

    public static void main(String[] args) throws Exception {
        log.info("Connecting to OOCSI server at {}:{}...", HOST, PORT);
        AsyncOocsiTcpClient client = Oocsi.tcpClientBuilder()
                .async()
                .host(HOST)
                .port(PORT)
                .handle("dashboard_###")
                .buildAndConnect()
                .get(10, TimeUnit.SECONDS);

        try {
            if (!client.isConnected()) {
                log.error("Could not connect to the OOCSI server, exiting.");
                return;
            }

            client.heyOocsi()
                    .addProperty("owner", "studio")
                    .addLight("status", "dashboard_status", LedType.RGB, Spectrum.RGB)
                    .submit();

            client.subscribe("testchannel", (sender, channel, event) -> log.info("{} on {}: {}", sender, channel, event));

            OocsiVariable brightness = client.variable("dashboard_brightness", "value")
                    .min(0)
                    .max(100)
                    .smooth(5);

            for (int i = 0; i < 10; i++) {
                brightness.set(i * 15);
                log.info("Brightness now {}", brightness.get());
                Thread.sleep(500);
            }

            client.callAndWait("timeservice", "localTime", Map.of("timezone", "UTC"), Duration.ofSeconds(2))
                    .thenAccept(call -> log.info("Call finished as {} with {}", call.getState(), call.getResponse()))
                    .get(5, TimeUnit.SECONDS);
        } finally {
            client.close().get(5, TimeUnit.SECONDS);
        }
    }
}
