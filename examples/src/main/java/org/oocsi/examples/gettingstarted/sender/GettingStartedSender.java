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

package org.oocsi.examples.gettingstarted.sender;

import org.oocsi.Oocsi;
import org.oocsi.client.blocking.tcp.OocsiTcpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

public final class GettingStartedSender {

    private static final String CHANNEL = "testchannel";
    private static final int EVENTS_LIMIT = 20;
    private static final long INTERVAL_MS = 500;

    private static final Logger log = LoggerFactory.getLogger(GettingStartedSender.class);

    private GettingStartedSender() {}

    public static void main(String[] args) {
        log.info("Starting with {}", Oocsi.versionInfo());
        try (OocsiTcpClient client = Oocsi.tcpClientBuilder()
                .blocking()
                .host("localhost")
                .port(4444)
                .handle("sender_###")
                .buildAndConnect()) {
            if (!client.isConnected()) {
                log.error("Could not connect to the OOCSI server, exiting.");
                return;
            }
            sendEvents(client);
        }
    }

    private static void sendEvents(OocsiTcpClient client) {
        log.info("Events will be sent to channel: {} with interval {}ms.", CHANNEL, INTERVAL_MS);

        for (int i = 0; i < EVENTS_LIMIT && client.isConnected(); i++) {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("count", i);
            event.put("color", ThreadLocalRandom.current().nextInt(255));
            event.put("position", ThreadLocalRandom.current().nextDouble());
            client.publish(CHANNEL, event);
            log.info("Sent event {}", event);

            try {
                // Keep-alives are only answered while pumping
                client.pump();
                Thread.sleep(INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
