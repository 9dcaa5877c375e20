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

package org.oocsi.examples.gettingstarted.receiver;

import org.oocsi.client.blocking.tcp.OocsiTcpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class GettingStartedReceiver {

    private static final String CHANNEL = "testchannel";
    private static final int EVENTS_LIMIT = 20;
    private static final long INTERVAL_MS = 100;

    private static final Logger log = LoggerFactory.getLogger(GettingStartedReceiver.class);

    private static int receivedEvents;

    private GettingStartedReceiver() {}

    public static void main(String[] args) {
        try (var client = OocsiTcpClient.builder()
                .host("localhost")
                .port(4444)
                .handle("receiver_###")
                .buildAndConnect()) {
            if (!client.isConnected()) {
                log.error("Could not connect to the OOCSI server, exiting.");
                return;
            }
            client.subscribe(CHANNEL, GettingStartedReceiver::handleEvent);
            receiveEvents(client);
        }
    }

    private static void receiveEvents(OocsiTcpClient client) {
        log.info("Events will be received from channel: {} with interval {}ms.", CHANNEL, INTERVAL_MS);

        while (client.isConnected()) {
            if (receivedEvents >= EVENTS_LIMIT) {
                log.info("Received {} events, exiting.", receivedEvents);
                return;
            }
            client.pump();
            try {
                Thread.sleep(INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        log.warn("Connection lost after {} events.", receivedEvents);
    }

    private static void handleEvent(String sender, String channel, Map<String, Object> event) {
        receivedEvents++;
        log.info("Handling event from {} on {}: {}", sender, channel, event);
    }
}
