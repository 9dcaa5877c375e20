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

package org.oocsi.examples.calls.responder;

import org.oocsi.client.blocking.tcp.OocsiTcpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answers {@code localTime} calls on the {@code timeservice} channel with the current time in the requested zone.
 */
public final class ClockResponder {

    private static final String CHANNEL = "timeservice";
    private static final String CALL_NAME = "localTime";

    private static final Logger log = LoggerFactory.getLogger(ClockResponder.class);

    private ClockResponder() {}

    public static void main(String[] args) throws InterruptedException {
        try (var client = OocsiTcpClient.builder().handle("clock_##").buildAndConnect()) {
            client.register(CHANNEL, CALL_NAME, ClockResponder::localTime);
            log.info("Serving {} on {}", CALL_NAME, CHANNEL);

            while (client.isConnected()) {
                client.pump();
                Thread.sleep(50);
            }
        }
    }

    private static Map<String, Object> localTime(Map<String, Object> request) {
        Object zone = request.getOrDefault("timezone", "UTC");
        ZonedDateTime now = ZonedDateTime.now(ZoneId.of(zone.toString()));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("hour", now.getHour());
        response.put("minute", now.getMinute());
        log.info("Answering {} with {}", request, response);
        return response;
    }
}
