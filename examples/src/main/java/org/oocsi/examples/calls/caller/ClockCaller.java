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

package org.oocsi.examples.calls.caller;

import org.oocsi.call.PendingCall;
import org.oocsi.client.blocking.tcp.OocsiTcpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

public final class ClockCaller {

    private static final Logger log = LoggerFactory.getLogger(ClockCaller.class);

    private ClockCaller() {}

    public static void main(String[] args) {
        try (var client = OocsiTcpClient.builder().handle("caller_##").buildAndConnect()) {
            for (String zone : new String[] {"Europe/Amsterdam", "Asia/Tokyo", "America/New_York"}) {
                PendingCall call = client.callAndWait(
                        "timeservice", "localTime", Map.of("timezone", zone), Duration.ofSeconds(2));
                call.getResponse()
                        .ifPresentOrElse(
                                response -> log.info("Time in {}: {}:{}", zone, response.get("hour"),
                                        response.get("minute")),
                                () -> log.warn("No response for {} within the timeout", zone));
            }
        }
    }
}
