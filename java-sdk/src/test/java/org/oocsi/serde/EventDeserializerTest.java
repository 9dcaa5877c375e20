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

package org.oocsi.serde;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.oocsi.message.Event;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventDeserializerTest {

    @Nested
    class ValidEvents {

        @Test
        void shouldSplitControlFieldsFromPayload() {
            // given
            String line = "{\"color\":\"red\",\"sender\":\"lamp_01\",\"recipient\":\"lamps\","
                    + "\"timestamp\":1700000000000,\"data\":\"\"}";

            // when
            Event event = EventDeserializer.fromJson(line).orElseThrow();

            // then
            assertThat(event.sender()).isEqualTo("lamp_01");
            assertThat(event.recipient()).isEqualTo("lamps");
            assertThat(event.timestamp()).isEqualTo(1700000000000L);
            assertThat(event.payload()).containsExactly(Map.entry("color", "red"));
        }

        @Test
        void shouldKeepNestedValues() {
            // given
            String line = "{\"sender\":\"a\",\"recipient\":\"b\",\"rgb\":[255,0,0],\"meta\":{\"room\":\"hall\"}}";

            // when
            Event event = EventDeserializer.fromJson(line).orElseThrow();

            // then
            assertThat(event.payload())
                    .containsEntry("rgb", List.of(255, 0, 0))
                    .containsEntry("meta", Map.of("room", "hall"));
        }

        @Test
        void shouldDefaultMissingTimestampToZero() {
            // when
            Event event = EventDeserializer.fromJson("{\"sender\":\"a\",\"recipient\":\"b\"}")
                    .orElseThrow();

            // then
            assertThat(event.timestamp()).isZero();
            assertThat(event.payload()).isEmpty();
        }

        @Test
        void shouldKeepCallControlFieldsInPayload() {
            // when
            Event event = EventDeserializer.fromJson(
                            "{\"sender\":\"a\",\"recipient\":\"b\",\"_MESSAGE_HANDLE\":\"time\",\"_MESSAGE_ID\":\"42\"}")
                    .orElseThrow();

            // then
            assertThat(event.messageHandle()).contains("time");
            assertThat(event.messageId()).contains("42");
            assertThat(event.userPayload()).isEmpty();
        }
    }

    @Nested
    class InvalidEvents {

        @Test
        void shouldRejectMalformedJson() {
            assertThat(EventDeserializer.fromJson("{\"sender\":")).isEmpty();
        }

        @Test
        void shouldRejectTrailingGarbage() {
            assertThat(EventDeserializer.fromJson("{\"sender\":\"a\",\"recipient\":\"b\"} extra")).isEmpty();
        }

        @Test
        void shouldRejectEventWithoutSender() {
            assertThat(EventDeserializer.fromJson("{\"recipient\":\"b\"}")).isEmpty();
        }

        @Test
        void shouldRejectEventWithoutRecipient() {
            assertThat(EventDeserializer.fromJson("{\"sender\":\"a\"}")).isEmpty();
        }
    }
}
