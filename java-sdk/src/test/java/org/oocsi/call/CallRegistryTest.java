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

package org.oocsi.call;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.oocsi.call.CallRegistry.Correlation;
import org.oocsi.exception.OocsiInvalidArgumentException;
import org.oocsi.testing.MutableClock;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallRegistryTest {

    private MutableClock clock;
    private CallRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        registry = new CallRegistry(clock);
    }

    @Nested
    class Create {

        @Test
        void shouldCreatePendingCallWithUniqueId() {
            // when
            PendingCall first = registry.create("clock", "time", Duration.ofSeconds(1));
            PendingCall second = registry.create("clock", "time", Duration.ofSeconds(1));

            // then
            assertThat(first.getId()).isNotEqualTo(second.getId());
            assertThat(first.getState()).isEqualTo(CallState.PENDING);
            assertThat(first.getDeadline()).isEqualTo(clock.instant().plusSeconds(1));
            assertThat(registry.size()).isEqualTo(2);
            assertThat(registry.find(first.getId())).contains(first);
        }

        @Test
        void shouldRejectNonPositiveTimeout() {
            assertThatThrownBy(() -> registry.create("clock", "time", Duration.ZERO))
                    .isInstanceOf(OocsiInvalidArgumentException.class);
            assertThatThrownBy(() -> registry.create("clock", "time", Duration.ofMillis(-1)))
                    .isInstanceOf(OocsiInvalidArgumentException.class);
        }
    }

    @Nested
    class Complete {

        @Test
        void shouldFulfillCallBeforeDeadline() {
            // given
            PendingCall call = registry.create("clock", "time", Duration.ofSeconds(1));
            clock.advance(Duration.ofMillis(999));

            // when
            Correlation result = registry.complete(call.getId(), Map.of("hour", 12));

            // then
            assertThat(result).isEqualTo(Correlation.FULFILLED);
            assertThat(call.isFulfilled()).isTrue();
            assertThat(call.getResponse()).contains(Map.of("hour", 12));
            assertThat(call.completion()).isCompletedWithValue(call);
            assertThat(registry.size()).isZero();
        }

        @Test
        void shouldExpireCallAtDeadline() {
            // given
            PendingCall call = registry.create("clock", "time", Duration.ofSeconds(1));
            clock.advance(Duration.ofSeconds(1));

            // when
            Correlation result = registry.complete(call.getId(), Map.of("hour", 12));

            // then
            assertThat(result).isEqualTo(Correlation.EXPIRED);
            assertThat(call.getState()).isEqualTo(CallState.EXPIRED);
            assertThat(call.getResponse()).isEmpty();
        }

        @Test
        void shouldIgnoreDuplicateResponse() {
            // given
            PendingCall call = registry.create("clock", "time", Duration.ofSeconds(1));
            registry.complete(call.getId(), Map.of("hour", 12));

            // when
            Correlation result = registry.complete(call.getId(), Map.of("hour", 13));

            // then
            assertThat(result).isEqualTo(Correlation.UNKNOWN);
            assertThat(call.getResponse()).contains(Map.of("hour", 12));
        }

        @Test
        void shouldIgnoreUnknownId() {
            assertThat(registry.complete("nope", Map.of())).isEqualTo(Correlation.UNKNOWN);
        }
    }

    @Nested
    class Expire {

        @Test
        void shouldExpirePendingCall() {
            // given
            PendingCall call = registry.create("clock", "time", Duration.ofSeconds(1));

            // when
            boolean expired = registry.expire(call.getId());

            // then
            assertThat(expired).isTrue();
            assertThat(call.getState()).isEqualTo(CallState.EXPIRED);
            assertThat(call.completion()).isCompletedWithValue(call);
            assertThat(registry.complete(call.getId(), Map.of())).isEqualTo(Correlation.UNKNOWN);
        }

        @Test
        void shouldPurgeOnlyCallsPastDeadline() {
            // given
            PendingCall shortCall = registry.create("clock", "time", Duration.ofMillis(100));
            PendingCall longCall = registry.create("clock", "time", Duration.ofSeconds(10));
            clock.advance(Duration.ofSeconds(1));

            // when
            int purged = registry.purgeExpired();

            // then
            assertThat(purged).isEqualTo(1);
            assertThat(shortCall.getState()).isEqualTo(CallState.EXPIRED);
            assertThat(longCall.getState()).isEqualTo(CallState.PENDING);
            assertThat(registry.size()).isEqualTo(1);
        }
    }
}
