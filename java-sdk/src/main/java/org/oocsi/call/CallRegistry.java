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

import org.oocsi.exception.OocsiInvalidArgumentException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Correlates the responses received by a client with the calls it issued.
 *
 * <p>A call leaves the registry when it is fulfilled or found expired. Removal is the single point of arbitration
 * between a response and an expiration racing for the same call.
 */
public final class CallRegistry {

    private final Map<String, PendingCall> calls = new ConcurrentHashMap<>();
    private final Clock clock;

    public CallRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates and stores a new pending call with a random UUID v4 identifier.
     *
     * @param channel  the channel the call is published to
     * @param callName the name of the called service
     * @param timeout  the time the call waits for a response
     * @return the new pending call
     * @throws OocsiInvalidArgumentException if timeout is not positive
     */
    public PendingCall create(String channel, String callName, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new OocsiInvalidArgumentException("Call timeout must be positive");
        }
        var call = new PendingCall(UUID.randomUUID().toString(), channel, callName, clock.instant().plus(timeout));
        calls.put(call.getId(), call);
        return call;
    }

    public Optional<PendingCall> find(String id) {
        return Optional.ofNullable(calls.get(id));
    }

    /**
     * Attaches a response to the call with the given identifier.
     *
     * @param id       the identifier carried by the response
     * @param response the response payload
     * @return the outcome of the correlation
     */
    public Correlation complete(String id, Map<String, Object> response) {
        PendingCall call = calls.remove(id);
        if (call == null) {
            return Correlation.UNKNOWN;
        }
        if (call.isExpiredAt(clock.instant())) {
            call.expire();
            return Correlation.EXPIRED;
        }
        return call.fulfill(response) ? Correlation.FULFILLED : Correlation.UNKNOWN;
    }

    /**
     * Expires the call with the given identifier if it is still waiting.
     *
     * @param id the call identifier
     * @return true if the call was pending and is now expired
     */
    public boolean expire(String id) {
        PendingCall call = calls.remove(id);
        return call != null && call.expire();
    }

    /**
     * Removes every call whose deadline has passed.
     *
     * @return the number of calls expired
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int purged = 0;
        for (PendingCall call : calls.values()) {
            if (call.isExpiredAt(now) && expire(call.getId())) {
                purged++;
            }
        }
        return purged;
    }

    public int size() {
        return calls.size();
    }

    /**
     * Outcome of matching a response against the registry.
     */
    public enum Correlation {
        FULFILLED,
        EXPIRED,
        UNKNOWN
    }
}
