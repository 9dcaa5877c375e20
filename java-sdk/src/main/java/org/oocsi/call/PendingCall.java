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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A call issued by this client, waiting for a response from a responder.
 *
 * <p>A pending call is fulfilled at most once and never after its deadline. Callers polling a call must check
 * {@link #isFulfilled()} or {@link #getResponse()} before using the result.
 */
public final class PendingCall {

    private final String id;
    private final String channel;
    private final String callName;
    private final Instant deadline;
    private final CompletableFuture<PendingCall> completion = new CompletableFuture<>();
    private CallState state = CallState.PENDING;
    private Map<String, Object> response;

    PendingCall(String id, String channel, String callName, Instant deadline) {
        this.id = id;
        this.channel = channel;
        this.callName = callName;
        this.deadline = deadline;
    }

    public String getId() {
        return id;
    }

    public String getChannel() {
        return channel;
    }

    public String getCallName() {
        return callName;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public synchronized CallState getState() {
        return state;
    }

    public synchronized boolean isFulfilled() {
        return state == CallState.FULFILLED;
    }

    /**
     * Returns the response payload, present only once the call is fulfilled.
     *
     * @return the response, if any
     */
    public synchronized Optional<Map<String, Object>> getResponse() {
        return Optional.ofNullable(response);
    }

    /**
     * Returns a future completed with this call once it is fulfilled or expired.
     *
     * @return a future that never completes exceptionally
     */
    public CompletableFuture<PendingCall> completion() {
        return completion.copy();
    }

    boolean isExpiredAt(Instant now) {
        return !now.isBefore(deadline);
    }

    synchronized boolean fulfill(Map<String, Object> payload) {
        if (state != CallState.PENDING) {
            return false;
        }
        response = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        state = CallState.FULFILLED;
        completion.complete(this);
        return true;
    }

    synchronized boolean expire() {
        if (state != CallState.PENDING) {
            return false;
        }
        state = CallState.EXPIRED;
        completion.complete(this);
        return true;
    }

    @Override
    public synchronized String toString() {
        return "PendingCall{id=" + id + ", callName=" + callName + ", channel=" + channel + ", state=" + state + "}";
    }
}
