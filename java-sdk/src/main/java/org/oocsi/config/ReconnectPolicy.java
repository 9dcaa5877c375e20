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

package org.oocsi.config;

import org.oocsi.exception.OocsiInvalidArgumentException;

import java.time.Duration;

/**
 * Controls how often a client tries to establish its connection again after a failed attempt or a lost connection.
 *
 * <p>The default is {@link #noReconnect()}: a failed {@code connect()} leaves the client disconnected and the host
 * decides whether to try again.
 */
public final class ReconnectPolicy {

    private static final ReconnectPolicy NO_RECONNECT = new ReconnectPolicy(0, Duration.ZERO);

    private final int maxAttempts;
    private final Duration delay;

    private ReconnectPolicy(int maxAttempts, Duration delay) {
        this.maxAttempts = maxAttempts;
        this.delay = delay;
    }

    /**
     * Creates a policy with a fixed delay between attempts.
     *
     * @param maxAttempts the number of attempts made after the first one failed
     * @param delay       the fixed delay between two attempts
     * @return a ReconnectPolicy with fixed delay configuration
     * @throws OocsiInvalidArgumentException if maxAttempts is negative or delay is negative
     */
    public static ReconnectPolicy fixedDelay(int maxAttempts, Duration delay) {
        if (maxAttempts < 0) {
            throw new OocsiInvalidArgumentException("Max attempts must not be negative");
        }
        if (delay == null || delay.isNegative()) {
            throw new OocsiInvalidArgumentException("Delay must not be negative");
        }
        return new ReconnectPolicy(maxAttempts, delay);
    }

    /**
     * Creates a policy that never tries again.
     *
     * @return a ReconnectPolicy that does not reconnect
     */
    public static ReconnectPolicy noReconnect() {
        return NO_RECONNECT;
    }

    /**
     * Gets the number of attempts made after the first one failed.
     *
     * @return the maximum number of additional attempts
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Gets the delay between two attempts.
     *
     * @return the delay duration
     */
    public Duration getDelay() {
        return delay;
    }

    public boolean isEnabled() {
        return maxAttempts > 0;
    }

    @Override
    public String toString() {
        return "ReconnectPolicy{maxAttempts=" + maxAttempts + ", delay=" + delay + "}";
    }
}
