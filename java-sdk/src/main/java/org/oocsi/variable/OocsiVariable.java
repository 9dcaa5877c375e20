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

package org.oocsi.variable;

import org.oocsi.client.OocsiClient;
import org.oocsi.exception.OocsiInvalidArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * A numeric value shared through one key of a channel.
 *
 * <p>The variable subscribes to its channel on creation and keeps the latest value of its key. Values received
 * and set locally pass the same filter: clamping to {@link #min(double)} and {@link #max(double)}, or otherwise
 * limiting the step away from the current mean to {@code sigma / window size}. With {@link #smooth(int)} the
 * variable reads as the mean of its last values.
 *
 * <p>With the blocking client, received values only arrive while the client is pumped.
 */
public class OocsiVariable {
    private static final Logger log = LoggerFactory.getLogger(OocsiVariable.class);

    private final OocsiClient client;
    private final String channel;
    private final String key;
    private final Deque<Double> window = new ArrayDeque<>();
    private Double value;
    private Double min;
    private Double max;
    private Double sigma;
    private int windowLength;

    public OocsiVariable(OocsiClient client, String channel, String key) {
        if (client == null) {
            throw new OocsiInvalidArgumentException("Client cannot be null");
        }
        if (key == null || key.isEmpty()) {
            throw new OocsiInvalidArgumentException("Key cannot be null or empty");
        }
        this.client = client;
        this.channel = channel;
        this.key = key;
        client.subscribe(channel, (sender, recipient, event) -> receive(event));
    }

    public String getChannel() {
        return channel;
    }

    public String getKey() {
        return key;
    }

    /**
     * Returns the current value: the mean of the window when smoothing, otherwise the last value.
     *
     * @return the current value, or null before any value was received or set
     */
    public synchronized Double get() {
        if (windowLength > 0 && !window.isEmpty()) {
            return window.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        }
        return value;
    }

    /**
     * Records a value locally and publishes it.
     *
     * <p>The local value is filtered; the published value is the one given.
     *
     * @param newValue the value
     */
    public void set(double newValue) {
        synchronized (this) {
            record(filter(newValue));
        }
        client.publish(channel, Map.of(key, newValue));
    }

    public synchronized OocsiVariable min(double min) {
        this.min = min;
        if (value != null && value < min) {
            value = min;
        }
        return this;
    }

    public synchronized OocsiVariable max(double max) {
        this.max = max;
        if (value != null && value > max) {
            value = max;
        }
        return this;
    }

    public OocsiVariable smooth(int windowLength) {
        return smooth(windowLength, null);
    }

    /**
     * Keeps a moving window of values.
     *
     * @param windowLength the number of values averaged by {@link #get()}
     * @param sigma        the largest accepted distance from the mean, null for no limit
     * @return this variable
     */
    public synchronized OocsiVariable smooth(int windowLength, Double sigma) {
        if (windowLength < 0) {
            throw new OocsiInvalidArgumentException("Window length cannot be negative");
        }
        this.windowLength = windowLength;
        this.sigma = sigma;
        while (window.size() > windowLength) {
            window.removeFirst();
        }
        return this;
    }

    private synchronized void receive(Map<String, Object> event) {
        Object received = event.get(key);
        if (received == null) {
            return;
        }
        if (!(received instanceof Number)) {
            log.debug("Ignoring non-numeric value of {} on {}: {}", key, channel, received);
            return;
        }
        record(filter(((Number) received).doubleValue()));
    }

    private double filter(double candidate) {
        if (min != null && candidate < min) {
            return min;
        }
        if (max != null && candidate > max) {
            return max;
        }
        if (sigma != null && !window.isEmpty()) {
            Double mean = get();
            if (mean != null && Math.abs(mean - candidate) > sigma) {
                double step = sigma / window.size();
                return mean - candidate > 0 ? mean - step : mean + step;
            }
        }
        return candidate;
    }

    private void record(double filtered) {
        if (windowLength > 0) {
            window.addLast(filtered);
            while (window.size() > windowLength) {
                window.removeFirst();
            }
        } else {
            value = filtered;
        }
    }
}
