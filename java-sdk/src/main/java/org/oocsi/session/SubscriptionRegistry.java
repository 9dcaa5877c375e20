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

package org.oocsi.session;

import org.oocsi.message.EventHandler;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Maps channel names to the handlers subscribed to them, in subscription order.
 *
 * <p>A channel is subscribed while it has an entry, even an empty one. Handlers are not deduplicated: a handler
 * subscribed twice is invoked twice per event.
 */
public final class SubscriptionRegistry {

    private final Map<String, List<EventHandler>> handlers = new ConcurrentHashMap<>();

    public void add(String channel, EventHandler handler) {
        handlers.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(handler);
    }

    /**
     * Creates an entry without handlers if the channel has none.
     *
     * @param channel the channel name
     */
    public void addChannel(String channel) {
        handlers.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>());
    }

    /**
     * Removes the channel and all of its handlers.
     *
     * @param channel the channel name
     * @return true if the channel was subscribed
     */
    public boolean remove(String channel) {
        return handlers.remove(channel) != null;
    }

    /**
     * Returns a snapshot of the handlers of a channel.
     *
     * @param channel the channel name
     * @return the handlers in invocation order, empty if the channel is not subscribed
     */
    public List<EventHandler> handlersOf(String channel) {
        List<EventHandler> list = handlers.get(channel);
        return list == null ? List.of() : List.copyOf(list);
    }

    public boolean isSubscribed(String channel) {
        return handlers.containsKey(channel);
    }

    public Set<String> channels() {
        return Set.copyOf(handlers.keySet());
    }
}
