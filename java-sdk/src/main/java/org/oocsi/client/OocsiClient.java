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

package org.oocsi.client;

import org.oocsi.call.PendingCall;
import org.oocsi.device.DeviceDescriptor;
import org.oocsi.message.EventHandler;
import org.oocsi.message.Responder;
import org.oocsi.session.ConnectionState;
import org.oocsi.variable.OocsiVariable;

import java.time.Duration;
import java.util.Map;

/**
 * Operations shared by the blocking and the async OOCSI clients.
 */
public interface OocsiClient {

    Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(1);

    /**
     * Returns the handle identifying this client on the server, with placeholders resolved.
     *
     * @return the client handle
     */
    String getHandle();

    ConnectionState getState();

    default boolean isConnected() {
        return getState() == ConnectionState.CONNECTED;
    }

    /**
     * Publishes an event to a channel. Nothing is buffered or retried when the client is disconnected.
     *
     * @param channel the channel name
     * @param data    the event payload
     */
    void publish(String channel, Map<String, ?> data);

    /**
     * Adds a handler to a channel and subscribes to it on the server.
     *
     * <p>The handler is registered locally before the server acknowledges the subscription.
     *
     * @param channel the channel name
     * @param handler the handler invoked for every event on the channel
     */
    void subscribe(String channel, EventHandler handler);

    /**
     * Removes all handlers of a channel and unsubscribes from it on the server.
     *
     * @param channel the channel name
     * @throws org.oocsi.exception.OocsiUnknownChannelException if the channel is not subscribed
     */
    void unsubscribe(String channel);

    /**
     * Registers this client as responder for a call name, listening on the given channel.
     *
     * @param channel   the channel callers publish their calls to
     * @param callName  the call name
     * @param responder the responder; replaces any earlier responder for the same name
     */
    void register(String channel, String callName, Responder responder);

    /**
     * Issues a call and returns immediately.
     *
     * @param channel  the channel the responder listens on
     * @param callName the call name
     * @param data     the call arguments
     * @param timeout  how long a response is accepted
     * @return the pending call, fulfilled later when a response arrives in time
     */
    PendingCall call(String channel, String callName, Map<String, ?> data, Duration timeout);

    default PendingCall call(String channel, String callName, Map<String, ?> data) {
        return call(channel, callName, data, DEFAULT_CALL_TIMEOUT);
    }

    /**
     * Sends {@code quit}, closes the connection and disables reconnection. Pending calls simply expire.
     */
    void stop();

    /**
     * Starts a device description announcing this client under its own handle.
     *
     * @return a new device descriptor
     */
    default DeviceDescriptor heyOocsi() {
        return new DeviceDescriptor(this, getHandle());
    }

    /**
     * Starts a device description announcing this client under a custom name.
     *
     * @param deviceName the device name
     * @return a new device descriptor
     */
    default DeviceDescriptor heyOocsi(String deviceName) {
        return new DeviceDescriptor(this, deviceName);
    }

    /**
     * Creates a variable tracking one key of a channel, subscribing to the channel.
     *
     * @param channel the channel carrying the value
     * @param key     the data key holding the value
     * @return a new variable bound to this client
     */
    default OocsiVariable variable(String channel, String key) {
        return new OocsiVariable(this, channel, key);
    }
}
