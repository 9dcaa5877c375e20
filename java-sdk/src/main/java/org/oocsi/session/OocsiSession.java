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

import org.apache.commons.lang3.StringUtils;
import org.oocsi.call.CallRegistry;
import org.oocsi.call.PendingCall;
import org.oocsi.exception.OocsiInvalidArgumentException;
import org.oocsi.exception.OocsiUnknownChannelException;
import org.oocsi.message.ControlFields;
import org.oocsi.message.EventHandler;
import org.oocsi.message.Responder;
import org.oocsi.protocol.Command;
import org.oocsi.serde.EventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Protocol engine of a single client, independent of the transport it runs on.
 *
 * <p>A session owns the subscription, call and service registries of its client. Outgoing commands go through
 * the {@link LineWriter} supplied by the client; received lines are fed to {@link #receive(String)}.
 *
 * <p>A session expects one thread at a time to feed it lines. Registries may be modified from other threads.
 */
public final class OocsiSession {
    private static final Logger log = LoggerFactory.getLogger(OocsiSession.class);

    private final String handle;
    private final SubscriptionRegistry subscriptions = new SubscriptionRegistry();
    private final ServiceRegistry services = new ServiceRegistry();
    private final CallRegistry calls;
    private final LineWriter writer;
    private final MessageRouter router;

    /**
     * Creates a session.
     *
     * @param handle         the resolved client handle
     * @param defaultHandler handler for events sent to the handle channel, may be null
     * @param clock          clock used for call deadlines
     * @param writer         writer for outgoing lines
     */
    public OocsiSession(String handle, EventHandler defaultHandler, Clock clock, LineWriter writer) {
        this.handle = handle;
        this.calls = new CallRegistry(clock);
        this.writer = writer;
        this.router = new MessageRouter(this);
        subscriptions.addChannel(handle);
        if (defaultHandler != null) {
            subscriptions.add(handle, defaultHandler);
        }
    }

    public String getHandle() {
        return handle;
    }

    public SubscriptionRegistry subscriptions() {
        return subscriptions;
    }

    public ServiceRegistry services() {
        return services;
    }

    public CallRegistry calls() {
        return calls;
    }

    /**
     * Handles one received line: answers keep-alives and dispatches events.
     *
     * @param line a protocol line without terminator
     */
    public void receive(String line) {
        router.route(line);
    }

    public void publish(String channel, Map<String, ?> payload) {
        requireChannel(channel);
        if (payload == null) {
            throw new OocsiInvalidArgumentException("Payload cannot be null");
        }
        writer.writeLine(Command.SEND_RAW.format(channel, EventSerializer.toJson(payload)));
        log.trace("[{}]: sent to {}", handle, channel);
    }

    public void subscribe(String channel, EventHandler handler) {
        requireChannel(channel);
        if (handler == null) {
            throw new OocsiInvalidArgumentException("Handler cannot be null");
        }
        subscriptions.add(channel, handler);
        writer.writeLine(Command.SUBSCRIBE.format(channel));
        log.info("[{}]: subscribed to {}", handle, channel);
    }

    /**
     * Removes every handler of a channel and unsubscribes from it.
     *
     * @param channel the channel name
     * @throws OocsiUnknownChannelException if the channel is not subscribed
     */
    public void unsubscribe(String channel) {
        if (!subscriptions.remove(channel)) {
            throw new OocsiUnknownChannelException(channel);
        }
        writer.writeLine(Command.UNSUBSCRIBE.format(channel));
        log.info("[{}]: unsubscribed from {}", handle, channel);
    }

    public void register(String channel, String callName, Responder responder) {
        requireChannel(channel);
        if (StringUtils.isBlank(callName)) {
            throw new OocsiInvalidArgumentException("Call name cannot be null or blank");
        }
        if (responder == null) {
            throw new OocsiInvalidArgumentException("Responder cannot be null");
        }
        services.register(callName, responder);
        writer.writeLine(Command.SUBSCRIBE.format(channel));
        log.info("[{}]: registered responder on {} for {}", handle, channel, callName);
    }

    /**
     * Issues a call without waiting for its response.
     *
     * @param channel  the channel the responder listens on
     * @param callName the name of the called service
     * @param payload  the call arguments
     * @param timeout  how long a response is accepted
     * @return the pending call
     */
    public PendingCall call(String channel, String callName, Map<String, ?> payload, Duration timeout) {
        requireChannel(channel);
        if (StringUtils.isBlank(callName)) {
            throw new OocsiInvalidArgumentException("Call name cannot be null or blank");
        }
        PendingCall call = calls.create(channel, callName, timeout);

        Map<String, Object> message = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
        message.put(ControlFields.MESSAGE_HANDLE, callName);
        message.put(ControlFields.MESSAGE_ID, call.getId());
        publish(channel, message);
        log.debug("[{}]: issued call {} to {} on {}", handle, call.getId(), callName, channel);
        return call;
    }

    /**
     * Sends a subscribe command for every subscribed channel, used right after a handshake.
     */
    public void replaySubscriptions() {
        for (String channel : subscriptions.channels()) {
            writer.writeLine(Command.SUBSCRIBE.format(channel));
        }
    }

    void sendKeepAlive() {
        writer.writeLine(Command.KEEP_ALIVE.format());
    }

    private static void requireChannel(String channel) {
        if (StringUtils.isBlank(channel)) {
            throw new OocsiInvalidArgumentException("Channel cannot be null or blank");
        }
        if (StringUtils.containsWhitespace(channel)) {
            throw new OocsiInvalidArgumentException("Channel cannot contain whitespace: '" + channel + "'");
        }
    }
}
