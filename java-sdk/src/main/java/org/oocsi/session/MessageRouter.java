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
import org.oocsi.message.ControlFields;
import org.oocsi.message.Event;
import org.oocsi.message.EventHandler;
import org.oocsi.message.Responder;
import org.oocsi.protocol.LineType;
import org.oocsi.serde.EventDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies received lines and dispatches events to responders, pending calls and channel subscribers.
 *
 * <p>Exceptions thrown by handlers and responders are not caught here; they abort the dispatch of the current
 * event and reach whoever fed the line.
 */
final class MessageRouter {
    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);
    private static final int MAX_LOGGED_LINE_LENGTH = 200;

    private final OocsiSession session;

    MessageRouter(OocsiSession session) {
        this.session = session;
    }

    void route(String line) {
        switch (LineType.of(line)) {
            case KEEP_ALIVE -> {
                log.trace("[{}]: keep-alive", session.getHandle());
                session.sendKeepAlive();
            }
            case EVENT -> EventDeserializer.fromJson(line)
                    .ifPresentOrElse(this::dispatch, () -> log.debug(
                            "[{}]: discarding malformed event: {}",
                            session.getHandle(),
                            StringUtils.abbreviate(line, MAX_LOGGED_LINE_LENGTH)));
            case IGNORED -> log.trace(
                    "[{}]: ignoring line: {}",
                    session.getHandle(),
                    StringUtils.abbreviate(line, MAX_LOGGED_LINE_LENGTH));
        }
    }

    void dispatch(Event event) {
        Optional<Responder> responder = event.messageHandle().flatMap(name -> session.services().find(name));
        if (responder.isPresent()) {
            serve(event, responder.get());
            return;
        }

        Optional<String> messageId = event.messageId();
        if (messageId.isPresent()) {
            correlate(messageId.get(), event);
            return;
        }

        broadcast(event.sender(), event.recipient(), event.userPayload());
    }

    private void serve(Event event, Responder responder) {
        Map<String, Object> response = responder.respond(event.userPayload());
        Map<String, Object> result = response == null ? new LinkedHashMap<>() : new LinkedHashMap<>(response);

        Map<String, Object> reply = new LinkedHashMap<>(result);
        event.messageId().ifPresent(id -> reply.put(ControlFields.MESSAGE_ID, id));
        session.publish(event.sender(), reply);

        broadcast(event.sender(), event.recipient(), result);
    }

    private void correlate(String id, Event event) {
        switch (session.calls().complete(id, event.userPayload())) {
            case FULFILLED -> log.debug("[{}]: response received for call {}", session.getHandle(), id);
            case EXPIRED -> log.debug("[{}]: dropping late response for call {}", session.getHandle(), id);
            case UNKNOWN -> log.debug("[{}]: dropping response for unknown call {}", session.getHandle(), id);
        }
    }

    private void broadcast(String sender, String recipient, Map<String, Object> payload) {
        Map<String, Object> event = Collections.unmodifiableMap(payload);
        for (EventHandler handler : session.subscriptions().handlersOf(recipient)) {
            handler.handle(sender, recipient, event);
        }
    }
}
