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

package org.oocsi.message;

import java.util.Map;

/**
 * Receives the events broadcast on a subscribed channel.
 *
 * <p>The event map holds the payload fields of the message; the {@code sender}, {@code recipient},
 * {@code timestamp} and {@code data} fields as well as the call control fields are removed before the handler is
 * invoked.
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handles a single event.
     *
     * @param sender    the handle of the client that sent the event
     * @param recipient the channel the event was sent to
     * @param event     the payload of the event
     */
    void handle(String sender, String recipient, Map<String, Object> event);
}
