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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An event received from the server.
 *
 * <p>The payload holds every field of the JSON object except {@code sender}, {@code recipient}, {@code timestamp}
 * and {@code data}. Call control fields are still present at this stage.
 */
public record Event(String sender, String recipient, long timestamp, Map<String, Object> payload) {

    public Event {
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Optional<String> messageHandle() {
        return controlField(ControlFields.MESSAGE_HANDLE);
    }

    public Optional<String> messageId() {
        return controlField(ControlFields.MESSAGE_ID);
    }

    /**
     * Returns a mutable copy of the payload without the call control fields.
     *
     * @return the payload as handed to user callbacks
     */
    public Map<String, Object> userPayload() {
        Map<String, Object> copy = new LinkedHashMap<>(payload);
        copy.remove(ControlFields.MESSAGE_HANDLE);
        copy.remove(ControlFields.MESSAGE_ID);
        return copy;
    }

    private Optional<String> controlField(String name) {
        Object value = payload.get(name);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }
}
