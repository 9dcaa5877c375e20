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

package org.oocsi.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.oocsi.message.ControlFields;
import org.oocsi.message.Event;

import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Reads event objects from protocol lines.
 */
public final class EventDeserializer {

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private EventDeserializer() {}

    /**
     * Decodes a JSON event line.
     *
     * <p>Returns empty for text that is not a JSON object, or an object without {@code sender} or
     * {@code recipient}. A missing or non-numeric {@code timestamp} reads as 0.
     *
     * @param line a protocol line starting with an opening brace
     * @return the decoded event, if the line holds one
     */
    public static Optional<Event> fromJson(String line) {
        LinkedHashMap<String, Object> fields;
        try {
            fields = ObjectMapperFactory.getInstance().readValue(line, OBJECT_TYPE);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (fields == null) {
            return Optional.empty();
        }

        Object sender = fields.remove(ControlFields.SENDER);
        Object recipient = fields.remove(ControlFields.RECIPIENT);
        Object timestamp = fields.remove(ControlFields.TIMESTAMP);
        fields.remove(ControlFields.DATA);
        if (sender == null || recipient == null) {
            return Optional.empty();
        }
        long time = timestamp instanceof Number number ? number.longValue() : 0L;
        return Optional.of(new Event(sender.toString(), recipient.toString(), time, fields));
    }
}
