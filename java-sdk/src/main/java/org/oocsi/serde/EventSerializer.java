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
import org.oocsi.exception.OocsiSerializationException;

import java.util.Map;

/**
 * Writes outgoing payloads as single-line JSON objects.
 */
public final class EventSerializer {

    private EventSerializer() {}

    /**
     * Serializes a payload to compact JSON.
     *
     * @param payload the payload to write
     * @return the JSON text, without line breaks
     * @throws OocsiSerializationException if the payload holds values Jackson cannot write
     */
    public static String toJson(Map<String, ?> payload) {
        try {
            return ObjectMapperFactory.getInstance().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new OocsiSerializationException("Failed to serialize payload to JSON", e);
        }
    }
}
