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

import org.oocsi.message.Responder;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps call names to the responder answering them. The last registration for a name wins.
 */
public final class ServiceRegistry {

    private final Map<String, Responder> responders = new ConcurrentHashMap<>();

    /**
     * Registers a responder.
     *
     * @param callName  the call name
     * @param responder the responder
     * @return the responder previously registered for the name, if any
     */
    public Optional<Responder> register(String callName, Responder responder) {
        return Optional.ofNullable(responders.put(callName, responder));
    }

    public Optional<Responder> find(String callName) {
        return Optional.ofNullable(responders.get(callName));
    }

    public boolean isRegistered(String callName) {
        return responders.containsKey(callName);
    }
}
