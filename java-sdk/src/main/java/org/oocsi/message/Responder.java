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
 * Answers calls addressed to a call name registered by this client.
 */
@FunctionalInterface
public interface Responder {

    /**
     * Computes the response to a call.
     *
     * <p>The request map is mutable; a responder may fill it in and return it, or return a new map.
     * Returning {@code null} answers with an empty payload.
     *
     * @param request the payload of the call, without control fields
     * @return the response payload
     */
    Map<String, Object> respond(Map<String, Object> request);
}
