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

package org.oocsi.exception;

import org.apache.commons.lang3.StringUtils;

/**
 * Raised when the server rejects the handshake of a client, typically because the handle is already taken.
 */
public class OocsiHandshakeException extends OocsiException {

    private final String reason;

    /**
     * Constructs a new OocsiHandshakeException from the line the server answered with.
     *
     * @param reason the server response, usually starting with {@code error}
     */
    public OocsiHandshakeException(String reason) {
        super(buildMessage(reason));
        this.reason = StringUtils.stripToEmpty(reason);
    }

    /**
     * Returns the raw response the server rejected the handshake with.
     *
     * @return the rejection reason
     */
    public String getReason() {
        return reason;
    }

    private static String buildMessage(String reason) {
        if (StringUtils.isBlank(reason)) {
            return "Handshake rejected by server";
        }
        return "Handshake rejected by server: " + StringUtils.strip(reason);
    }
}
