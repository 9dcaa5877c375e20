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

package org.oocsi.protocol;

/**
 * Classifies the first line the server sends after a handshake.
 */
public enum HandshakeResponse {
    /** The server sent its JSON session information. */
    ACCEPTED,
    /** The server refused the client, for instance because its handle is taken. */
    REJECTED,
    UNEXPECTED;

    public static HandshakeResponse of(String line) {
        if (line == null) {
            return UNEXPECTED;
        }
        if (line.startsWith("{")) {
            return ACCEPTED;
        }
        if (line.startsWith("error")) {
            return REJECTED;
        }
        return UNEXPECTED;
    }
}
