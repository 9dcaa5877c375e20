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
 * Commands a client sends to the server, one per line.
 */
public enum Command {
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe"),
    SEND_RAW("sendraw"),
    QUIT("quit"),
    KEEP_ALIVE(".");

    private static final String HANDSHAKE_SUFFIX = "(JSON)";

    private final String keyword;

    Command(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Formats the command with its arguments, separated by single spaces, without the line terminator.
     *
     * @param arguments the command arguments
     * @return the command line
     */
    public String format(String... arguments) {
        if (arguments.length == 0) {
            return keyword;
        }
        return keyword + " " + String.join(" ", arguments);
    }

    /**
     * Formats the first line a client sends, announcing its handle and asking for JSON events.
     *
     * @param handle the client handle
     * @return the handshake line
     */
    public static String handshake(String handle) {
        return handle + HANDSHAKE_SUFFIX;
    }
}
