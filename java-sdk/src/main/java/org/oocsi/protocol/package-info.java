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

/**
 * The OOCSI line protocol.
 *
 * <p>Every message is one UTF-8 line terminated by {@code \n}. The client sends plain-text commands such as
 * {@code subscribe <channel>} and {@code sendraw <channel> <json>}; the server answers the handshake with a JSON
 * object or an {@code error} line, sends keep-alive probes ({@code ping} or {@code .}) and delivers events as JSON
 * objects.
 */
package org.oocsi.protocol;
