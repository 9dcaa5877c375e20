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
 * Netty-based TCP implementation of the async OOCSI client.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link org.oocsi.client.async.tcp.AsyncOocsiTcpClient}: client entry point with future-based connect,
 *       close and call operations</li>
 *   <li>{@link org.oocsi.client.async.tcp.AsyncOocsiTcpClientBuilder}: fluent builder for configuring and
 *       constructing the client</li>
 *   <li>{@link org.oocsi.client.async.tcp.AsyncTcpConnection}: manages the Netty channel and its event loop</li>
 * </ul>
 *
 * <p>Received lines are decoded by {@link org.oocsi.protocol.OocsiLineDecoder} and handed to the session on the
 * connection's single event-loop thread, so events are dispatched one at a time and in arrival order.
 *
 * @see org.oocsi.client.async.tcp.AsyncOocsiTcpClient
 */
package org.oocsi.client.async.tcp;
