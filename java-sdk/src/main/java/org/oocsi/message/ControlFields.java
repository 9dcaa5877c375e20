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

/**
 * Names of the fields the protocol reserves in an event object.
 */
public final class ControlFields {

    public static final String SENDER = "sender";
    public static final String RECIPIENT = "recipient";
    public static final String TIMESTAMP = "timestamp";
    public static final String DATA = "data";

    /** Names the service a call is addressed to. */
    public static final String MESSAGE_HANDLE = "_MESSAGE_HANDLE";

    /** Correlates a call with its response. */
    public static final String MESSAGE_ID = "_MESSAGE_ID";

    private ControlFields() {}
}
