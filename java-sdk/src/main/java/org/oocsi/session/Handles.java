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

import org.apache.commons.lang3.StringUtils;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Resolves client handle templates.
 */
public final class Handles {

    /** Used when no handle is given. */
    public static final String DEFAULT_TEMPLATE = "OOCSIClient_####";

    private static final char PLACEHOLDER = '#';

    private Handles() {}

    /**
     * Replaces every {@code #} in the template with a random decimal digit.
     *
     * @param template the handle template, may be null or blank
     * @return the resolved handle
     */
    public static String resolve(String template) {
        String handle = StringUtils.isBlank(template) ? DEFAULT_TEMPLATE : template;
        StringBuilder resolved = new StringBuilder(handle.length());
        for (char c : handle.toCharArray()) {
            resolved.append(c == PLACEHOLDER ? Character.forDigit(ThreadLocalRandom.current().nextInt(10), 10) : c);
        }
        return resolved.toString();
    }
}
