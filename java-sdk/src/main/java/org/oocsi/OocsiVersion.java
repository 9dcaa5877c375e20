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

package org.oocsi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Provides version information for the OOCSI Java SDK.
 *
 * <p>Version information is read from a properties file filtered at build time.
 */
public final class OocsiVersion {

    private static final Logger log = LoggerFactory.getLogger(OocsiVersion.class);
    private static final String PROPERTIES_FILE = "/oocsi-version.properties";
    private static final String UNKNOWN = "unknown";

    private static final OocsiVersion INSTANCE = load();

    private final String version;
    private final String buildTime;

    private OocsiVersion(String version, String buildTime) {
        this.version = version;
        this.buildTime = buildTime;
    }

    private static OocsiVersion load() {
        Properties props = new Properties();
        try (InputStream is = OocsiVersion.class.getResourceAsStream(PROPERTIES_FILE)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException e) {
            log.warn("Failed to read version information from {}", PROPERTIES_FILE, e);
        }
        return new OocsiVersion(
                resolved(props.getProperty("version")),
                resolved(props.getProperty("buildTime")));
    }

    // unfiltered placeholders count as missing
    private static String resolved(String value) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return UNKNOWN;
        }
        return value;
    }

    /**
     * Gets the singleton OocsiVersion instance.
     *
     * @return the version information instance
     */
    public static OocsiVersion getInstance() {
        return INSTANCE;
    }

    /**
     * Gets the SDK version string.
     *
     * @return the version string (e.g., "1.0.0")
     */
    public String getVersion() {
        return version;
    }

    /**
     * Gets the build timestamp.
     *
     * @return the build time as ISO-8601 string, or "unknown" if not available
     */
    public String getBuildTime() {
        return buildTime;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("OOCSI Java SDK ").append(version);
        if (!UNKNOWN.equals(buildTime)) {
            sb.append(" (built: ").append(buildTime).append(")");
        }
        return sb.toString();
    }
}
