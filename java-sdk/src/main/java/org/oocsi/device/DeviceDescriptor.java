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

package org.oocsi.device;

import org.apache.commons.lang3.EnumUtils;
import org.oocsi.client.OocsiClient;
import org.oocsi.exception.OocsiInvalidArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the self-description a device announces on the {@value #CHANNEL} channel.
 *
 * <p>The published document has the shape
 * <pre>{@code
 * {"<device name>": {
 *     "properties": {"device_id": "<client handle>", ...},
 *     "components": {"<component name>": {...}, ...},
 *     "location": {"<location name>": [latitude, longitude], ...}}}
 * }</pre>
 * Optional component fields that are not given are published as {@code null}.
 *
 * <pre>{@code
 * client.heyOocsi("kitchen_lamp")
 *     .addProperty("vendor", "acme")
 *     .addLocation("kitchen", 51.44, 5.47)
 *     .addLight("ceiling", "kitchen_lamp_ceiling", LedType.RGB, Spectrum.RGB)
 *     .submit();
 * }</pre>
 */
public final class DeviceDescriptor {
    private static final Logger log = LoggerFactory.getLogger(DeviceDescriptor.class);

    public static final String CHANNEL = "heyOOCSI!";

    private final OocsiClient client;
    private final String deviceName;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final Map<String, Object> components = new LinkedHashMap<>();
    private final Map<String, Object> locations = new LinkedHashMap<>();

    public DeviceDescriptor(OocsiClient client, String deviceName) {
        if (client == null) {
            throw new OocsiInvalidArgumentException("Client cannot be null");
        }
        if (deviceName == null || deviceName.isBlank()) {
            throw new OocsiInvalidArgumentException("Device name cannot be null or blank");
        }
        this.client = client;
        this.deviceName = deviceName;
        properties.put("device_id", client.getHandle());
        log.info("[{}]: created device {}", client.getHandle(), deviceName);
    }

    public String getDeviceName() {
        return deviceName;
    }

    public DeviceDescriptor addProperty(String name, Object value) {
        properties.put(name, value);
        logAdded(name, "properties");
        return this;
    }

    public DeviceDescriptor addLocation(String name) {
        return addLocation(name, 0, 0);
    }

    public DeviceDescriptor addLocation(String name, double latitude, double longitude) {
        locations.put(name, Arrays.asList(latitude, longitude));
        logAdded(name, "locations");
        return this;
    }

    public DeviceDescriptor addSensor(String name, String channel, String sensorType, String unit, double value) {
        return addSensor(name, channel, sensorType, unit, value, "auto", null, null);
    }

    /**
     * Adds a sensor reporting a numeric value.
     *
     * @param name       the component name
     * @param channel    the channel the sensor publishes on
     * @param sensorType the sensor type, e.g. {@code temperature}
     * @param unit       the unit of the value
     * @param value      the initial value
     * @param mode       the sensor mode, {@code auto} unless given
     * @param step       the value step, may be null
     * @param icon       the icon, may be null
     * @return this descriptor
     */
    public DeviceDescriptor addSensor(
            String name,
            String channel,
            String sensorType,
            String unit,
            double value,
            String mode,
            Double step,
            String icon) {
        Map<String, Object> component = component(channel, "sensor");
        component.put("sensor_type", sensorType);
        component.put("unit", unit);
        component.put("value", value);
        component.put("mode", mode);
        component.put("step", step);
        component.put("icon", icon);
        return addComponent(name, component);
    }

    public DeviceDescriptor addNumber(String name, String channel, double min, double max, String unit, double value) {
        return addNumber(name, channel, min, max, unit, value, null);
    }

    public DeviceDescriptor addNumber(
            String name, String channel, double min, double max, String unit, double value, String icon) {
        Map<String, Object> component = component(channel, "number");
        component.put("min_max", Arrays.asList(min, max));
        component.put("unit", unit);
        component.put("value", value);
        component.put("icon", icon);
        return addComponent(name, component);
    }

    public DeviceDescriptor addBinarySensor(String name, String channel, String sensorType) {
        return addBinarySensor(name, channel, sensorType, false, null);
    }

    public DeviceDescriptor addBinarySensor(
            String name, String channel, String sensorType, boolean state, String icon) {
        Map<String, Object> component = component(channel, "binary_sensor");
        component.put("sensor_type", sensorType);
        component.put("state", state);
        component.put("icon", icon);
        return addComponent(name, component);
    }

    public DeviceDescriptor addSwitch(String name, String channel) {
        return addSwitch(name, channel, false, null);
    }

    public DeviceDescriptor addSwitch(String name, String channel, boolean state, String icon) {
        Map<String, Object> component = component(channel, "switch");
        component.put("state", state);
        component.put("icon", icon);
        return addComponent(name, component);
    }

    public DeviceDescriptor addLight(String name, String channel, LedType ledType, Spectrum spectrum) {
        return addLight(name, channel, ledType.name(), spectrum.name(), false, 0, null, null, null);
    }

    /**
     * Adds a light.
     *
     * <p>LED types and spectra outside {@link LedType} and {@link Spectrum} are logged as errors and published as
     * given.
     *
     * @param name       the component name
     * @param channel    the channel the light listens on
     * @param ledType    the LED type
     * @param spectrum   the color spectrum
     * @param state      whether the light is initially on
     * @param brightness the initial brightness
     * @param miredMin   the lowest color temperature in mired, may be null
     * @param miredMax   the highest color temperature in mired, may be null
     * @param icon       the icon, may be null
     * @return this descriptor
     */
    public DeviceDescriptor addLight(
            String name,
            String channel,
            String ledType,
            String spectrum,
            boolean state,
            int brightness,
            Integer miredMin,
            Integer miredMax,
            String icon) {
        if (!EnumUtils.isValidEnum(LedType.class, ledType)) {
            log.error("[{}]: unknown LED type {} for light {}", client.getHandle(), ledType, name);
        } else if (!EnumUtils.isValidEnum(Spectrum.class, spectrum)) {
            log.error("[{}]: unknown spectrum {} for light {}", client.getHandle(), spectrum, name);
        }
        Map<String, Object> component = component(channel, "light");
        component.put("ledType", ledType);
        component.put("spectrum", spectrum);
        component.put("min_max", miredMin == null && miredMax == null ? null : Arrays.asList(miredMin, miredMax));
        component.put("state", state);
        component.put("brightness", brightness);
        component.put("icon", icon);
        return addComponent(name, component);
    }

    /**
     * Returns the description as it is published.
     *
     * @return the description keyed by device name
     */
    public Map<String, Object> toMap() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("properties", properties);
        description.put("components", components);
        description.put("location", locations);
        return Map.of(deviceName, description);
    }

    /**
     * Publishes the description to {@value #CHANNEL}.
     */
    public void submit() {
        client.publish(CHANNEL, toMap());
        log.info("[{}]: sent {} message for device {}", client.getHandle(), CHANNEL, deviceName);
    }

    public void sayHi() {
        submit();
    }

    private DeviceDescriptor addComponent(String name, Map<String, Object> component) {
        if (name == null || name.isBlank()) {
            throw new OocsiInvalidArgumentException("Component name cannot be null or blank");
        }
        components.put(name, component);
        logAdded(name, "components");
        return this;
    }

    private static Map<String, Object> component(String channel, String type) {
        Map<String, Object> component = new LinkedHashMap<>();
        component.put("channel_name", channel);
        component.put("type", type);
        return component;
    }

    private void logAdded(String name, String section) {
        log.debug("[{}]: added {} to the {} of device {}", client.getHandle(), name, section, deviceName);
    }
}
