package com.p14n.upsbridge.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Configuration of the bridge, the collector and their collaborators.
 *
 * <p>
 * Built from environment variables by {@link #fromEnv(Map)}. Every key has a
 * default except the database credentials.
 * </p>
 */
public record ConfigData(String nutHost,
        int nutPort,
        String nutUpsName,
        String nutDeviceId,
        String nutDeviceName,
        String deviceManufacturer,
        String deviceModel,
        int nutPollIntervalSeconds,
        String mqttBroker,
        int mqttPort,
        String mqttUser,
        String mqttPassword,
        String mqttClientId,
        String namespace,
        String dbHost,
        int dbPort,
        String dbName,
        String dbUser,
        String dbPassword,
        int saveIntervalSeconds,
        int maxUntrackedDevices,
        int healthCheckPort,
        List<String> deviceIds,
        Map<String, String> storageKeys,
        Map<String, String> friendlyNames) implements UpsBridgeConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP = new TypeReference<>() {
    };

    public ConfigData {
        deviceIds = List.copyOf(deviceIds);
        storageKeys = Collections.unmodifiableMap(new LinkedHashMap<>(storageKeys));
        friendlyNames = Collections.unmodifiableMap(new LinkedHashMap<>(friendlyNames));
    }

    /**
     * Reads the configuration from an environment map.
     *
     * @param env usually {@code System.getenv()}
     * @return the configuration
     * @throws IllegalArgumentException for malformed integers, malformed JSON
     *                                  mappings or out-of-range values
     */
    public static ConfigData fromEnv(Map<String, String> env) {
        String nutDeviceId = string(env, "NUT_DEVICE_ID", "ups");
        List<String> deviceIds = csv(env.get("UPS_DEVICE_IDS"));
        if (deviceIds.isEmpty()) {
            deviceIds = List.of(nutDeviceId);
        }
        return new ConfigData(
                string(env, "NUT_HOST", "localhost"),
                port(env, "NUT_PORT", 3493),
                string(env, "NUT_UPS_NAME", "ups@localhost"),
                nutDeviceId,
                string(env, "NUT_DEVICE_NAME", "UPS"),
                string(env, "NUT_DEVICE_MANUFACTURER", "American Power Conversion"),
                string(env, "NUT_DEVICE_MODEL", "Back-UPS XS 1000M"),
                positive(env, "NUT_POLL_INTERVAL", 60),
                string(env, "MQTT_BROKER", "localhost"),
                port(env, "MQTT_PORT", 1883),
                string(env, "MQTT_USER", ""),
                string(env, "MQTT_PASSWORD", ""),
                string(env, "MQTT_CLIENT_ID", "ups_bridge"),
                string(env, "MQTT_NAMESPACE", Topics.DEFAULT_NAMESPACE),
                string(env, "DB_HOST", "localhost"),
                port(env, "DB_PORT", 5432),
                string(env, "DB_NAME", "ups_monitoring"),
                env.get("DB_USER"),
                env.get("DB_PASSWORD"),
                positive(env, "COLLECTOR_SAVE_INTERVAL", 3600),
                positive(env, "COLLECTOR_MAX_UNTRACKED_DEVICES", 32),
                port(env, "HEALTH_CHECK_PORT", 8892),
                deviceIds,
                json(env, "UPS_DB_MAPPING"),
                json(env, "UPS_FRIENDLY_NAMES"));
    }

    private static String string(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return v == null || v.isEmpty() ? defaultValue : v;
    }

    private static int integer(Map<String, String> env, String key, int defaultValue) {
        String v = env.get(key);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + v + "'", e);
        }
    }

    private static int positive(Map<String, String> env, String key, int defaultValue) {
        int v = integer(env, key, defaultValue);
        if (v <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + v);
        }
        return v;
    }

    private static int port(Map<String, String> env, String key, int defaultValue) {
        int v = integer(env, key, defaultValue);
        if (v < 1 || v > 65535) {
            throw new IllegalArgumentException(key + " must be a port number, got " + v);
        }
        return v;
    }

    private static List<String> csv(String value) {
        List<String> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    private static Map<String, String> json(Map<String, String> env, String key) {
        String v = env.get(key);
        if (v == null || v.isBlank()) {
            return Map.of();
        }
        try {
            LinkedHashMap<String, String> m = MAPPER.readValue(v, STRING_MAP);
            return m == null ? Map.of() : m;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(key + " must be a JSON object of strings", e);
        }
    }

    @Override
    public String toString() {
        return "ConfigData[nut=" + nutHost + ":" + nutPort + "/" + nutUpsName
                + ", mqtt=" + mqttBroker + ":" + mqttPort
                + ", db=" + dbHost + ":" + dbPort + "/" + dbName
                + ", devices=" + deviceIds + "]";
    }
}
