package com.p14n.upsbridge.data;

import java.util.Optional;

/**
 * Builds and parses the bus topics used for device state and discovery.
 *
 * <pre>
 * &lt;ns&gt;/sensor/&lt;device&gt;/&lt;field&gt;/state
 * &lt;ns&gt;/sensor/&lt;device&gt;/&lt;field&gt;/config
 * &lt;ns&gt;/binary_sensor/&lt;device&gt;/&lt;field&gt;/config
 * &lt;ns&gt;/status
 * </pre>
 */
public final class Topics {

    public static final String DEFAULT_NAMESPACE = "homeassistant";

    private Topics() {
    }

    public static String state(String namespace, String deviceId, String field) {
        return namespace + "/sensor/" + deviceId + "/" + field + "/state";
    }

    public static String config(String namespace, String deviceId, UpsField field) {
        String component = field.isBinary() ? "binary_sensor" : "sensor";
        return namespace + "/" + component + "/" + deviceId + "/" + field.topicName() + "/config";
    }

    /**
     * Pattern matching every field state of one device.
     */
    public static String deviceStatePattern(String namespace, String deviceId) {
        return namespace + "/sensor/" + deviceId + "/+/state";
    }

    public static String dashboardStatus(String namespace) {
        return namespace + "/status";
    }

    /**
     * Device id and field name carried by a state topic.
     */
    public record StateTopic(String deviceId, String field) {
    }

    /**
     * Parses {@code <ns>/sensor/<device>/<field>/state}.
     *
     * @return empty for any topic of another shape or namespace
     */
    public static Optional<StateTopic> parseState(String namespace, String topic) {
        if (topic == null) {
            return Optional.empty();
        }
        String[] levels = topic.split("/", -1);
        if (levels.length != 5
                || !levels[0].equals(namespace)
                || !levels[1].equals("sensor")
                || !levels[4].equals("state")
                || levels[2].isEmpty()
                || levels[3].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new StateTopic(levels[2], levels[3]));
    }
}
