package com.p14n.upsbridge.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.upsbridge.broker.MessageBus;
import com.p14n.upsbridge.data.Topics;
import com.p14n.upsbridge.data.UpsField;

/**
 * Publishes the retained dashboard discovery configuration for one device:
 * one sensor per field, with {@code power_failure} as a binary sensor.
 */
public class DiscoveryPublisher {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryPublisher.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final MessageBus bus;
    private final String namespace;
    private final String deviceId;
    private final String deviceName;
    private final String manufacturer;
    private final String model;

    public DiscoveryPublisher(MessageBus bus, String namespace, String deviceId, String deviceName,
            String manufacturer, String model) {
        this.bus = bus;
        this.namespace = namespace;
        this.deviceId = deviceId;
        this.deviceName = deviceName;
        this.manufacturer = manufacturer;
        this.model = model;
    }

    /**
     * Publishes every field's configuration, retained with QoS 1.
     *
     * @return true only if every publish was accepted
     */
    public boolean publishAll() {
        boolean allAccepted = true;
        for (UpsField field : UpsField.values()) {
            allAccepted &= bus.publish(Topics.config(namespace, deviceId, field), payload(field), 1, true);
        }
        if (allAccepted) {
            logger.atInfo().log("Published discovery for {} ({} entities)", deviceId, UpsField.values().length);
        } else {
            logger.atWarn().log("Some discovery messages for {} were not accepted", deviceId);
        }
        return allAccepted;
    }

    /**
     * Clears every retained configuration, which removes the device from the
     * dashboard.
     */
    public boolean removeDevice() {
        boolean allAccepted = true;
        for (UpsField field : UpsField.values()) {
            allAccepted &= bus.publish(Topics.config(namespace, deviceId, field), "", 1, true);
        }
        logger.atInfo().log("Removed discovery for {} (all accepted: {})", deviceId, allAccepted);
        return allAccepted;
    }

    ObjectNode config(UpsField field) {
        ObjectNode config = mapper.createObjectNode();
        config.put("name", field.displayName());
        config.put("unique_id", deviceId + "_" + field.topicName());
        config.put("state_topic", Topics.state(namespace, deviceId, field.topicName()));
        if (field.isBinary()) {
            config.put("payload_on", "1");
            config.put("payload_off", "0");
        }
        ObjectNode device = config.putObject("device");
        device.putArray("identifiers").add(deviceId);
        device.put("name", deviceName);
        device.put("manufacturer", manufacturer);
        device.put("model", model);

        field.unit().ifPresent(u -> config.put("unit_of_measurement", u));
        field.deviceClass().ifPresent(c -> config.put("device_class", c));
        field.stateClass().ifPresent(c -> config.put("state_class", c));
        field.icon().ifPresent(i -> config.put("icon", i));
        return config;
    }

    String payload(UpsField field) {
        try {
            return mapper.writeValueAsString(config(field));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialise discovery config for " + field.topicName(), e);
        }
    }
}
