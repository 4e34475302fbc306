package com.p14n.upsbridge.broker;

import java.nio.charset.StandardCharsets;

/**
 * A message travelling over the bus, in either direction.
 *
 * @param topic    concrete topic, never a pattern
 * @param payload  UTF-8 payload text
 * @param qos      requested delivery level (0, 1 or 2)
 * @param retained whether the broker keeps the message for late subscribers
 */
public record BusMessage(String topic, String payload, int qos, boolean retained) {

    public BusMessage {
        if (topic == null || topic.isEmpty()) {
            throw new IllegalArgumentException("Topic cannot be null or empty");
        }
        if (qos < 0 || qos > 2) {
            throw new IllegalArgumentException("QoS must be 0, 1 or 2");
        }
        payload = payload == null ? "" : payload;
    }

    public static BusMessage of(String topic, byte[] payload, int qos, boolean retained) {
        return new BusMessage(topic, new String(payload, StandardCharsets.UTF_8), qos, retained);
    }

    public byte[] payloadBytes() {
        return payload.getBytes(StandardCharsets.UTF_8);
    }
}
