package com.p14n.upsbridge.data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.p14n.upsbridge.broker.BusMessage;

/**
 * The latest known state of one UPS device. Each field is either present or
 * absent, and a present field is last-write-wins.
 *
 * <p>
 * Instances are mutable and not thread-safe; owners serialize access.
 * {@link #snapshot()} yields an independent copy.
 * </p>
 */
public class DeviceRecord {

    /** Nominal power assumed when the device does not report one. */
    public static final double DEFAULT_NOMINAL_POWER_WATTS = 600.0;

    private final String deviceId;
    private final Instant firstSeen;
    private final EnumMap<UpsField, Object> values;
    private Instant timestamp;

    public DeviceRecord(String deviceId, Instant now) {
        this(deviceId, now, now, new EnumMap<>(UpsField.class));
    }

    private DeviceRecord(String deviceId, Instant firstSeen, Instant timestamp, EnumMap<UpsField, Object> values) {
        if (deviceId == null || deviceId.isEmpty()) {
            throw new IllegalArgumentException("Device id cannot be null or empty");
        }
        this.deviceId = deviceId;
        this.firstSeen = firstSeen;
        this.timestamp = timestamp;
        this.values = values;
    }

    /**
     * Builds a record from a NUT variable snapshot. Empty and unparsable
     * values are left absent. {@code load_watts} and {@code power_failure} are
     * derived here.
     */
    public static DeviceRecord fromTelemetry(String deviceId, Map<String, String> vars, Instant now) {
        DeviceRecord r = new DeviceRecord(deviceId, now);
        for (UpsField f : UpsField.values()) {
            f.nutVariable()
                    .map(vars::get)
                    .flatMap(f.type()::parseValue)
                    .ifPresent(v -> r.values.put(f, v));
        }
        r.getDecimal(UpsField.LOAD_PERCENTAGE).ifPresent(pct -> {
            double nominal = r.getDecimal(UpsField.UPS_NOMINAL_POWER).orElse(DEFAULT_NOMINAL_POWER_WATTS);
            r.values.put(UpsField.LOAD_WATTS, pct / 100.0 * nominal);
        });
        r.getText(UpsField.UPS_STATUS)
                .ifPresent(status -> r.values.put(UpsField.POWER_FAILURE, status.contains("OB")));
        return r;
    }

    /**
     * Merges one field update received from the bus. Exactly the named field
     * is set; nothing is derived.
     *
     * @param fieldName topic field name or alias
     * @param payload   payload text
     * @param now       update time
     * @return true if the record changed; false for unknown fields or
     *         unparsable values, which leave the record untouched
     */
    public boolean applyUpdate(String fieldName, String payload, Instant now) {
        Optional<UpsField> field = UpsField.byName(fieldName);
        if (field.isEmpty()) {
            return false;
        }
        Optional<Object> value = field.get().type().parseValue(payload);
        if (value.isEmpty()) {
            return false;
        }
        values.put(field.get(), value.get());
        timestamp = now;
        return true;
    }

    /**
     * @return true once both the status and the battery charge are known
     */
    public boolean isComplete() {
        return values.containsKey(UpsField.UPS_STATUS) && values.containsKey(UpsField.BATTERY_CHARGE);
    }

    public String deviceId() {
        return deviceId;
    }

    public Instant firstSeen() {
        return firstSeen;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public boolean has(UpsField field) {
        return values.containsKey(field);
    }

    public Optional<Object> get(UpsField field) {
        return Optional.ofNullable(values.get(field));
    }

    public Optional<Double> getDecimal(UpsField field) {
        Object v = values.get(field);
        return v instanceof Number ? Optional.of(((Number) v).doubleValue()) : Optional.empty();
    }

    public Optional<Integer> getInteger(UpsField field) {
        Object v = values.get(field);
        return v instanceof Number ? Optional.of(((Number) v).intValue()) : Optional.empty();
    }

    public Optional<String> getText(UpsField field) {
        Object v = values.get(field);
        return v instanceof String ? Optional.of((String) v) : Optional.empty();
    }

    public Optional<Boolean> getFlag(UpsField field) {
        Object v = values.get(field);
        return v instanceof Boolean ? Optional.of((Boolean) v) : Optional.empty();
    }

    public Set<UpsField> presentFields() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    /**
     * One state message per present field: QoS 1, not retained.
     */
    public List<BusMessage> toStateMessages(String namespace) {
        List<BusMessage> messages = new ArrayList<>(values.size());
        for (Map.Entry<UpsField, Object> e : values.entrySet()) {
            UpsField f = e.getKey();
            messages.add(new BusMessage(Topics.state(namespace, deviceId, f.topicName()),
                    f.type().format(e.getValue()), 1, false));
        }
        return messages;
    }

    public DeviceRecord snapshot() {
        return new DeviceRecord(deviceId, firstSeen, timestamp, new EnumMap<>(values));
    }

    @Override
    public String toString() {
        return "DeviceRecord[" + deviceId + ", " + values.size() + " fields, " + timestamp + "]";
    }
}
