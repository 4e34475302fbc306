package com.p14n.upsbridge.data;

/**
 * A configured device.
 *
 * @param deviceId   id used in bus topics
 * @param storageKey id used as the storage key
 * @param label      human-readable name
 */
public record DeviceEntry(String deviceId, String storageKey, String label) {

    public DeviceEntry {
        if (deviceId == null || deviceId.isEmpty()) {
            throw new IllegalArgumentException("Device id cannot be null or empty");
        }
        storageKey = storageKey == null || storageKey.isEmpty() ? deviceId : storageKey;
        label = label == null || label.isEmpty() ? defaultLabel(deviceId) : label;
    }

    /**
     * {@code living_room_ups} becomes {@code Living room ups}.
     */
    public static String defaultLabel(String deviceId) {
        String name = deviceId.replace('_', ' ');
        if (name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
