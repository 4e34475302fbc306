package com.p14n.upsbridge.data;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps bus device ids to storage keys and labels. Populated from
 * configuration at startup and read-mostly afterwards. Ids that were never
 * registered map to themselves.
 */
public class DeviceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DeviceRegistry.class);

    private final List<String> deviceIds = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, DeviceEntry> byDeviceId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> byStorageKey = new ConcurrentHashMap<>();

    public DeviceRegistry() {
    }

    /**
     * @param deviceIds     configured device ids, in order
     * @param storageKeys   device id to storage key overrides
     * @param friendlyNames device id to label overrides
     */
    public DeviceRegistry(Collection<String> deviceIds, Map<String, String> storageKeys,
            Map<String, String> friendlyNames) {
        for (String id : deviceIds) {
            register(new DeviceEntry(id, storageKeys.get(id), friendlyNames.get(id)));
        }
        // mappings may also name devices that are not in the id list
        storageKeys.forEach((id, key) -> byStorageKey.putIfAbsent(key, id));
    }

    public static DeviceRegistry fromConfig(UpsBridgeConfig config) {
        return new DeviceRegistry(config.deviceIds(), config.storageKeys(), config.friendlyNames());
    }

    /**
     * Adds or replaces a device.
     */
    public void register(DeviceEntry entry) {
        DeviceEntry previous = byDeviceId.put(entry.deviceId(), entry);
        if (previous == null) {
            deviceIds.add(entry.deviceId());
        } else {
            byStorageKey.remove(previous.storageKey(), previous.deviceId());
        }
        byStorageKey.put(entry.storageKey(), entry.deviceId());
        logger.atInfo().log("Device {} -> {} ({})", entry.deviceId(), entry.storageKey(), entry.label());
    }

    public List<String> deviceIds() {
        return List.copyOf(deviceIds);
    }

    public boolean isKnown(String deviceId) {
        return byDeviceId.containsKey(deviceId);
    }

    public String storageKey(String deviceId) {
        DeviceEntry e = byDeviceId.get(deviceId);
        return e == null ? deviceId : e.storageKey();
    }

    public String deviceIdForStorageKey(String storageKey) {
        return byStorageKey.getOrDefault(storageKey, storageKey);
    }

    public String label(String deviceId) {
        DeviceEntry e = byDeviceId.get(deviceId);
        return e == null ? DeviceEntry.defaultLabel(deviceId) : e.label();
    }

    /**
     * Label for a storage key, used when a device row has to be created.
     */
    public String labelForStorageKey(String storageKey) {
        return label(deviceIdForStorageKey(storageKey));
    }
}
