package com.p14n.upsbridge.data;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DeviceRegistryTest {

    @Test
    public void configuredDevicesUseOverrides() {
        DeviceRegistry registry = new DeviceRegistry(List.of("apc_ups", "eaton"),
                Map.of("apc_ups", "apc_bx1000"),
                Map.of("eaton", "Rack UPS"));

        assertEquals(List.of("apc_ups", "eaton"), registry.deviceIds());
        assertEquals("apc_bx1000", registry.storageKey("apc_ups"));
        assertEquals("eaton", registry.storageKey("eaton"));
        assertEquals("Apc ups", registry.label("apc_ups"));
        assertEquals("Rack UPS", registry.label("eaton"));
        assertEquals("apc_ups", registry.deviceIdForStorageKey("apc_bx1000"));
        assertEquals("Apc ups", registry.labelForStorageKey("apc_bx1000"));
    }

    @Test
    public void unknownDevicesMapToThemselves() {
        DeviceRegistry registry = new DeviceRegistry();

        assertFalse(registry.isKnown("garage_ups"));
        assertEquals("garage_ups", registry.storageKey("garage_ups"));
        assertEquals("garage_ups", registry.deviceIdForStorageKey("garage_ups"));
        assertEquals("Garage ups", registry.label("garage_ups"));
    }

    @Test
    public void registerAddsOrReplacesDevice() {
        DeviceRegistry registry = new DeviceRegistry();
        registry.register(new DeviceEntry("d1", "key1", "First"));
        registry.register(new DeviceEntry("d1", "key2", "Renamed"));

        assertEquals(List.of("d1"), registry.deviceIds());
        assertEquals("key2", registry.storageKey("d1"));
        assertEquals("Renamed", registry.label("d1"));
        assertEquals("key1", registry.deviceIdForStorageKey("key1"));
        assertEquals("d1", registry.deviceIdForStorageKey("key2"));
    }

    @Test
    public void defaultLabelCapitalisesAndSpaces() {
        assertEquals("Living room ups", DeviceEntry.defaultLabel("living_room_ups"));
        assertEquals("", DeviceEntry.defaultLabel(""));
    }
}
