package com.p14n.upsbridge.data;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TopicsTest {

    @Test
    public void configTopicDependsOnFieldKind() {
        assertEquals("homeassistant/sensor/apc/battery_charge/config",
                Topics.config("homeassistant", "apc", UpsField.BATTERY_CHARGE));
        assertEquals("homeassistant/binary_sensor/apc/power_failure/config",
                Topics.config("homeassistant", "apc", UpsField.POWER_FAILURE));
    }

    @Test
    public void stateTopicsParseBack() {
        Topics.StateTopic parsed = Topics.parseState("homeassistant",
                "homeassistant/sensor/apc/battery_charge/state").orElseThrow();

        assertEquals("apc", parsed.deviceId());
        assertEquals("battery_charge", parsed.field());
    }

    @Test
    public void malformedStateTopicsAreRejected() {
        assertTrue(Topics.parseState("homeassistant", "homeassistant/sensor/apc/state").isEmpty());
        assertTrue(Topics.parseState("homeassistant", "homeassistant/sensor/apc/x/config").isEmpty());
        assertTrue(Topics.parseState("homeassistant", "other/sensor/apc/x/state").isEmpty());
        assertTrue(Topics.parseState("homeassistant", "homeassistant/binary_sensor/apc/x/state").isEmpty());
        assertTrue(Topics.parseState("homeassistant", "homeassistant/sensor/apc/x/state/extra").isEmpty());
    }
}
