package com.p14n.upsbridge.collector;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.p14n.upsbridge.broker.BusMessage;
import com.p14n.upsbridge.broker.InMemoryMessageBus;
import com.p14n.upsbridge.data.DeviceRecord;
import com.p14n.upsbridge.data.DeviceRegistry;
import com.p14n.upsbridge.data.UpsField;

import io.opentelemetry.api.OpenTelemetry;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import static org.junit.jupiter.api.Assertions.*;

class CompletenessGatePropertiesTest {

    private static final Instant T0 = Instant.parse("2025-06-01T00:00:00Z");

    @Provide
    Arbitrary<Set<UpsField>> fieldsWithoutStatus() {
        return Arbitraries.subsetOf(EnumSet.complementOf(EnumSet.of(UpsField.UPS_STATUS)));
    }

    private static String payloadFor(UpsField field) {
        switch (field.type()) {
            case DECIMAL:
                return "1.5";
            case INTEGER:
                return "2";
            case FLAG:
                return "1";
            default:
                return "x";
        }
    }

    @Property(tries = 200)
    void recordWithoutStatusIsNeverStored(@ForAll("fieldsWithoutStatus") Set<UpsField> fields) {
        RecordingSink sink = new RecordingSink();
        Collector collector = new Collector(new InMemoryMessageBus(true), sink,
                new DeviceRegistry(List.of("d1"), Map.of(), Map.of()),
                CollectorSettings.of("homeassistant", Duration.ofSeconds(3600), 10),
                OpenTelemetry.noop(), Clock.fixed(T0, ZoneOffset.UTC));

        for (UpsField field : fields) {
            collector.onMessage(new BusMessage("homeassistant/sensor/d1/" + field.topicName() + "/state",
                    payloadFor(field), 1, false));
        }

        assertEquals(0, collector.tick());
        assertEquals(0, collector.flushAll());
        assertTrue(sink.inserts().isEmpty());
        assertEquals(fields, collector.snapshot("d1").map(DeviceRecord::presentFields).orElse(Set.of()));
    }
}
