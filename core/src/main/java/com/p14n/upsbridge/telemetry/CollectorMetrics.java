package com.p14n.upsbridge.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Counters for the collector flush path, tagged by storage key.
 */
public class CollectorMetrics {
        private static final AttributeKey<String> DEVICE = AttributeKey.stringKey("device");

        private final LongCounter recordsSaved;
        private final LongCounter saveFailures;
        private final LongCounter recordsSkipped;

        public CollectorMetrics(Meter meter) {
                recordsSaved = meter.counterBuilder("records_saved")
                                .setDescription("Number of device snapshots written to storage")
                                .build();

                saveFailures = meter.counterBuilder("save_failures")
                                .setDescription("Number of device snapshots the sink rejected")
                                .build();

                recordsSkipped = meter.counterBuilder("records_skipped")
                                .setDescription("Number of incomplete snapshots not written")
                                .build();
        }

        public void recordSaved(String device) {
                recordsSaved.add(1, Attributes.of(DEVICE, device));
        }

        public void recordFailure(String device) {
                saveFailures.add(1, Attributes.of(DEVICE, device));
        }

        public void recordSkipped(String device) {
                recordsSkipped.add(1, Attributes.of(DEVICE, device));
        }
}
