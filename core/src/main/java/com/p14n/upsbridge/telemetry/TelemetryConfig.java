package com.p14n.upsbridge.telemetry;

import io.opentelemetry.api.OpenTelemetry;

public interface TelemetryConfig {
    OpenTelemetry getOpenTelemetry();
}
