package com.p14n.upsbridge.status;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.upsbridge.bridge.TelemetryBridge;
import com.p14n.upsbridge.broker.MessageBus;
import com.p14n.upsbridge.collector.Collector;
import com.p14n.upsbridge.collector.MetricsSink;

/**
 * Summarises component state for the status surface. Every probe is
 * non-blocking.
 */
public class HealthCheck {

    private static final Logger logger = LoggerFactory.getLogger(HealthCheck.class);

    private final String service;
    private final String version;
    private final MessageBus bus;
    private final MetricsSink sink;
    private final List<TelemetryBridge> bridges;
    private final Collector collector;

    public HealthCheck(String service, String version, MessageBus bus, MetricsSink sink,
            List<TelemetryBridge> bridges, Collector collector) {
        this.service = service;
        this.version = version;
        this.bus = bus;
        this.sink = sink;
        this.bridges = List.copyOf(bridges);
        this.collector = collector;
    }

    public HealthReport report() {
        boolean mqtt = bus.isConnected();
        boolean database = sink.isAvailable();
        boolean bridgesRunning = !bridges.isEmpty() && bridges.stream().allMatch(TelemetryBridge::isRunning);
        boolean collectorRunning = collector.isRunning();

        Map<String, String> components = new LinkedHashMap<>();
        components.put("mqtt", mqtt ? "connected" : "disconnected");
        components.put("database", database ? "connected" : "disconnected");
        components.put("nut_bridge", bridgesRunning ? "running" : "stopped");
        components.put("collector", collectorRunning ? "running" : "stopped");

        boolean healthy = mqtt && database && bridgesRunning && collectorRunning;

        Optional<Instant> lastPoll = bridges.stream()
                .map(TelemetryBridge::getLastPollTime)
                .flatMap(Optional::stream)
                .max(Instant::compareTo);

        return new HealthReport(service, version,
                healthy ? HealthReport.HEALTHY : HealthReport.DEGRADED,
                components,
                lastPoll.map(HealthCheck::iso).orElse(null),
                collector.getLastSaveTime().map(HealthCheck::iso).orElse(null),
                collector.getDeviceCount());
    }

    /**
     * Republishes discovery on every bridge.
     *
     * @return true only if every bridge republished
     */
    public boolean republishDiscovery() {
        boolean all = !bridges.isEmpty();
        for (TelemetryBridge b : bridges) {
            all &= b.republishDiscovery();
        }
        logger.atInfo().log("Discovery republish requested, success: {}", all);
        return all;
    }

    static String iso(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}
