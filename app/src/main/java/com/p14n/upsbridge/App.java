package com.p14n.upsbridge;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.upsbridge.bridge.BridgeSettings;
import com.p14n.upsbridge.bridge.DiscoveryPublisher;
import com.p14n.upsbridge.bridge.NutTelemetrySource;
import com.p14n.upsbridge.bridge.TelemetryBridge;
import com.p14n.upsbridge.broker.BusCredentials;
import com.p14n.upsbridge.broker.MqttMessageBus;
import com.p14n.upsbridge.collector.Collector;
import com.p14n.upsbridge.collector.CollectorSettings;
import com.p14n.upsbridge.data.ConfigData;
import com.p14n.upsbridge.data.DeviceRegistry;
import com.p14n.upsbridge.db.DatabaseSetup;
import com.p14n.upsbridge.db.JdbcMetricsSink;
import com.p14n.upsbridge.db.PoolSetup;
import com.p14n.upsbridge.status.HealthCheck;
import com.p14n.upsbridge.telemetry.DefaultTelemetryConfig;
import com.p14n.upsbridge.vertx.StatusServer;
import com.zaxxer.hikari.HikariDataSource;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;

/**
 * Starts the NUT bridge, the collector and the status server, and stops them
 * in reverse order on shutdown.
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final String SERVICE_NAME = "ups-bridge";

    private final List<AutoCloseable> closeables = new ArrayList<>();

    public static void main(String[] args) throws InterruptedException {
        ConfigData cfg;
        try {
            cfg = ConfigData.fromEnv(System.getenv());
        } catch (IllegalArgumentException e) {
            logger.atError().setCause(e).log("Invalid configuration");
            System.exit(1);
            return;
        }

        App app = new App();
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.atInfo().log("Shutdown requested");
            app.close();
            stopped.countDown();
        }, "ups-bridge-shutdown"));

        try {
            app.start(cfg);
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Startup failed");
            System.exit(1);
        }
        stopped.await();
    }

    void start(ConfigData cfg) {
        logger.atInfo().log("Starting {} with {}", SERVICE_NAME, cfg);

        DefaultTelemetryConfig telemetry = new DefaultTelemetryConfig(SERVICE_NAME);
        closeables.add(telemetry::shutdown);
        OpenTelemetry ot = telemetry.getOpenTelemetry();

        DeviceRegistry registry = DeviceRegistry.fromConfig(cfg);

        MqttMessageBus bus = new MqttMessageBus(cfg.mqttClientId(), ot);
        closeables.add(bus);
        if (!bus.connect(cfg.mqttAddress(), new BusCredentials(cfg.mqttUser(), cfg.mqttPassword()))) {
            logger.atWarn().log("MQTT broker not reachable yet, retrying in the background");
        }

        HikariDataSource ds = PoolSetup.createPool(cfg);
        closeables.add(ds);
        try {
            new DatabaseSetup(ds).setupAll();
        } catch (RuntimeException e) {
            logger.atWarn().setCause(e).log("Database setup failed, inserts will fail until it is reachable");
        }
        JdbcMetricsSink sink = new JdbcMetricsSink(ds, registry);

        NutTelemetrySource source = new NutTelemetrySource(cfg.nutHost(), cfg.nutPort(), cfg.nutUpsName());
        DiscoveryPublisher discovery = new DiscoveryPublisher(bus, cfg.namespace(), cfg.nutDeviceId(),
                cfg.nutDeviceName(), cfg.deviceManufacturer(), cfg.deviceModel());
        TelemetryBridge bridge = new TelemetryBridge(source, bus, discovery,
                BridgeSettings.of(cfg.nutDeviceId(), cfg.namespace(), cfg.pollInterval()), ot);
        closeables.add(bridge);
        bridge.start();

        Collector collector = new Collector(bus, sink, registry,
                CollectorSettings.of(cfg.namespace(), cfg.saveInterval(), cfg.maxUntrackedDevices()), ot);
        closeables.add(collector);
        collector.start();

        Vertx vertx = Vertx.vertx();
        closeables.add(vertx::close);
        HealthCheck health = new HealthCheck(SERVICE_NAME, version(), bus, sink, List.of(bridge), collector);
        StatusServer status = new StatusServer(vertx, health);
        closeables.add(status);
        status.start(cfg.healthCheckPort());

        logger.atInfo().log("{} running, health on http://localhost:{}/health", SERVICE_NAME,
                cfg.healthCheckPort());
    }

    void close() {
        for (int i = closeables.size() - 1; i >= 0; i--) {
            try {
                closeables.get(i).close();
            } catch (Exception e) {
                logger.atWarn().setCause(e).log("Error during shutdown");
            }
        }
        closeables.clear();
        logger.atInfo().log("{} stopped", SERVICE_NAME);
    }

    static String version() {
        String v = App.class.getPackage().getImplementationVersion();
        return v == null ? "1.0" : v;
    }
}
