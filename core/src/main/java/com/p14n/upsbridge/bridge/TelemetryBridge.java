package com.p14n.upsbridge.bridge;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.p14n.upsbridge.broker.Backoff;
import com.p14n.upsbridge.broker.BusMessage;
import com.p14n.upsbridge.broker.ConnectionListener;
import com.p14n.upsbridge.broker.MessageBus;
import com.p14n.upsbridge.data.DeviceRecord;
import com.p14n.upsbridge.data.Topics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static com.p14n.upsbridge.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Polls a telemetry source on a fixed interval and publishes each reading to
 * the bus, one message per field.
 *
 * <p>
 * The discovery configuration is published, retained, before the first state
 * message of every bus session. It is published again when the dashboard
 * announces {@code online} on {@code <ns>/status}.
 * </p>
 *
 * <p>
 * The loop runs on its own thread. {@code lock} guards the last poll time,
 * the discovery flag and the connect attempt counter; no call into the bus or
 * the source is made while holding it.
 * </p>
 */
public class TelemetryBridge implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TelemetryBridge.class);

    private final TelemetrySource source;
    private final MessageBus bus;
    private final DiscoveryPublisher discovery;
    private final BridgeSettings settings;
    private final Clock clock;
    private final Tracer tracer;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile BridgeState state = BridgeState.IDLE;
    private Thread thread;

    private final Object lock = new Object();
    private Instant lastPollTime;
    private boolean discoveryPublished;
    private int connectAttempts;

    public TelemetryBridge(TelemetrySource source, MessageBus bus, DiscoveryPublisher discovery,
            BridgeSettings settings, OpenTelemetry ot) {
        this(source, bus, discovery, settings, ot, Clock.systemUTC());
    }

    public TelemetryBridge(TelemetrySource source, MessageBus bus, DiscoveryPublisher discovery,
            BridgeSettings settings, OpenTelemetry ot, Clock clock) {
        this.source = source;
        this.bus = bus;
        this.discovery = discovery;
        this.settings = settings;
        this.clock = clock;
        this.tracer = ot.getTracer("com.p14n.upsbridge.bridge");
        bus.addConnectionListener(new ConnectionListener() {
            @Override
            public void onConnectionLost(Throwable cause) {
                clearDiscoveryFlag();
            }
        });
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        bus.subscribe(statusTopic(), this::onDashboardStatus, 1);
        thread = new ThreadFactoryBuilder()
                .setNameFormat("nut-bridge-" + settings.deviceId())
                .build()
                .newThread(this::run);
        thread.start();
        logger.atInfo().log("Bridge for {} started (poll interval {}s)", settings.deviceId(),
                settings.pollInterval().toSeconds());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread t = thread;
        if (t != null) {
            t.interrupt();
            try {
                t.join(settings.sleepSlice().toMillis() * 5 + 5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        bus.unsubscribe(statusTopic());
        source.disconnect();
        state = BridgeState.IDLE;
        logger.atInfo().log("Bridge for {} stopped", settings.deviceId());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public BridgeState getState() {
        return state;
    }

    public Optional<Instant> getLastPollTime() {
        synchronized (lock) {
            return Optional.ofNullable(lastPollTime);
        }
    }

    public String getDeviceId() {
        return settings.deviceId();
    }

    /**
     * Publishes the discovery configuration now, regardless of whether it was
     * already published this session.
     *
     * @return false when the bus is disconnected or a publish was refused
     */
    public boolean republishDiscovery() {
        if (!bus.isConnected()) {
            logger.atWarn().log("Cannot republish discovery for {}: bus disconnected", settings.deviceId());
            return false;
        }
        try {
            boolean published = discovery.publishAll();
            if (published) {
                synchronized (lock) {
                    discoveryPublished = true;
                }
            }
            return published;
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Discovery republish for {} failed", settings.deviceId());
            return false;
        }
    }

    /**
     * Removes this device from the dashboard.
     */
    public boolean removeDiscovery() {
        if (!bus.isConnected()) {
            return false;
        }
        clearDiscoveryFlag();
        return discovery.removeDevice();
    }

    private String statusTopic() {
        return Topics.dashboardStatus(settings.namespace());
    }

    private void onDashboardStatus(BusMessage message) {
        if ("online".equalsIgnoreCase(message.payload().trim())) {
            logger.atInfo().log("Dashboard came online, republishing discovery for {}", settings.deviceId());
            republishDiscovery();
        }
    }

    private void clearDiscoveryFlag() {
        synchronized (lock) {
            discoveryPublished = false;
        }
    }

    private void run() {
        while (running.get()) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Bridge cycle for {} failed", settings.deviceId());
                sleep(backoffDelay());
            }
        }
    }

    /**
     * Runs one cycle: connect if needed, poll, convert, publish, then sleep the
     * poll interval.
     */
    void pollOnce() {
        if (!source.isConnected()) {
            state = BridgeState.CONNECTING;
            if (!source.connect()) {
                Duration delay = backoffDelay();
                logger.atWarn().log("Telemetry source for {} unavailable, retrying in {}s",
                        settings.deviceId(), delay.toSeconds());
                sleep(delay);
                return;
            }
            synchronized (lock) {
                connectAttempts = 0;
            }
        }

        state = BridgeState.POLLING;
        Map<String, String> vars = processWithTelemetry(tracer, "nut_poll", settings.deviceId(),
                source::fetchAll);
        if (vars.isEmpty()) {
            logger.atWarn().log("No variables read for {}", settings.deviceId());
            sleepInterval();
            return;
        }
        Instant now = clock.instant();
        synchronized (lock) {
            lastPollTime = now;
        }

        DeviceRecord record = DeviceRecord.fromTelemetry(settings.deviceId(), vars, now);
        if (!record.isComplete()) {
            logger.atWarn().log("Reading for {} lacks status or battery charge, discarding", settings.deviceId());
            sleepInterval();
            return;
        }

        state = BridgeState.PUBLISHING;
        ensureDiscovery();
        int published = 0;
        for (BusMessage m : record.toStateMessages(settings.namespace())) {
            if (bus.publish(m)) {
                published++;
            }
        }
        logger.atDebug().log("Published {}/{} fields for {}", published, record.size(), settings.deviceId());
        sleepInterval();
    }

    private void ensureDiscovery() {
        if (!bus.isConnected()) {
            clearDiscoveryFlag();
            return;
        }
        boolean needed;
        synchronized (lock) {
            needed = !discoveryPublished;
        }
        if (needed && discovery.publishAll()) {
            synchronized (lock) {
                discoveryPublished = true;
            }
        }
    }

    boolean isDiscoveryPublished() {
        synchronized (lock) {
            return discoveryPublished;
        }
    }

    private Duration backoffDelay() {
        int attempt;
        synchronized (lock) {
            attempt = connectAttempts++;
        }
        return Backoff.next(attempt, settings.backoffBase(), settings.backoffMax());
    }

    private void sleepInterval() {
        state = BridgeState.SLEEPING;
        sleep(settings.pollInterval());
    }

    private void sleep(Duration duration) {
        long remaining = duration.toMillis();
        long slice = Math.max(1, settings.sleepSlice().toMillis());
        try {
            while (running.get() && remaining > 0) {
                long s = Math.min(slice, remaining);
                Thread.sleep(s);
                remaining -= s;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
