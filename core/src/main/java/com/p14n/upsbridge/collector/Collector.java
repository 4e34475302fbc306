package com.p14n.upsbridge.collector;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.p14n.upsbridge.broker.BusMessage;
import com.p14n.upsbridge.broker.MessageBus;
import com.p14n.upsbridge.data.DeviceRecord;
import com.p14n.upsbridge.data.DeviceRegistry;
import com.p14n.upsbridge.data.Topics;
import com.p14n.upsbridge.telemetry.CollectorMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static com.p14n.upsbridge.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Merges per-field state updates from the bus into one record per device and
 * writes each device to a {@link MetricsSink} on its own rolling schedule.
 *
 * <p>
 * A device that has never been saved is written at the next check; after
 * that it is written once the save interval has elapsed since its last
 * successful save. A failed write leaves the device due, so it is retried at
 * the next check.
 * </p>
 *
 * <p>
 * {@code recordsLock} guards the records and the untracked set,
 * {@code saveTimesLock} the save times. When both are needed they are taken
 * in that order. Flushes run under {@code recordsLock}; the sink receives a
 * snapshot.
 * </p>
 */
public class Collector implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Collector.class);

    private final MessageBus bus;
    private final MetricsSink sink;
    private final DeviceRegistry registry;
    private final CollectorSettings settings;
    private final Clock clock;
    private final CollectorMetrics metrics;
    private final Tracer tracer;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread thread;
    private final List<String> patterns = new ArrayList<>();

    private final Object recordsLock = new Object();
    private final Map<String, DeviceRecord> records = new HashMap<>();
    private final LinkedHashMap<String, Boolean> untracked = new LinkedHashMap<>(16, 0.75f, true);

    private final Object saveTimesLock = new Object();
    private final Map<String, Instant> saveTimes = new HashMap<>();
    private Instant lastSaveTime;

    public Collector(MessageBus bus, MetricsSink sink, DeviceRegistry registry, CollectorSettings settings,
            OpenTelemetry ot) {
        this(bus, sink, registry, settings, ot, Clock.systemUTC());
    }

    public Collector(MessageBus bus, MetricsSink sink, DeviceRegistry registry, CollectorSettings settings,
            OpenTelemetry ot, Clock clock) {
        this.bus = bus;
        this.sink = sink;
        this.registry = registry;
        this.settings = settings;
        this.clock = clock;
        this.metrics = new CollectorMetrics(ot.getMeter("com.p14n.upsbridge.collector"));
        this.tracer = ot.getTracer("com.p14n.upsbridge.collector");
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        patterns.clear();
        for (String deviceId : registry.deviceIds()) {
            patterns.add(Topics.deviceStatePattern(settings.namespace(), deviceId));
        }
        if (!bus.subscribeAll(patterns, this::onMessage, 1)) {
            logger.atWarn().log("Not all collector subscriptions were sent, they will be sent on connect");
        }
        thread = new ThreadFactoryBuilder()
                .setNameFormat("collector-flush-%d")
                .build()
                .newThread(this::run);
        thread.start();
        logger.atInfo().log("Collector started for {} device(s), save interval {}s", patterns.size(),
                settings.saveInterval().toSeconds());
    }

    /**
     * Stops the flush loop and writes every buffered device.
     */
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
        for (String pattern : patterns) {
            bus.unsubscribe(pattern);
        }
        int flushed = flushAll();
        logger.atInfo().log("Collector stopped, flushed {} device(s)", flushed);
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the latest successful save across all devices
     */
    public Optional<Instant> getLastSaveTime() {
        synchronized (saveTimesLock) {
            return Optional.ofNullable(lastSaveTime);
        }
    }

    public int getDeviceCount() {
        synchronized (recordsLock) {
            return records.size();
        }
    }

    Optional<DeviceRecord> snapshot(String storageKey) {
        synchronized (recordsLock) {
            return Optional.ofNullable(records.get(storageKey)).map(DeviceRecord::snapshot);
        }
    }

    /**
     * Merges one state message into the device record it belongs to.
     */
    void onMessage(BusMessage message) {
        Optional<Topics.StateTopic> parsed = Topics.parseState(settings.namespace(), message.topic());
        if (parsed.isEmpty()) {
            logger.atDebug().log("Ignoring message on {}", message.topic());
            return;
        }
        String deviceId = parsed.get().deviceId();
        String storageKey = registry.storageKey(deviceId);
        Instant now = clock.instant();
        boolean applied;
        synchronized (recordsLock) {
            DeviceRecord record = records.get(storageKey);
            if (record == null) {
                record = new DeviceRecord(deviceId, now);
                records.put(storageKey, record);
                logger.atInfo().log("First update from {} (stored as {})", deviceId, storageKey);
            }
            applied = record.applyUpdate(parsed.get().field(), message.payload(), now);
            if (!registry.isKnown(deviceId)) {
                trackUntracked(storageKey);
            }
        }
        if (!applied) {
            logger.atDebug().log("Ignored update {}={} for {}", parsed.get().field(), message.payload(), deviceId);
        }
    }

    // caller holds recordsLock
    private void trackUntracked(String storageKey) {
        untracked.put(storageKey, Boolean.TRUE);
        if (untracked.size() <= settings.maxUntrackedDevices()) {
            return;
        }
        Iterator<String> eldest = untracked.keySet().iterator();
        String evicted = eldest.next();
        eldest.remove();
        records.remove(evicted);
        synchronized (saveTimesLock) {
            saveTimes.remove(evicted);
        }
        logger.atWarn().log("Evicted untracked device {}", evicted);
    }

    /**
     * Writes every device that is due.
     *
     * @return the number of devices written
     */
    public int tick() {
        return flush(false);
    }

    int flushAll() {
        return flush(true);
    }

    private int flush(boolean all) {
        Instant now = clock.instant();
        int written = 0;
        synchronized (recordsLock) {
            for (Map.Entry<String, DeviceRecord> e : records.entrySet()) {
                String storageKey = e.getKey();
                if (all || isDue(storageKey, now)) {
                    try {
                        if (flushDevice(storageKey, e.getValue(), now)) {
                            written++;
                        }
                    } catch (RuntimeException ex) {
                        metrics.recordFailure(storageKey);
                        logger.atError().setCause(ex).log("Flush of {} failed", storageKey);
                    }
                }
            }
        }
        return written;
    }

    private boolean isDue(String storageKey, Instant now) {
        Instant last;
        synchronized (saveTimesLock) {
            last = saveTimes.get(storageKey);
        }
        return last == null || Duration.between(last, now).compareTo(settings.saveInterval()) >= 0;
    }

    // caller holds recordsLock
    private boolean flushDevice(String storageKey, DeviceRecord record, Instant now) {
        if (!record.isComplete()) {
            metrics.recordSkipped(storageKey);
            logger.atWarn().log("Skipping save of {}: status or battery charge not yet known", storageKey);
            return false;
        }
        DeviceRecord snapshot = record.snapshot();
        boolean stored = processWithTelemetry(tracer, "collector_flush", storageKey,
                () -> sink.insert(storageKey, snapshot));
        if (!stored) {
            metrics.recordFailure(storageKey);
            logger.atWarn().log("Save of {} failed, will retry", storageKey);
            return false;
        }
        synchronized (saveTimesLock) {
            saveTimes.put(storageKey, now);
            lastSaveTime = now;
        }
        metrics.recordSaved(storageKey);
        logger.atInfo().log("Saved {} ({} fields)", storageKey, snapshot.size());
        return true;
    }

    // checks before sleeping, so state retained at startup is saved at once
    private void run() {
        while (running.get()) {
            try {
                tick();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Collector tick failed");
            }
            sleep(settings.checkPeriod());
        }
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
