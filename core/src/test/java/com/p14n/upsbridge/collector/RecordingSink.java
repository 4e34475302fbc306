package com.p14n.upsbridge.collector;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import com.p14n.upsbridge.data.DeviceRecord;

/**
 * Sink that keeps every stored snapshot and can be told to fail.
 */
public class RecordingSink implements MetricsSink {

    public record Insert(String storageKey, DeviceRecord record) {
    }

    private final List<Insert> inserts = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private volatile boolean available = true;

    public void failNext(int count) {
        failuresLeft.set(count);
    }

    @Override
    public boolean insert(String storageKey, DeviceRecord record) {
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            available = false;
            return false;
        }
        available = true;
        inserts.add(new Insert(storageKey, record));
        return true;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    public List<Insert> inserts() {
        return List.copyOf(inserts);
    }
}
