package com.p14n.upsbridge.collector;

import com.p14n.upsbridge.data.DeviceRecord;

/**
 * Durable store for device snapshots.
 */
public interface MetricsSink {

    /**
     * Writes one snapshot. Implementations retry internally and never throw
     * for storage failures.
     *
     * @param storageKey storage key of the device
     * @param record     snapshot owned by the sink
     * @return true if the snapshot was stored
     */
    boolean insert(String storageKey, DeviceRecord record);

    /**
     * @return outcome of the last interaction with the store; never blocks
     */
    boolean isAvailable();
}
