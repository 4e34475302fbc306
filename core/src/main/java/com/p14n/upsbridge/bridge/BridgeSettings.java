package com.p14n.upsbridge.bridge;

import java.time.Duration;

import com.p14n.upsbridge.broker.Backoff;

/**
 * Timing and identity of one bridge.
 *
 * @param deviceId     device id used in topics
 * @param namespace    topic namespace
 * @param pollInterval time between polls
 * @param backoffBase  first delay after a failed source connect
 * @param backoffMax   cap on the source connect delay
 * @param sleepSlice   longest uninterrupted sleep, bounds stop latency
 */
public record BridgeSettings(String deviceId,
        String namespace,
        Duration pollInterval,
        Duration backoffBase,
        Duration backoffMax,
        Duration sleepSlice) {

    public static BridgeSettings of(String deviceId, String namespace, Duration pollInterval) {
        return new BridgeSettings(deviceId, namespace, pollInterval,
                Backoff.DEFAULT_BASE, Backoff.DEFAULT_MAX, Duration.ofSeconds(1));
    }
}
