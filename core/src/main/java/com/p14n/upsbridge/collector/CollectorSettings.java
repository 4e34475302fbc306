package com.p14n.upsbridge.collector;

import java.time.Duration;

/**
 * @param namespace           topic namespace
 * @param saveInterval        minimum time between two saves of one device
 * @param checkPeriod         time between flush checks
 * @param sleepSlice          longest uninterrupted sleep, bounds stop latency
 * @param maxUntrackedDevices records kept for devices outside the registry
 */
public record CollectorSettings(String namespace,
        Duration saveInterval,
        Duration checkPeriod,
        Duration sleepSlice,
        int maxUntrackedDevices) {

    public static CollectorSettings of(String namespace, Duration saveInterval, int maxUntrackedDevices) {
        return new CollectorSettings(namespace, saveInterval, Duration.ofSeconds(60), Duration.ofSeconds(1),
                maxUntrackedDevices);
    }
}
