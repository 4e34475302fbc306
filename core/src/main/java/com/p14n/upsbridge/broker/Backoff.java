package com.p14n.upsbridge.broker;

import java.time.Duration;

/**
 * Capped exponential backoff: {@code min(max, base * 2^attempt)}.
 */
public final class Backoff {

    public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(64);

    private Backoff() {
    }

    /**
     * @param attempt retry attempt number, 0-based; negative values count as 0
     * @param base    delay of the first attempt
     * @param max     cap
     * @return the delay before the given attempt
     */
    public static Duration next(int attempt, Duration base, Duration max) {
        long baseMs = base.toMillis();
        // exponent capped so the shift cannot overflow
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20));
        return Duration.ofMillis(Math.min(expMs, max.toMillis()));
    }

    public static Duration next(int attempt) {
        return next(attempt, DEFAULT_BASE, DEFAULT_MAX);
    }
}
