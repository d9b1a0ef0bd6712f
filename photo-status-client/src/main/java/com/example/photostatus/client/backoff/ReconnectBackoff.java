package com.example.photostatus.client.backoff;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Jittered exponential delay between stream reconnect attempts:
 * {@code min(baseMs * 2^attempt, maxMs) * (1 + jitterRatio * (2r - 1))}.
 */
public final class ReconnectBackoff {

    public static final long DEFAULT_BASE_MS = 500L;
    public static final long DEFAULT_MAX_MS = 30_000L;
    public static final double DEFAULT_JITTER_RATIO = 0.2;

    private static final int MAX_EXPONENT = 10;

    private final long baseMs;
    private final long maxMs;
    private final double jitterRatio;
    private final DoubleSupplier random;

    public ReconnectBackoff(long baseMs, long maxMs, double jitterRatio, DoubleSupplier random) {
        if (baseMs <= 0) {
            throw new IllegalArgumentException("baseMs must be positive");
        }
        if (jitterRatio < 0 || jitterRatio > 1) {
            throw new IllegalArgumentException("jitterRatio must be within [0, 1]");
        }
        this.baseMs = baseMs;
        this.maxMs = maxMs;
        this.jitterRatio = jitterRatio;
        this.random = random != null ? random : () -> ThreadLocalRandom.current().nextDouble();
    }

    public static ReconnectBackoff withDefaults() {
        return new ReconnectBackoff(DEFAULT_BASE_MS, DEFAULT_MAX_MS, DEFAULT_JITTER_RATIO, null);
    }

    public long computeReconnectDelayMs(int attempt) {
        return computeReconnectDelayMs(attempt, baseMs, maxMs, jitterRatio, random.getAsDouble());
    }

    /**
     * Negative attempts count as 0 and the exponent stops growing at 10. A non-positive
     * {@code maxMs} leaves the delay uncapped. The result is whole milliseconds, never negative.
     */
    public static long computeReconnectDelayMs(int attempt, long baseMs, long maxMs, double jitterRatio, double randomValue) {
        int exponent = Math.min(Math.max(0, attempt), MAX_EXPONENT);
        double delay = baseMs * Math.pow(2, exponent);
        if (maxMs > 0) {
            delay = Math.min(delay, maxMs);
        }
        double r = Double.isNaN(randomValue) ? 0.5 : Math.min(1.0, Math.max(0.0, randomValue));
        double jittered = delay * (1 + jitterRatio * (2 * r - 1));
        return Math.max(0L, (long) Math.floor(jittered));
    }
}
