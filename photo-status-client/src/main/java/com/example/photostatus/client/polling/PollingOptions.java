package com.example.photostatus.client.polling;

import lombok.Value;

/**
 * Timing for one polling loop, all in milliseconds.
 */
@Value
public class PollingOptions {

    public static final long DEFAULT_INTERVAL_MS = 1_500L;
    public static final long DEFAULT_MAX_INTERVAL_MS = 15_000L;
    public static final long DEFAULT_SOFT_TIMEOUT_MS = 180_000L;
    public static final long DEFAULT_HARD_TIMEOUT_MS = 1_800_000L;

    long intervalMs;
    long maxIntervalMs;
    long softTimeoutMs;
    long hardTimeoutMs;

    public PollingOptions(long intervalMs, long maxIntervalMs, long softTimeoutMs, long hardTimeoutMs) {
        requirePositive("intervalMs", intervalMs);
        requirePositive("maxIntervalMs", maxIntervalMs);
        requirePositive("softTimeoutMs", softTimeoutMs);
        requirePositive("hardTimeoutMs", hardTimeoutMs);
        this.intervalMs = intervalMs;
        this.maxIntervalMs = maxIntervalMs;
        this.softTimeoutMs = softTimeoutMs;
        this.hardTimeoutMs = hardTimeoutMs;
    }

    public static PollingOptions defaults() {
        return new PollingOptions(DEFAULT_INTERVAL_MS, DEFAULT_MAX_INTERVAL_MS, DEFAULT_SOFT_TIMEOUT_MS, DEFAULT_HARD_TIMEOUT_MS);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
    }
}
