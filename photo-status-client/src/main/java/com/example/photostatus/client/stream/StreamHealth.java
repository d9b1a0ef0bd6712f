package com.example.photostatus.client.stream;

import lombok.extern.slf4j.Slf4j;

/**
 * Whether the push stream is currently delivering, and how many connection attempts in a row
 * have failed. Written only by the connector; read by polling and coordination.
 */
@Slf4j
public class StreamHealth {

    private volatile boolean active;
    private volatile int consecutiveFailures;

    public boolean isActive() {
        return active;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void markHealthy() {
        if (!active || consecutiveFailures != 0) {
            log.debug("Event stream healthy after {} failures", consecutiveFailures);
        }
        active = true;
        consecutiveFailures = 0;
    }

    public int recordFailure() {
        active = false;
        return ++consecutiveFailures;
    }

    public void markInactive() {
        active = false;
    }
}
