package com.example.photostatus.client.polling;

/**
 * Live states of a polling task. A task that reaches a {@link PollingOutcome} is removed.
 */
public enum PollingState {
    /** Registered while the push stream is healthy; issues no queries. */
    IDLE,
    ACTIVE,
    /** Waiting out a lengthened interval after a failed query. */
    BACKOFF
}
