package com.example.photostatus.client.polling;

import reactor.core.Disposable;

/**
 * Mutable bookkeeping for one photo's polling loop. Only touched on the manager's scheduler.
 */
class PollingTask {

    final String photoId;
    final PollingOptions options;

    PollingState state = PollingState.IDLE;
    boolean live = true;
    long activatedAtMs;
    long retryIntervalMs;
    int attempts;
    int consecutiveErrors;
    boolean softTimeoutNotified;

    Disposable inFlight;
    Disposable nextAttempt;
    Disposable hardDeadline;
    Disposable softDeadline;

    PollingTask(String photoId, PollingOptions options) {
        this.photoId = photoId;
        this.options = options;
        this.retryIntervalMs = options.getIntervalMs();
    }

    boolean isQueryInFlight() {
        return inFlight != null && !inFlight.isDisposed();
    }

    void cancelTimers() {
        dispose(inFlight);
        dispose(nextAttempt);
        dispose(hardDeadline);
        dispose(softDeadline);
        inFlight = null;
        nextAttempt = null;
        hardDeadline = null;
        softDeadline = null;
    }

    private static void dispose(Disposable disposable) {
        if (disposable != null) {
            disposable.dispose();
        }
    }
}
