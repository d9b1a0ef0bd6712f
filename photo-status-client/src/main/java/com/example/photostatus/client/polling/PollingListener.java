package com.example.photostatus.client.polling;

public interface PollingListener {

    default void onPollingStopped(String photoId, PollingOutcome outcome) {
    }

    /**
     * The job is taking longer than usual. Sent at most once per task.
     */
    default void onSoftTimeout(String photoId) {
    }
}
