package com.example.photostatus.client.stream;

import com.example.photostatus.shared.dto.PhotoStatusUpdate;

/**
 * Receives what the connector observes. Called on the client scheduler.
 */
public interface StreamEventListener {

    void onPhotoStatus(PhotoStatusUpdate update);

    /**
     * Push delivery should be considered unavailable; pending photos need polling.
     */
    void onFallback(FallbackReason reason);

    default void onStreamHealthy() {
    }
}
