package com.example.photostatus.client.coordinator;

import com.example.photostatus.client.polling.PollingTaskManager;
import com.example.photostatus.client.state.PhotoStateStore;
import com.example.photostatus.client.stream.FallbackReason;
import com.example.photostatus.client.stream.StreamConnector;
import com.example.photostatus.client.stream.StreamEventListener;
import com.example.photostatus.shared.dto.PhotoStatusUpdate;
import com.example.photostatus.shared.util.Constants.PhotoState;
import com.example.photostatus.shared.util.Constants.ProcessingStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;

import java.util.Optional;
import java.util.Set;

/**
 * Decides, per photo, whether completion is learned from the push stream or from polling.
 *
 * <p>Polling tasks are registered for every tracked photo but only query while the stream is
 * down. Whichever path first reports a terminal state wins; the other is cancelled.
 */
@Slf4j
public class DeliveryCoordinator implements StreamEventListener {

    private final StreamConnector connector;
    private final PollingTaskManager pollingTaskManager;
    private final PhotoStateStore stateStore;
    private final Scheduler scheduler;

    public DeliveryCoordinator(StreamConnector connector,
                               PollingTaskManager pollingTaskManager,
                               PhotoStateStore stateStore,
                               Scheduler scheduler) {
        this.connector = connector;
        this.pollingTaskManager = pollingTaskManager;
        this.stateStore = stateStore;
        this.scheduler = scheduler;
    }

    /**
     * Opens the session's push stream.
     */
    public void start(String accessToken) {
        connector.start(accessToken, this);
    }

    /**
     * A processing run started for the photo; it is pending until a terminal state arrives.
     */
    public void track(String photoId) {
        if (photoId == null || photoId.isBlank()) {
            throw new IllegalArgumentException("photoId is required");
        }
        scheduler.schedule(() -> {
            stateStore.beginProcessing(photoId);
            pollingTaskManager.start(photoId);
        });
    }

    /**
     * Ends the session: closes the stream and cancels every polling task.
     */
    public void close() {
        connector.stop();
        pollingTaskManager.stopAll();
    }

    @Override
    public void onPhotoStatus(PhotoStatusUpdate update) {
        Optional<PhotoState> observed = update.getProcessingStatus().map(ProcessingStatus::toPhotoState);
        if (observed.isEmpty()) {
            log.debug("Ignoring push event {} with unknown status", update.getEventId());
            return;
        }
        String photoId = update.getPhotoId();
        PhotoState state = observed.get();
        if (stateStore.isTerminal(photoId)) {
            log.debug("Photo {} already settled, ignoring pushed {}", photoId, state.wireValue());
            return;
        }
        stateStore.applyState(photoId, state);
        if (state.isTerminal()) {
            stateStore.clearPending(photoId);
            pollingTaskManager.stop(photoId);
            log.info("Photo {} settled by push: {}", photoId, state.wireValue());
        }
    }

    /**
     * Starts polling every pending photo. Tasks registered while the stream was healthy wake up;
     * tasks already polling are left alone.
     */
    @Override
    public void onFallback(FallbackReason reason) {
        Set<String> pending = stateStore.pendingPhotoIds();
        log.warn("Falling back to polling for {} pending photos ({})", pending.size(), reason);
        pending.forEach(pollingTaskManager::start);
    }

    @Override
    public void onStreamHealthy() {
        log.debug("Push stream healthy; polling tasks already running are kept");
    }
}
