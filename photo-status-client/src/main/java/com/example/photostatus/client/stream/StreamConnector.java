package com.example.photostatus.client.stream;

import com.example.photostatus.client.backoff.ReconnectBackoff;
import com.example.photostatus.client.dedupe.EventDedupeCache;
import com.example.photostatus.shared.dto.PhotoStatusUpdate;
import com.example.photostatus.shared.util.Constants;
import com.example.photostatus.shared.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Keeps one push connection open for the session, reconnecting with backoff whenever it fails
 * or ends. Redelivered events are dropped before they reach the listener.
 *
 * <p>All state lives on the given scheduler; the public methods only enqueue work onto it.
 */
@Slf4j
public class StreamConnector {

    public static final int DEFAULT_FALLBACK_FAILURE_THRESHOLD = 3;

    private final PhotoEventStreamTransport transport;
    private final ReconnectBackoff backoff;
    private final EventDedupeCache dedupe;
    private final StreamHealth health;
    private final Scheduler scheduler;
    private final int fallbackFailureThreshold;

    private StreamEventListener listener;
    private String accessToken;
    private String lastEventId;
    private boolean running;
    // Bumped on every start and stop; callbacks from an older generation are ignored
    private long generation;
    private Disposable connection;
    private Disposable reconnectTimer;

    public StreamConnector(PhotoEventStreamTransport transport,
                           ReconnectBackoff backoff,
                           EventDedupeCache dedupe,
                           StreamHealth health,
                           Scheduler scheduler,
                           int fallbackFailureThreshold) {
        if (fallbackFailureThreshold <= 0) {
            throw new IllegalArgumentException("fallbackFailureThreshold must be positive");
        }
        this.transport = transport;
        this.backoff = backoff;
        this.dedupe = dedupe;
        this.health = health;
        this.scheduler = scheduler;
        this.fallbackFailureThreshold = fallbackFailureThreshold;
    }

    /**
     * Opens the stream unless it is already running.
     */
    public void start(String accessToken, StreamEventListener listener) {
        Objects.requireNonNull(listener, "listener");
        scheduler.schedule(() -> {
            if (running) {
                return;
            }
            this.accessToken = accessToken;
            this.listener = listener;
            running = true;
            generation++;
            log.info("Starting photo event stream");
            connect(generation);
        });
    }

    /**
     * Closes the stream and cancels any pending reconnect. Safe to call repeatedly.
     */
    public void stop() {
        scheduler.schedule(() -> {
            if (!running) {
                return;
            }
            running = false;
            generation++;
            disposeConnection();
            cancelReconnect();
            health.markInactive();
            log.info("Photo event stream stopped");
        });
    }

    public StreamHealth getHealth() {
        return health;
    }

    private void connect(long gen) {
        boolean[] healthy = {false};
        Flux<StreamFrame> frames;
        try {
            frames = transport.open(accessToken, lastEventId);
        } catch (RuntimeException e) {
            frames = Flux.error(e);
        }
        connection = frames
                .publishOn(scheduler)
                .subscribe(
                        frame -> onFrame(gen, healthy, frame),
                        error -> onDisconnect(gen, error),
                        () -> onDisconnect(gen, null));
    }

    private void onFrame(long gen, boolean[] healthy, StreamFrame frame) {
        if (!isCurrent(gen)) {
            return;
        }
        if (!healthy[0]) {
            healthy[0] = true;
            health.markHealthy();
            log.info("Photo event stream connected");
            listener.onStreamHealthy();
        }
        if (frame.isComment()) {
            return;
        }

        Optional<PhotoStatusUpdate> payload = JsonUtils.parse(frame.getData(), PhotoStatusUpdate.class);
        String dedupeId = dedupeId(frame, payload);
        if (dedupeId != null) {
            if (dedupe.has(dedupeId)) {
                log.debug("Dropping redelivered event {}", dedupeId);
                return;
            }
            dedupe.add(dedupeId);
            lastEventId = dedupeId;
        }

        if (!Constants.PHOTO_PROCESSING_EVENT.equals(frame.getEventName())) {
            return;
        }
        if (payload.isEmpty() || payload.get().getPhotoId() == null) {
            log.debug("Ignoring photo event {} without a usable payload", dedupeId);
            return;
        }
        listener.onPhotoStatus(payload.get());
    }

    private void onDisconnect(long gen, Throwable error) {
        if (!isCurrent(gen)) {
            return;
        }
        connection = null;

        if (error instanceof StreamRejectedException rejected) {
            running = false;
            generation++;
            health.markInactive();
            log.warn("Photo event stream rejected by server (HTTP {}); polling for this session",
                    rejected.getHttpStatus());
            listener.onFallback(rejected.toFallbackReason());
            return;
        }

        int failures = health.recordFailure();
        if (error != null) {
            log.warn("Photo event stream failed (consecutive failures: {}): {}", failures, error.getMessage());
        } else {
            log.info("Photo event stream closed by server (consecutive failures: {})", failures);
        }
        if (failures >= fallbackFailureThreshold) {
            listener.onFallback(FallbackReason.TOO_MANY_FAILURES);
        }
        long delayMs = backoff.computeReconnectDelayMs(failures);
        log.debug("Reconnecting photo event stream in {} ms", delayMs);
        reconnectTimer = scheduler.schedule(() -> {
            if (isCurrent(gen)) {
                reconnectTimer = null;
                connect(gen);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
    }

    private boolean isCurrent(long gen) {
        return running && gen == generation;
    }

    private static String dedupeId(StreamFrame frame, Optional<PhotoStatusUpdate> payload) {
        if (frame.getEventId() != null && !frame.getEventId().isBlank()) {
            return frame.getEventId();
        }
        return payload.map(PhotoStatusUpdate::getEventId)
                .filter(id -> !id.isBlank())
                .orElse(null);
    }

    private void disposeConnection() {
        if (connection != null) {
            connection.dispose();
            connection = null;
        }
    }

    private void cancelReconnect() {
        if (reconnectTimer != null) {
            reconnectTimer.dispose();
            reconnectTimer = null;
        }
    }
}
