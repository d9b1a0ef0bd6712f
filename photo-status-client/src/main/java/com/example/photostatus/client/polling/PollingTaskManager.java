package com.example.photostatus.client.polling;

import com.example.photostatus.client.state.PhotoStateStore;
import com.example.photostatus.client.stream.StreamHealth;
import com.example.photostatus.shared.util.Constants.PhotoState;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Runs at most one job-status polling loop per photo.
 *
 * <p>While the push stream is healthy a started task stays {@link PollingState#IDLE}. Calling
 * {@link #start} again once the stream is down wakes it. An active task queries, waits, and
 * queries again until the job ends, a deadline passes or errors pile up. Only one query per task
 * is ever outstanding.
 */
@Slf4j
public class PollingTaskManager {

    public static final int DEFAULT_MAX_CONSECUTIVE_ERRORS = 5;

    private final JobStatusClient jobStatusClient;
    private final PhotoStateStore stateStore;
    private final StreamHealth streamHealth;
    private final Scheduler scheduler;
    private final PollingOptions defaultOptions;
    private final int maxConsecutiveErrors;

    private final Map<String, PollingTask> tasks = new ConcurrentHashMap<>();
    private final List<PollingListener> listeners = new CopyOnWriteArrayList<>();

    public PollingTaskManager(JobStatusClient jobStatusClient,
                              PhotoStateStore stateStore,
                              StreamHealth streamHealth,
                              Scheduler scheduler,
                              PollingOptions defaultOptions,
                              int maxConsecutiveErrors) {
        if (maxConsecutiveErrors <= 0) {
            throw new IllegalArgumentException("maxConsecutiveErrors must be positive");
        }
        this.jobStatusClient = jobStatusClient;
        this.stateStore = stateStore;
        this.streamHealth = streamHealth;
        this.scheduler = scheduler;
        this.defaultOptions = defaultOptions;
        this.maxConsecutiveErrors = maxConsecutiveErrors;
    }

    public void addListener(PollingListener listener) {
        listeners.add(listener);
    }

    public void start(String photoId) {
        start(photoId, defaultOptions);
    }

    /**
     * Marks the photo pending and starts polling it, or only registers it while the stream is
     * healthy. A no-op for a task that is already polling.
     */
    public void start(String photoId, PollingOptions options) {
        if (photoId == null || photoId.isBlank()) {
            throw new IllegalArgumentException("photoId is required");
        }
        if (options == null) {
            throw new IllegalArgumentException("options are required");
        }
        scheduler.schedule(() -> doStart(photoId, options));
    }

    /**
     * Cancels the photo's task and clears its pending flag. Does nothing if there is no task.
     */
    public void stop(String photoId) {
        scheduler.schedule(() -> {
            PollingTask task = tasks.get(photoId);
            if (task != null) {
                finish(task, PollingOutcome.STOPPED);
            }
        });
    }

    public void stopAll() {
        scheduler.schedule(() -> List.copyOf(tasks.values()).forEach(task -> finish(task, PollingOutcome.STOPPED)));
    }

    public Optional<PollingState> getTaskState(String photoId) {
        PollingTask task = tasks.get(photoId);
        return task == null ? Optional.empty() : Optional.of(task.state);
    }

    public boolean hasTask(String photoId) {
        return tasks.containsKey(photoId);
    }

    public int getTaskCount() {
        return tasks.size();
    }

    private void doStart(String photoId, PollingOptions options) {
        stateStore.markPending(photoId);
        PollingTask existing = tasks.get(photoId);
        if (existing != null) {
            if (existing.state == PollingState.IDLE && !streamHealth.isActive()) {
                activate(existing);
            }
            return;
        }

        PollingTask task = new PollingTask(photoId, options);
        tasks.put(photoId, task);
        if (streamHealth.isActive()) {
            log.debug("Stream healthy, photo {} registered for polling without querying", photoId);
            return;
        }
        activate(task);
    }

    private void activate(PollingTask task) {
        PollingOptions options = task.options;
        task.state = PollingState.ACTIVE;
        task.activatedAtMs = now();
        task.hardDeadline = scheduler.schedule(() -> {
            if (isLive(task)) {
                log.warn("Polling for photo {} hit the hard timeout of {} ms", task.photoId, options.getHardTimeoutMs());
                finish(task, PollingOutcome.HARD_TIMEOUT);
            }
        }, options.getHardTimeoutMs(), TimeUnit.MILLISECONDS);
        task.softDeadline = scheduler.schedule(() -> notifySoftTimeout(task),
                options.getSoftTimeoutMs(), TimeUnit.MILLISECONDS);
        log.info("Polling started for photo {}", task.photoId);
        attempt(task);
    }

    private void attempt(PollingTask task) {
        if (!isLive(task) || task.isQueryInFlight()) {
            return;
        }
        task.nextAttempt = null;
        if (now() - task.activatedAtMs >= task.options.getHardTimeoutMs()) {
            finish(task, PollingOutcome.HARD_TIMEOUT);
            return;
        }

        int attemptNumber = ++task.attempts;
        Mono<JobStatus> query;
        try {
            query = jobStatusClient.getJobStatus(task.photoId);
        } catch (RuntimeException e) {
            query = Mono.error(e);
        }
        task.inFlight = query
                .switchIfEmpty(Mono.error(() -> new JobStatusQueryException("Empty job status response")))
                .publishOn(scheduler)
                .subscribe(
                        status -> onResult(task, attemptNumber, status),
                        error -> onError(task, attemptNumber, error));
    }

    private void onResult(PollingTask task, int attemptNumber, JobStatus status) {
        if (!isCurrentAttempt(task, attemptNumber)) {
            return;
        }
        task.inFlight = null;
        if (stateStore.isTerminal(task.photoId)) {
            // The push path already settled this photo
            finish(task, PollingOutcome.STOPPED);
            return;
        }
        if (status.getState() == null || status.getState().isBlank()) {
            onError(task, attemptNumber, new JobStatusQueryException("Job status response has no state"));
            return;
        }

        PhotoState photoState = PhotoState.fromJobState(status.getState());
        if (photoState == PhotoState.FINISHED) {
            finish(task, PollingOutcome.SUCCEEDED);
        } else if (photoState == PhotoState.ERROR) {
            finish(task, PollingOutcome.JOB_FAILED);
        } else {
            stateStore.applyState(task.photoId, PhotoState.IN_PROGRESS);
            task.consecutiveErrors = 0;
            task.retryIntervalMs = task.options.getIntervalMs();
            task.state = PollingState.ACTIVE;
            scheduleNext(task, task.options.getIntervalMs());
        }
    }

    private void onError(PollingTask task, int attemptNumber, Throwable error) {
        if (!isCurrentAttempt(task, attemptNumber)) {
            return;
        }
        task.inFlight = null;
        if (error instanceof JobStatusQueryException queryError) {
            if (queryError.isAuthFailure()) {
                log.warn("Job status query for photo {} was not authorized (HTTP {})", task.photoId, queryError.getHttpStatus());
                finish(task, PollingOutcome.AUTH_FAILED);
                return;
            }
            if (queryError.isNotFound()) {
                log.warn("Job status for photo {} not found", task.photoId);
                finish(task, PollingOutcome.NOT_FOUND);
                return;
            }
        }

        task.consecutiveErrors++;
        if (task.consecutiveErrors >= maxConsecutiveErrors) {
            log.warn("Polling for photo {} gave up after {} consecutive errors: {}",
                    task.photoId, task.consecutiveErrors, error.getMessage());
            finish(task, PollingOutcome.TOO_MANY_ERRORS);
            return;
        }
        task.retryIntervalMs = Math.min(task.retryIntervalMs * 2, task.options.getMaxIntervalMs());
        task.state = PollingState.BACKOFF;
        log.debug("Job status query for photo {} failed ({} in a row), retrying in {} ms: {}",
                task.photoId, task.consecutiveErrors, task.retryIntervalMs, error.getMessage());
        scheduleNext(task, task.retryIntervalMs);
    }

    private void scheduleNext(PollingTask task, long delayMs) {
        task.nextAttempt = scheduler.schedule(() -> attempt(task), delayMs, TimeUnit.MILLISECONDS);
    }

    private void notifySoftTimeout(PollingTask task) {
        if (!isLive(task) || task.softTimeoutNotified) {
            return;
        }
        task.softTimeoutNotified = true;
        log.info("Photo {} is taking longer than usual", task.photoId);
        for (PollingListener listener : listeners) {
            try {
                listener.onSoftTimeout(task.photoId);
            } catch (RuntimeException e) {
                log.warn("Polling listener failed on soft timeout for photo {}: {}", task.photoId, e.getMessage());
            }
        }
    }

    private void finish(PollingTask task, PollingOutcome outcome) {
        if (!task.live) {
            return;
        }
        task.live = false;
        task.cancelTimers();
        tasks.remove(task.photoId, task);
        stateStore.clearPending(task.photoId);
        outcome.getPhotoState().ifPresent(state -> stateStore.applyState(task.photoId, state));
        log.info("Polling for photo {} ended: {} after {} queries", task.photoId, outcome, task.attempts);
        for (PollingListener listener : listeners) {
            try {
                listener.onPollingStopped(task.photoId, outcome);
            } catch (RuntimeException e) {
                log.warn("Polling listener failed for photo {}: {}", task.photoId, e.getMessage());
            }
        }
    }

    private boolean isLive(PollingTask task) {
        return task.live && tasks.get(task.photoId) == task;
    }

    private boolean isCurrentAttempt(PollingTask task, int attemptNumber) {
        return isLive(task) && task.attempts == attemptNumber;
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }
}
