package com.example.photostatus.client.polling;

import reactor.core.publisher.Mono;

/**
 * Asks the backend for the current state of a photo's processing job.
 */
@FunctionalInterface
public interface JobStatusClient {

    /**
     * Errors are signalled as {@link JobStatusQueryException} where an HTTP status is known.
     */
    Mono<JobStatus> getJobStatus(String photoId);
}
