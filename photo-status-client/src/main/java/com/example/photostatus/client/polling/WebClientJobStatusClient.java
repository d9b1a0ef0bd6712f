package com.example.photostatus.client.polling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Queries {@code GET /photos/{id}/status} relative to the WebClient's base URL. Authentication is
 * whatever the supplied WebClient is configured with.
 */
@Slf4j
public class WebClientJobStatusClient implements JobStatusClient {

    private final WebClient webClient;
    private final Duration requestTimeout;

    public WebClientJobStatusClient(WebClient webClient, Duration requestTimeout) {
        this.webClient = webClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<JobStatus> getJobStatus(String photoId) {
        return webClient.get()
                .uri("/photos/{id}/status", photoId)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(status -> status.isError(),
                        response -> response.releaseBody()
                                .then(Mono.<Throwable>error(new JobStatusQueryException(
                                        "Job status query failed (HTTP " + response.statusCode().value() + ")",
                                        response.statusCode().value()))))
                .bodyToMono(JobStatus.class)
                .timeout(requestTimeout)
                .onErrorMap(error -> !(error instanceof JobStatusQueryException),
                        error -> new JobStatusQueryException("Job status query failed: " + error.getMessage(), error));
    }
}
