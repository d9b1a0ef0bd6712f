package com.example.photostatus.client.stream;

import com.example.photostatus.shared.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reads the event stream with Spring's SSE decoder. Comment frames are surfaced too, so a
 * heartbeat alone proves the connection is alive.
 */
@Slf4j
public class WebClientPhotoEventStreamTransport implements PhotoEventStreamTransport {

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final String eventsPath;

    public WebClientPhotoEventStreamTransport(WebClient webClient, String eventsPath) {
        this.webClient = webClient;
        this.eventsPath = eventsPath;
    }

    @Override
    public Flux<StreamFrame> open(String accessToken, String lastEventId) {
        return webClient.get()
                .uri(eventsPath)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .headers(headers -> {
                    headers.setCacheControl("no-cache");
                    if (accessToken != null && !accessToken.isBlank()) {
                        headers.setBearerAuth(accessToken);
                    }
                    if (lastEventId != null && !lastEventId.isBlank()) {
                        headers.set(Constants.Headers.LAST_EVENT_ID, lastEventId);
                    }
                })
                .retrieve()
                .onStatus(status -> StreamRejectedException.isRejection(status.value()),
                        response -> response.releaseBody()
                                .then(Mono.<Throwable>error(new StreamRejectedException(response.statusCode().value()))))
                .onStatus(status -> status.isError(),
                        response -> response.releaseBody()
                                .then(Mono.<Throwable>error(new StreamConnectException(
                                        "Event stream refused (HTTP " + response.statusCode().value() + ")",
                                        response.statusCode().value()))))
                .bodyToFlux(SSE_TYPE)
                .map(StreamFrame::from)
                .onErrorMap(error -> !(error instanceof StreamConnectException),
                        error -> new StreamConnectException("Event stream failed: " + error.getMessage(), error));
    }
}
