package com.example.photostatus.server;

import com.example.photostatus.server.service.PhotoEventBroadcaster;
import com.example.photostatus.server.service.PhotoStatusPublisher;
import com.example.photostatus.shared.dto.PhotoStatusUpdate;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.FluxExchangeResult;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "photo-status.sse.heartbeat-ms=0",
                "photo-status.relay.redis-enabled=false"
        })
class PhotoStatusServerApplicationTests {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private PhotoStatusPublisher publisher;

    @Autowired
    private PhotoEventBroadcaster broadcaster;

    @Test
    void publishedUpdateReachesTheOwnersStream() {
        FluxExchangeResult<String> result = webTestClient.get().uri("/api/events/photos")
                .header("X-Authenticated-User-Id", "it-user")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(String.class);

        StepVerifier.create(result.getResponseBody())
                .then(() -> publisher.publish(PhotoStatusUpdate.builder()
                        .userId("it-user")
                        .eventId("it-1")
                        .photoId("p1")
                        .status("finished")
                        .updatedAt("2024-01-01T00:00:00Z")
                        .build()))
                .expectNextMatches(data -> data.contains("\"eventId\":\"it-1\"") && data.contains("\"status\":\"finished\""))
                .thenCancel()
                .verify(Duration.ofSeconds(10));
    }

    @Test
    void healthEndpointReportsRealtimeDetails() {
        webTestClient.get().uri("/actuator/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.components.realtime.details.realtimeEnabled").isEqualTo(true);
    }

    @Test
    void streamIsReleasedWhenClientGoesAway() {
        FluxExchangeResult<String> result = webTestClient.get().uri("/api/events/photos")
                .header("X-Authenticated-User-Id", "leaving-user")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(String.class);

        StepVerifier.create(result.getResponseBody())
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        StepVerifier.create(Flux.interval(Duration.ofMillis(50))
                        .map(tick -> broadcaster.getUserConnectionCount("leaving-user"))
                        .filter(count -> count == 0)
                        .next())
                .expectNext(0)
                .expectComplete()
                .verify(Duration.ofSeconds(10));
    }
}
