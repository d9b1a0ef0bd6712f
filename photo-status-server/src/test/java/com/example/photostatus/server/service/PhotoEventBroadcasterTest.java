package com.example.photostatus.server.service;

import com.example.photostatus.server.config.AppProperties;
import com.example.photostatus.server.metrics.RealtimeMetrics;
import com.example.photostatus.server.service.PhotoEventBroadcaster.DisconnectReason;
import com.example.photostatus.shared.util.JsonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PhotoEventBroadcasterTest {

    private VirtualTimeScheduler scheduler;
    private RealtimeMetrics metrics;
    private PhotoEventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getSse().setMaxConnectionsPerUser(3);
        properties.getSse().setHeartbeatMs(25_000L);
        ObjectMapper objectMapper = JsonUtils.newObjectMapper();
        AtomicInteger ids = new AtomicInteger();
        scheduler = VirtualTimeScheduler.create();
        metrics = new RealtimeMetrics(new SimpleMeterRegistry());
        broadcaster = new PhotoEventBroadcaster(properties, new SseFrameFormatter(objectMapper), objectMapper,
                scheduler, () -> "evt-" + ids.incrementAndGet(), metrics);
    }

    @AfterEach
    void tearDown() {
        broadcaster.shutdown();
        scheduler.dispose();
    }

    @Test
    void rejectsFourthConnectionForSameUser() {
        for (int i = 0; i < 3; i++) {
            assertThat(broadcaster.subscribe("u1", new RecordingEventSink()).isOk()).isTrue();
        }

        RecordingEventSink rejected = new RecordingEventSink();
        SubscribeResult fourth = broadcaster.subscribe("u1", rejected, List.of(SseFrameFormatter.CONNECTED_FRAME));

        assertThat(fourth.isOk()).isFalse();
        assertThat(fourth.getReason()).isEqualTo(SubscribeResult.RejectReason.CONNECTION_CAP);
        assertThat(broadcaster.getUserConnectionCount("u1")).isEqualTo(3);
        assertThat(broadcaster.canAccept("u1")).isFalse();
        assertThat(broadcaster.canAccept("u2")).isTrue();
        assertThat(metrics.getCounterValue(RealtimeMetrics.CONNECTIONS_REJECTED, "reason", "connection_cap")).isEqualTo(1);

        PublishResult result = broadcaster.publish("u1", "photo.processing", Map.of("photoId", "p1"));

        assertThat(result.getDelivered()).isEqualTo(3);
        assertThat(rejected.frames).isEmpty();
        assertThat(rejected.closeCount).isZero();
    }

    @Test
    void initialFramesPrecedeLaterEvents() {
        RecordingEventSink sink = new RecordingEventSink();

        SubscribeResult result = broadcaster.subscribe("u1", sink,
                List.of(SseFrameFormatter.CONNECTED_FRAME, "event: photo.processing\nid: old-1\ndata: {}\n\n"));
        broadcaster.publish("u1", "photo.processing", Map.of("photoId", "p1"));

        assertThat(result.isOk()).isTrue();
        assertThat(sink.frames).hasSize(3);
        assertThat(sink.frames.get(0)).isEqualTo(SseFrameFormatter.CONNECTED_FRAME);
        assertThat(sink.frames.get(1)).contains("id: old-1");
        assertThat(sink.frames.get(2)).contains("id: evt-1");
    }

    @Test
    void unwritableInitialFrameRejectsTheStream() {
        RecordingEventSink sink = new RecordingEventSink();
        sink.nextOutcome = EventSink.WriteOutcome.BACKPRESSURE;

        SubscribeResult result = broadcaster.subscribe("u1", sink, List.of(SseFrameFormatter.CONNECTED_FRAME));

        assertThat(result.isOk()).isFalse();
        assertThat(result.getReason()).isEqualTo(SubscribeResult.RejectReason.INITIAL_WRITE_FAILED);
        assertThat(broadcaster.getUserConnectionCount("u1")).isZero();
        assertThat(broadcaster.getTotalConnectionCount()).isZero();
        assertThat(sink.closeCount).isEqualTo(1);
        assertThat(metrics.getCounterValue(RealtimeMetrics.CONNECTIONS_CLOSED, "reason", "backpressure_drop")).isEqualTo(1);
    }

    @Test
    void publishDuringCatchUpNeverDropsTheNewStream() throws Exception {
        List<String> catchUp = new ArrayList<>();
        catchUp.add(SseFrameFormatter.CONNECTED_FRAME);
        for (int i = 0; i < 200; i++) {
            catchUp.add("event: photo.processing\nid: old-" + i + "\ndata: {}\n\n");
        }
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 50; round++) {
                String userId = "user-" + round;
                SseConnection connection = new SseConnection(512);
                CountDownLatch go = new CountDownLatch(1);
                Future<SubscribeResult> subscribed = executor.submit(() -> {
                    go.await();
                    return broadcaster.subscribe(userId, connection, catchUp);
                });
                Future<?> published = executor.submit(() -> {
                    go.await();
                    for (int i = 0; i < 50; i++) {
                        broadcaster.publish(userId, "photo.processing", Map.of("photoId", "p" + i));
                    }
                    return null;
                });
                go.countDown();

                assertThat(subscribed.get(10, TimeUnit.SECONDS).isOk()).isTrue();
                published.get(10, TimeUnit.SECONDS);
                assertThat(broadcaster.getUserConnectionCount(userId)).isEqualTo(1);
                assertThat(connection.asFlux().blockFirst(Duration.ofSeconds(5)))
                        .isEqualTo(SseFrameFormatter.CONNECTED_FRAME);
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(metrics.getCounterValue(RealtimeMetrics.CONNECTIONS_CLOSED, "reason", "write_failed")).isZero();
    }

    @Test
    void unsubscribeIsIdempotentAndFreesCapacity() {
        RecordingEventSink sink = new RecordingEventSink();
        broadcaster.subscribe("u1", sink);

        broadcaster.unsubscribe("u1", sink);
        broadcaster.unsubscribe("u1", sink);
        broadcaster.unsubscribe("nobody", sink);

        assertThat(sink.closeCount).isEqualTo(1);
        assertThat(broadcaster.getUserConnectionCount("u1")).isZero();
        assertThat(broadcaster.getTotalConnectionCount()).isZero();
        assertThat(broadcaster.getConnectedUserIds()).isEmpty();
        assertThat(metrics.getCounterValue(RealtimeMetrics.CONNECTIONS_CLOSED, "reason", "client_close")).isEqualTo(1);
    }

    @Test
    void publishReachesOnlyTheTargetUsersConnections() {
        RecordingEventSink first = new RecordingEventSink();
        RecordingEventSink second = new RecordingEventSink();
        RecordingEventSink otherUser = new RecordingEventSink();
        broadcaster.subscribe("u1", first);
        broadcaster.subscribe("u1", second);
        broadcaster.subscribe("u2", otherUser);

        PublishResult result = broadcaster.publish("u1", "photo.processing", Map.of("photoId", "p1"));

        assertThat(result.getDelivered()).isEqualTo(2);
        assertThat(result.getEventId()).isEqualTo("evt-1");
        assertThat(first.frames).containsExactly(
                "event: photo.processing\nid: evt-1\ndata: {\"photoId\":\"p1\",\"eventId\":\"evt-1\"}\n\n");
        assertThat(second.frames).isEqualTo(first.frames);
        assertThat(otherUser.frames).isEmpty();
    }

    @Test
    void publishReusesUpstreamEventId() {
        RecordingEventSink sink = new RecordingEventSink();
        broadcaster.subscribe("u1", sink);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("eventId", "upstream-7");
        payload.put("status", "finished");

        PublishResult result = broadcaster.publish("u1", "photo.processing", payload);

        assertThat(result.getEventId()).isEqualTo("upstream-7");
        assertThat(sink.frames.get(0)).contains("id: upstream-7\n").contains("\"eventId\":\"upstream-7\"");
    }

    @Test
    void publishWrapsNonObjectPayloads() {
        RecordingEventSink sink = new RecordingEventSink();
        broadcaster.subscribe("u1", sink);

        broadcaster.publish("u1", "photo.processing", "hello");

        assertThat(sink.frames.get(0)).contains("data: {\"eventId\":\"evt-1\",\"payload\":\"hello\"}");
    }

    @Test
    void publishWithoutConnectionsDeliversNothing() {
        PublishResult result = broadcaster.publish("u1", "photo.processing", Map.of("photoId", "p1"));

        assertThat(result.getDelivered()).isZero();
        assertThat(result.getEventId()).isNull();
    }

    @Test
    void failedWritesRemoveTheConnection() {
        RecordingEventSink healthy = new RecordingEventSink();
        RecordingEventSink broken = new RecordingEventSink();
        RecordingEventSink slow = new RecordingEventSink();
        broken.nextOutcome = EventSink.WriteOutcome.FAILED;
        slow.nextOutcome = EventSink.WriteOutcome.BACKPRESSURE;
        broadcaster.subscribe("u1", healthy);
        broadcaster.subscribe("u1", broken);
        broadcaster.subscribe("u1", slow);

        PublishResult result = broadcaster.publish("u1", "photo.processing", Map.of("photoId", "p1"));

        assertThat(result.getDelivered()).isEqualTo(1);
        assertThat(broadcaster.getUserConnectionCount("u1")).isEqualTo(1);
        assertThat(broken.closeCount).isEqualTo(1);
        assertThat(slow.closeCount).isEqualTo(1);
        assertThat(metrics.getCounterValue(RealtimeMetrics.CONNECTIONS_CLOSED, "reason", "write_failed")).isEqualTo(1);
        assertThat(metrics.getCounterValue(RealtimeMetrics.CONNECTIONS_CLOSED, "reason", "backpressure_drop")).isEqualTo(1);
    }

    @Test
    void heartbeatsAreWrittenOnSchedule() {
        RecordingEventSink sink = new RecordingEventSink();
        broadcaster.subscribe("u1", sink);

        scheduler.advanceTimeBy(Duration.ofMillis(24_999));
        assertThat(sink.frames).isEmpty();

        scheduler.advanceTimeBy(Duration.ofMillis(1));
        assertThat(sink.frames).containsExactly(SseFrameFormatter.HEARTBEAT_FRAME);

        scheduler.advanceTimeBy(Duration.ofMillis(25_000));
        assertThat(sink.frames).hasSize(2);
    }

    @Test
    void failedHeartbeatPrunesTheConnection() {
        RecordingEventSink sink = new RecordingEventSink();
        broadcaster.subscribe("u1", sink);
        sink.nextOutcome = EventSink.WriteOutcome.FAILED;

        scheduler.advanceTimeBy(Duration.ofMillis(25_000));

        assertThat(broadcaster.getUserConnectionCount("u1")).isZero();
        assertThat(sink.closeCount).isEqualTo(1);
        assertThat(metrics.getCounterValue(RealtimeMetrics.CONNECTIONS_CLOSED, "reason", "heartbeat_failed")).isEqualTo(1);
    }

    @Test
    void heartbeatStopsAfterUnsubscribe() {
        RecordingEventSink sink = new RecordingEventSink();
        broadcaster.subscribe("u1", sink);
        broadcaster.unsubscribe("u1", sink, DisconnectReason.CLIENT_CLOSE);

        scheduler.advanceTimeBy(Duration.ofMinutes(2));

        assertThat(sink.frames).isEmpty();
    }

    @Test
    void shutdownClosesEverythingAndRefusesNewStreams() {
        RecordingEventSink first = new RecordingEventSink();
        RecordingEventSink second = new RecordingEventSink();
        broadcaster.subscribe("u1", first);
        broadcaster.subscribe("u2", second);

        broadcaster.shutdown();

        assertThat(first.closeCount).isEqualTo(1);
        assertThat(second.closeCount).isEqualTo(1);
        assertThat(broadcaster.getTotalConnectionCount()).isZero();
        assertThat(broadcaster.subscribe("u1", new RecordingEventSink()).getReason())
                .isEqualTo(SubscribeResult.RejectReason.SHUT_DOWN);
    }
}
