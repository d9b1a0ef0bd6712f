package com.example.photostatus.client.coordinator;

import com.example.photostatus.client.backoff.ReconnectBackoff;
import com.example.photostatus.client.dedupe.EventDedupeCache;
import com.example.photostatus.client.polling.JobStatus;
import com.example.photostatus.client.polling.JobStatusClient;
import com.example.photostatus.client.polling.PollingOptions;
import com.example.photostatus.client.polling.PollingState;
import com.example.photostatus.client.polling.PollingTaskManager;
import com.example.photostatus.client.state.PhotoStateStore;
import com.example.photostatus.client.stream.FakeStreamTransport;
import com.example.photostatus.client.stream.StreamConnectException;
import com.example.photostatus.client.stream.StreamConnector;
import com.example.photostatus.client.stream.StreamHealth;
import com.example.photostatus.client.stream.StreamRejectedException;
import com.example.photostatus.shared.util.Constants.PhotoState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeliveryCoordinatorTest {

    @Mock
    private JobStatusClient jobStatusClient;

    private VirtualTimeScheduler scheduler;
    private FakeStreamTransport transport;
    private StreamHealth health;
    private PhotoStateStore stateStore;
    private PollingTaskManager polling;
    private DeliveryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        transport = new FakeStreamTransport();
        health = new StreamHealth();
        stateStore = new PhotoStateStore();
        StreamConnector connector = new StreamConnector(transport, new ReconnectBackoff(500, 30_000, 0.2, () -> 0.5),
                new EventDedupeCache(200), health, scheduler, 3);
        polling = new PollingTaskManager(jobStatusClient, stateStore, health, scheduler,
                new PollingOptions(100, 1_000, 60_000, 600_000), 5);
        coordinator = new DeliveryCoordinator(connector, polling, stateStore, scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private static Mono<JobStatus> job(String state) {
        return Mono.just(new JobStatus("p1", state));
    }

    @Test
    void pushSettlesPhotoWithoutPolling() {
        coordinator.start("token");
        transport.heartbeat();

        coordinator.track("p1");
        assertThat(stateStore.getState("p1")).contains(PhotoState.IN_PROGRESS);
        assertThat(stateStore.isPending("p1")).isTrue();
        assertThat(polling.getTaskState("p1")).contains(PollingState.IDLE);

        transport.emit(FakeStreamTransport.photoEvent("e1", "p1", "processing"));
        transport.emit(FakeStreamTransport.photoEvent("e2", "p1", "finished"));
        scheduler.advanceTimeBy(Duration.ofMinutes(1));

        assertThat(stateStore.getState("p1")).contains(PhotoState.FINISHED);
        assertThat(stateStore.isPending("p1")).isFalse();
        assertThat(polling.hasTask("p1")).isFalse();
        verify(jobStatusClient, never()).getJobStatus(anyString());
    }

    @Test
    void pollResultWinsOverLaterPush() {
        when(jobStatusClient.getJobStatus("p1")).thenReturn(job("finished"));
        transport.failWith = new StreamConnectException("connection refused", new java.io.IOException("refused"));
        coordinator.start("token");

        coordinator.track("p1");
        assertThat(stateStore.getState("p1")).contains(PhotoState.FINISHED);
        assertThat(stateStore.isPending("p1")).isFalse();

        transport.failWith = null;
        scheduler.advanceTimeBy(Duration.ofMillis(1_000));
        transport.heartbeat();
        transport.emit(FakeStreamTransport.photoEvent("e1", "p1", "failed"));

        assertThat(health.isActive()).isTrue();
        assertThat(stateStore.getState("p1")).contains(PhotoState.FINISHED);
    }

    @Test
    void fallsBackToPollingAfterThreeStreamFailures() {
        when(jobStatusClient.getJobStatus("p1")).thenReturn(job("inprogress"));
        coordinator.start("token");
        transport.heartbeat();
        coordinator.track("p1");

        transport.failWith = new StreamConnectException("connection refused", new java.io.IOException("refused"));
        transport.drop();
        scheduler.advanceTimeBy(Duration.ofMillis(1_000));
        assertThat(health.getConsecutiveFailures()).isEqualTo(2);
        verify(jobStatusClient, never()).getJobStatus(anyString());

        scheduler.advanceTimeBy(Duration.ofMillis(2_000));

        assertThat(health.getConsecutiveFailures()).isEqualTo(3);
        verify(jobStatusClient, times(1)).getJobStatus("p1");
        assertThat(polling.getTaskState("p1")).contains(PollingState.ACTIVE);
    }

    @Test
    void serverRejectionStartsPollingImmediately() {
        when(jobStatusClient.getJobStatus("p1")).thenReturn(job("inprogress"));
        coordinator.start("token");
        transport.heartbeat();
        coordinator.track("p1");

        transport.current().tryEmitError(new StreamRejectedException(429));

        verify(jobStatusClient, times(1)).getJobStatus("p1");
        assertThat(health.isActive()).isFalse();
        scheduler.advanceTimeBy(Duration.ofMinutes(5));
        assertThat(transport.openCount).isEqualTo(1);
    }

    @Test
    void pushStillSettlesPhotoWhilePolling() {
        when(jobStatusClient.getJobStatus("p1")).thenReturn(job("inprogress"));
        coordinator.start("token");
        transport.current().tryEmitComplete();
        coordinator.track("p1");
        verify(jobStatusClient, times(1)).getJobStatus("p1");

        scheduler.advanceTimeBy(Duration.ofMillis(1_000));
        assertThat(transport.openCount).isEqualTo(2);
        transport.emit(FakeStreamTransport.photoEvent("e1", "p1", "failed"));
        clearInvocations(jobStatusClient);
        scheduler.advanceTimeBy(Duration.ofSeconds(10));

        assertThat(stateStore.getState("p1")).contains(PhotoState.ERROR);
        assertThat(polling.hasTask("p1")).isFalse();
        verify(jobStatusClient, never()).getJobStatus(anyString());
    }

    @Test
    void closeEndsStreamAndPolling() {
        coordinator.start("token");
        transport.heartbeat();
        coordinator.track("p1");
        coordinator.track("p2");

        coordinator.close();

        assertThat(polling.getTaskCount()).isZero();
        assertThat(stateStore.pendingPhotoIds()).isEmpty();
        assertThat(health.isActive()).isFalse();
        scheduler.advanceTimeBy(Duration.ofMinutes(5));
        assertThat(transport.openCount).isEqualTo(1);
    }

    @Test
    void trackRequiresPhotoId() {
        assertThatThrownBy(() -> coordinator.track("")).isInstanceOf(IllegalArgumentException.class);
    }
}
