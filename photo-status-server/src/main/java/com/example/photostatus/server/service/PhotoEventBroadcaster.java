package com.example.photostatus.server.service;

import com.example.photostatus.server.config.AppProperties;
import com.example.photostatus.server.metrics.RealtimeMetrics;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Registry of open event streams keyed by user. Every mutation and every write to a sink happens
 * under this object's monitor, so frames for one connection are never interleaved.
 */
@Service
@Slf4j
public class PhotoEventBroadcaster {

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_MAP = new TypeReference<>() {};

    private final Map<String, Map<EventSink, Connection>> connectionsByUser = new LinkedHashMap<>();

    private final int maxConnectionsPerUser;
    private final long heartbeatMs;
    private final SseFrameFormatter frameFormatter;
    private final ObjectMapper objectMapper;
    private final Scheduler heartbeatScheduler;
    private final Supplier<String> eventIdGenerator;
    private final RealtimeMetrics metrics;

    private int totalConnections;
    private boolean shutDown;

    public PhotoEventBroadcaster(AppProperties appProperties,
                                 SseFrameFormatter frameFormatter,
                                 ObjectMapper objectMapper,
                                 @Qualifier("heartbeatScheduler") Scheduler heartbeatScheduler,
                                 Supplier<String> eventIdGenerator,
                                 RealtimeMetrics metrics) {
        this.maxConnectionsPerUser = appProperties.getSse().getMaxConnectionsPerUser();
        this.heartbeatMs = appProperties.getSse().getHeartbeatMs();
        this.frameFormatter = frameFormatter;
        this.objectMapper = objectMapper;
        this.heartbeatScheduler = heartbeatScheduler;
        this.eventIdGenerator = eventIdGenerator;
        this.metrics = metrics;
    }

    public SubscribeResult subscribe(String userId, EventSink sink) {
        return subscribe(userId, sink, List.of());
    }

    /**
     * Registers a stream for the user, writes {@code initialFrames} to it and starts its heartbeat.
     * The initial frames go out under the same monitor as {@link #publish}, so a concurrent publish
     * lands after them. Rejected once the user already has the maximum number of open streams, or
     * if an initial frame cannot be written.
     */
    public synchronized SubscribeResult subscribe(String userId, EventSink sink, List<String> initialFrames) {
        if (shutDown) {
            return SubscribeResult.rejected(SubscribeResult.RejectReason.SHUT_DOWN);
        }
        Map<EventSink, Connection> connections = connectionsByUser.computeIfAbsent(userId, k -> new LinkedHashMap<>());
        if (connections.containsKey(sink)) {
            return SubscribeResult.accepted();
        }
        if (connections.size() >= maxConnectionsPerUser) {
            log.warn("[CONNECT_REJECTED] userId='{}', open={}, max={}", userId, connections.size(), maxConnectionsPerUser);
            metrics.connectionRejected("connection_cap");
            return SubscribeResult.rejected(SubscribeResult.RejectReason.CONNECTION_CAP);
        }

        Connection connection = new Connection(userId, sink);
        connections.put(sink, connection);
        totalConnections++;
        metrics.connectionOpened();
        metrics.setActiveConnections(totalConnections);
        for (String frame : initialFrames) {
            EventSink.WriteOutcome outcome = safeWrite(connection, frame);
            if (!outcome.isWritten()) {
                log.warn("[CONNECT_FAILED] userId='{}', initial frame not written, outcome={}", userId, outcome);
                unsubscribe(userId, sink, disconnectReasonFor(outcome));
                return SubscribeResult.rejected(SubscribeResult.RejectReason.INITIAL_WRITE_FAILED);
            }
        }
        if (heartbeatMs > 0) {
            connection.heartbeat = heartbeatScheduler.schedulePeriodically(
                    () -> heartbeat(connection), heartbeatMs, heartbeatMs, TimeUnit.MILLISECONDS);
        }
        log.info("[CONNECT_SUCCESS] userId='{}', userConnections={}, totalConnections={}",
                userId, connections.size(), totalConnections);
        return SubscribeResult.accepted();
    }

    /**
     * Removes the stream, stops its heartbeat and closes it. Unknown sinks are ignored, so this
     * may be called any number of times.
     */
    public synchronized void unsubscribe(String userId, EventSink sink, DisconnectReason reason) {
        Map<EventSink, Connection> connections = connectionsByUser.get(userId);
        if (connections == null) {
            return;
        }
        Connection connection = connections.remove(sink);
        if (connection == null) {
            return;
        }
        if (connections.isEmpty()) {
            connectionsByUser.remove(userId);
        }
        release(connection, reason);
        log.info("[DISCONNECT] userId='{}', reason={}, userConnections={}, totalConnections={}",
                userId, reason.getTag(), connections.size(), totalConnections);
    }

    public void unsubscribe(String userId, EventSink sink) {
        unsubscribe(userId, sink, DisconnectReason.CLIENT_CLOSE);
    }

    /**
     * Writes one event frame to each of the user's open streams. Streams that fail the write are
     * removed.
     *
     * <p>Event ids: when the payload is a JSON object carrying a non-blank {@code eventId}, that id
     * is reused as the frame id instead of generating a new one. Status updates already carry the
     * id they are stored under in {@link PhotoEventHistory}, so a client's {@code Last-Event-ID}
     * resolves against the history on reconnect. Payloads without an id get a fresh one from the
     * event id generator, embedded into the payload.
     *
     * @return how many streams took the frame
     */
    public synchronized PublishResult publish(String userId, String eventName, Object payload) {
        Map<EventSink, Connection> connections = connectionsByUser.get(userId);
        if (connections == null || connections.isEmpty()) {
            log.debug("[PUBLISH_SKIPPED] No open connections for userId='{}'", userId);
            return PublishResult.none();
        }

        Map<String, Object> data = toPayloadMap(payload);
        String eventId = upstreamEventId(data);
        if (eventId == null) {
            eventId = eventIdGenerator.get();
        }
        Object framed;
        if (data != null) {
            data.put("eventId", eventId);
            framed = data;
        } else {
            Map<String, Object> wrapper = new LinkedHashMap<>();
            wrapper.put("eventId", eventId);
            wrapper.put("payload", payload);
            framed = wrapper;
        }
        String frame = frameFormatter.formatEvent(eventName, eventId, framed);

        int delivered = 0;
        for (Connection connection : new ArrayList<>(connections.values())) {
            EventSink.WriteOutcome outcome = safeWrite(connection, frame);
            if (outcome.isWritten()) {
                delivered++;
            } else {
                log.warn("[PUBLISH_FAILED] userId='{}', eventId='{}', outcome={}", userId, eventId, outcome);
                unsubscribe(userId, connection.sink, disconnectReasonFor(outcome));
            }
        }
        metrics.eventPublished(delivered);
        log.debug("[PUBLISH] userId='{}', event='{}', eventId='{}', delivered={}", userId, eventName, eventId, delivered);
        return new PublishResult(delivered, eventId);
    }

    public synchronized int getUserConnectionCount(String userId) {
        Map<EventSink, Connection> connections = connectionsByUser.get(userId);
        return connections == null ? 0 : connections.size();
    }

    public synchronized boolean canAccept(String userId) {
        return !shutDown && getUserConnectionCount(userId) < maxConnectionsPerUser;
    }

    public synchronized int getTotalConnectionCount() {
        return totalConnections;
    }

    public synchronized Set<String> getConnectedUserIds() {
        return new TreeSet<>(connectionsByUser.keySet());
    }

    /**
     * Closes every open stream and refuses new ones.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        log.info("Commencing broadcaster shutdown, closing {} connections", totalConnections);
        List<Connection> all = new ArrayList<>();
        connectionsByUser.values().forEach(connections -> all.addAll(connections.values()));
        connectionsByUser.clear();
        all.forEach(connection -> release(connection, DisconnectReason.SHUTDOWN));
        log.info("Broadcaster shutdown complete.");
    }

    private synchronized void heartbeat(Connection connection) {
        if (connection.released) {
            return;
        }
        EventSink.WriteOutcome outcome = safeWrite(connection, frameFormatter.heartbeat());
        if (!outcome.isWritten()) {
            log.warn("[HEARTBEAT_FAILED] userId='{}', outcome={}", connection.userId, outcome);
            unsubscribe(connection.userId, connection.sink, DisconnectReason.HEARTBEAT_FAILED);
        }
    }

    private void release(Connection connection, DisconnectReason reason) {
        connection.released = true;
        totalConnections--;
        if (connection.heartbeat != null) {
            connection.heartbeat.dispose();
        }
        try {
            connection.sink.close();
        } catch (RuntimeException e) {
            log.debug("Error closing sink for userId='{}': {}", connection.userId, e.getMessage());
        }
        metrics.connectionClosed(reason.getTag());
        metrics.setActiveConnections(totalConnections);
    }

    private EventSink.WriteOutcome safeWrite(Connection connection, String frame) {
        try {
            return connection.sink.write(frame);
        } catch (RuntimeException e) {
            log.warn("Write threw for userId='{}': {}", connection.userId, e.getMessage());
            return EventSink.WriteOutcome.FAILED;
        }
    }

    private static DisconnectReason disconnectReasonFor(EventSink.WriteOutcome outcome) {
        return outcome == EventSink.WriteOutcome.BACKPRESSURE
                ? DisconnectReason.BACKPRESSURE_DROP
                : DisconnectReason.WRITE_FAILED;
    }

    private Map<String, Object> toPayloadMap(Object payload) {
        if (payload == null || payload instanceof CharSequence || payload instanceof Number
                || payload instanceof Boolean || payload instanceof Iterable || payload.getClass().isArray()) {
            return null;
        }
        try {
            return new LinkedHashMap<>(objectMapper.convertValue(payload, PAYLOAD_MAP));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String upstreamEventId(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        Object value = data.get("eventId");
        if (value instanceof String id && !id.isBlank()) {
            return id;
        }
        return null;
    }

    private static final class Connection {
        private final String userId;
        private final EventSink sink;
        private Disposable heartbeat;
        private boolean released;

        private Connection(String userId, EventSink sink) {
            this.userId = userId;
            this.sink = sink;
        }
    }

    public enum DisconnectReason {
        CLIENT_CLOSE("client_close"),
        WRITE_FAILED("write_failed"),
        BACKPRESSURE_DROP("backpressure_drop"),
        HEARTBEAT_FAILED("heartbeat_failed"),
        SHUTDOWN("shutdown");

        private final String tag;

        DisconnectReason(String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }
    }
}
