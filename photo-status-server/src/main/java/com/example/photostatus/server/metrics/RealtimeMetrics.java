package com.example.photostatus.server.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters and gauges for the real-time delivery path. Recording failures are logged and never
 * reach the caller.
 */
@Component
@Slf4j
public class RealtimeMetrics {

    public static final String CONNECTIONS_OPENED = "photo.realtime.connections.opened";
    public static final String CONNECTIONS_CLOSED = "photo.realtime.connections.closed";
    public static final String CONNECTIONS_REJECTED = "photo.realtime.connections.rejected";
    public static final String CONNECTIONS_ACTIVE = "photo.realtime.connections.active";
    public static final String EVENTS_PUBLISHED = "photo.realtime.events.published";
    public static final String FRAMES_DELIVERED = "photo.realtime.frames.delivered";
    public static final String RELAY_MESSAGES = "photo.realtime.relay.messages";

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final AtomicLong activeConnections = new AtomicLong();

    public RealtimeMetrics(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge(CONNECTIONS_ACTIVE, activeConnections);
    }

    public void connectionOpened() {
        increment(CONNECTIONS_OPENED);
    }

    public void connectionClosed(String reason) {
        increment(CONNECTIONS_CLOSED, "reason", reason);
    }

    public void connectionRejected(String reason) {
        increment(CONNECTIONS_REJECTED, "reason", reason);
    }

    public void eventPublished(int delivered) {
        increment(EVENTS_PUBLISHED);
        if (delivered > 0) {
            try {
                counter(FRAMES_DELIVERED).increment(delivered);
            } catch (RuntimeException e) {
                log.debug("Failed to record {}: {}", FRAMES_DELIVERED, e.getMessage());
            }
        }
    }

    public void relayMessage(String outcome) {
        increment(RELAY_MESSAGES, "outcome", outcome);
    }

    public void setActiveConnections(long count) {
        activeConnections.set(count);
    }

    public long getCounterValue(String name, String... tags) {
        Counter counter = counters.get(key(name, tags));
        return counter != null ? (long) counter.count() : 0;
    }

    private void increment(String name, String... tags) {
        try {
            counter(name, tags).increment();
        } catch (RuntimeException e) {
            log.debug("Failed to record {}: {}", name, e.getMessage());
        }
    }

    private Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> registry.counter(name, tags));
    }

    private static String key(String name, String... tags) {
        return name + "_" + String.join("_", tags);
    }
}
