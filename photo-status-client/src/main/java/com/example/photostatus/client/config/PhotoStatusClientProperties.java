package com.example.photostatus.client.config;

import com.example.photostatus.client.backoff.ReconnectBackoff;
import com.example.photostatus.client.dedupe.EventDedupeCache;
import com.example.photostatus.client.polling.PollingOptions;
import com.example.photostatus.client.polling.PollingTaskManager;
import com.example.photostatus.client.stream.StreamConnector;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "photo-status.client")
public class PhotoStatusClientProperties {

    private String baseUrl = "http://localhost:8080";
    private String eventsPath = "/api/events/photos";
    private int dedupeCapacity = EventDedupeCache.DEFAULT_CAPACITY;
    private int fallbackFailureThreshold = StreamConnector.DEFAULT_FALLBACK_FAILURE_THRESHOLD;
    private int maxConsecutivePollErrors = PollingTaskManager.DEFAULT_MAX_CONSECUTIVE_ERRORS;
    private Duration statusRequestTimeout = Duration.ofSeconds(10);
    private final Backoff backoff = new Backoff();
    private final Polling polling = new Polling();

    @Data
    public static class Backoff {
        private long baseMs = ReconnectBackoff.DEFAULT_BASE_MS;
        private long maxMs = ReconnectBackoff.DEFAULT_MAX_MS;
        private double jitterRatio = ReconnectBackoff.DEFAULT_JITTER_RATIO;
    }

    @Data
    public static class Polling {
        private long intervalMs = PollingOptions.DEFAULT_INTERVAL_MS;
        private long maxIntervalMs = PollingOptions.DEFAULT_MAX_INTERVAL_MS;
        private long softTimeoutMs = PollingOptions.DEFAULT_SOFT_TIMEOUT_MS;
        private long hardTimeoutMs = PollingOptions.DEFAULT_HARD_TIMEOUT_MS;

        public PollingOptions toOptions() {
            return new PollingOptions(intervalMs, maxIntervalMs, softTimeoutMs, hardTimeoutMs);
        }
    }
}
