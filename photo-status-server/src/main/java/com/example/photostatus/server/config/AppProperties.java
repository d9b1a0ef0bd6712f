package com.example.photostatus.server.config;

import com.example.photostatus.shared.util.Constants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "photo-status")
public class AppProperties {

    @Valid
    private final Realtime realtime = new Realtime();
    @Valid
    private final Sse sse = new Sse();
    @Valid
    private final History history = new History();
    @Valid
    private final Relay relay = new Relay();

    @Data
    public static class Realtime {
        // Kill switch; bound from REALTIME_EVENTS_DISABLED in application.yml
        private boolean disabled = false;
    }

    @Data
    public static class Sse {
        @Positive
        private int maxConnectionsPerUser = 3;
        // 0 disables heartbeats
        @PositiveOrZero
        private long heartbeatMs = 25000L;
        @Min(1)
        private int maxBufferedFrames = 256;
    }

    @Data
    public static class History {
        @Positive
        private int maxEntries = 200;
        @Positive
        private int maxReplay = 200;
        @Positive
        private long maxUsers = 10000L;
        @NotNull
        private Duration ttl = Duration.ofMinutes(10);
    }

    @Data
    public static class Relay {
        private boolean redisEnabled = false;
        @NotBlank
        private String channel = Constants.PHOTO_STATUS_CHANNEL;
    }
}
