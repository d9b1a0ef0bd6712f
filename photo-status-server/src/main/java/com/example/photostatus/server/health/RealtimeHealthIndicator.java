package com.example.photostatus.server.health;

import com.example.photostatus.server.config.AppProperties;
import com.example.photostatus.server.service.PhotoEventBroadcaster;
import com.example.photostatus.server.service.PhotoEventHistory;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports live stream counts. The kill switch does not make the service unhealthy: clients fall
 * back to polling, which this service does not serve.
 */
@Component
@RequiredArgsConstructor
public class RealtimeHealthIndicator implements HealthIndicator {

    private final PhotoEventBroadcaster broadcaster;
    private final PhotoEventHistory history;
    private final AppProperties appProperties;

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("realtimeEnabled", !appProperties.getRealtime().isDisabled());
        try {
            details.put("activeConnections", broadcaster.getTotalConnectionCount());
            details.put("connectedUsers", broadcaster.getConnectedUserIds().size());
            details.put("historyUsers", history.getTrackedUserCount());
            details.put("maxConnectionsPerUser", appProperties.getSse().getMaxConnectionsPerUser());
            return Health.up().withDetails(details).build();
        } catch (Exception e) {
            details.put("sseError", e.getMessage());
            return Health.down().withDetails(details).build();
        }
    }
}
