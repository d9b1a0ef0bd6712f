package com.example.photostatus.server.service;

import com.example.photostatus.server.metrics.RealtimeMetrics;
import com.example.photostatus.shared.dto.PhotoStatusUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Relays status updates published by the processing pipeline on Redis pub/sub. Malformed or
 * incomplete messages are dropped; nothing here ever propagates back into the listener container.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisPhotoStatusListener implements MessageListener {

    private final ObjectMapper objectMapper;
    private final PhotoStatusPublisher publisher;
    private final RealtimeMetrics metrics;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        handle(new String(message.getBody(), StandardCharsets.UTF_8));
    }

    void handle(String body) {
        if (body == null || body.isBlank()) {
            metrics.relayMessage("dropped");
            return;
        }
        PhotoStatusUpdate update;
        try {
            update = objectMapper.readValue(body, PhotoStatusUpdate.class);
        } catch (JsonProcessingException e) {
            log.debug("Dropping unparseable photo status message: {}", e.getOriginalMessage());
            metrics.relayMessage("dropped");
            return;
        }
        if (update == null || !update.isDeliverable()) {
            log.debug("Dropping incomplete photo status message");
            metrics.relayMessage("dropped");
            return;
        }
        try {
            publisher.publish(update);
            metrics.relayMessage("forwarded");
        } catch (RuntimeException e) {
            log.error("Failed to forward photo status event. userId='{}', photoId='{}', eventId='{}': {}",
                    update.getUserId(), update.getPhotoId(), update.getEventId(), e.getMessage(), e);
            metrics.relayMessage("failed");
        }
    }
}
