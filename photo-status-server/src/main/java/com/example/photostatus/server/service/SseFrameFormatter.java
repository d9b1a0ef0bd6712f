package com.example.photostatus.server.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Renders raw text/event-stream frames. Every frame ends with a blank line.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SseFrameFormatter {

    public static final String HEARTBEAT_FRAME = ": ping\n\n";
    public static final String CONNECTED_FRAME = ": connected\n\n";

    private final ObjectMapper objectMapper;

    /**
     * Builds an {@code event:}/{@code id:}/{@code data:} frame. String data is written verbatim,
     * anything else is serialized as JSON.
     *
     * @throws IllegalArgumentException if the name or id is blank or the data cannot be serialized
     */
    public String formatEvent(String eventName, String eventId, Object data) {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("SSE event name is required");
        }
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("SSE event id is required");
        }
        StringBuilder frame = new StringBuilder();
        frame.append("event: ").append(eventName).append('\n');
        frame.append("id: ").append(eventId).append('\n');
        // A payload containing newlines would split into several data lines
        for (String line : serialize(data).split("\n", -1)) {
            frame.append("data: ").append(line).append('\n');
        }
        return frame.append('\n').toString();
    }

    public String heartbeat() {
        return HEARTBEAT_FRAME;
    }

    public String connected() {
        return CONNECTED_FRAME;
    }

    public String comment(String text) {
        return ": " + text.replace('\n', ' ') + "\n\n";
    }

    private String serialize(Object data) {
        if (data instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.error("Error serializing SSE payload of type {}: {}",
                    data == null ? "null" : data.getClass().getSimpleName(), e.getMessage());
            throw new IllegalArgumentException("SSE payload is not serializable", e);
        }
    }
}
