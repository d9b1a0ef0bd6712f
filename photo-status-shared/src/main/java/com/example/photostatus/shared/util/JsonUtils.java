package com.example.photostatus.shared.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Utility class for the lenient JSON handling used on both ends of the status stream.
 */
@Slf4j
public final class JsonUtils {

    private static final ObjectMapper objectMapper = newObjectMapper();

    private JsonUtils() {}

    /**
     * Creates an ObjectMapper configured the way status payloads are written and read.
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Parses a JSON document into the given type.
     *
     * @param json The JSON string to parse.
     * @param type The target type.
     * @return The parsed value, or empty if the input is blank or not valid JSON for the type.
     */
    public static <T> Optional<T> parse(String json, Class<T> type) {
        if (json == null || json.trim().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (Exception e) {
            log.debug("Ignoring unparseable JSON for {}: {}", type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Serializes a value to JSON.
     *
     * @param value The value to serialize.
     * @return The JSON string, or "{}" if the value is null.
     * @throws IllegalArgumentException if the value cannot be serialized.
     */
    public static String toJson(Object value) {
        if (value == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to serialize " + value.getClass().getSimpleName() + " to JSON", e);
        }
    }
}
