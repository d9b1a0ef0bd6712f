package com.example.photostatus.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Body returned by the events endpoint whenever it refuses to open a stream.
 */
@Data
@AllArgsConstructor
public class RealtimeErrorResponse {
    private final boolean success;
    private final String error;
    private final String requestId;

    public static RealtimeErrorResponse of(String error, String requestId) {
        return new RealtimeErrorResponse(false, error, requestId);
    }
}
