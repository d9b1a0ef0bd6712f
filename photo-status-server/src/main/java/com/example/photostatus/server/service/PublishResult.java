package com.example.photostatus.server.service;

import lombok.Value;

/**
 * Outcome of a publish: how many connections accepted the frame and the event id it carried.
 * The id is null when the user had no open connections.
 */
@Value
public class PublishResult {
    int delivered;
    String eventId;

    public static PublishResult none() {
        return new PublishResult(0, null);
    }
}
