package com.example.photostatus.client.stream;

import reactor.core.publisher.Flux;

/**
 * Opens the push stream. The returned flux is cold: each subscription is a new connection, and
 * cancelling it closes that connection. Failures are signalled as {@link StreamConnectException}.
 */
public interface PhotoEventStreamTransport {

    /**
     * @param accessToken bearer token for the session, may be null
     * @param lastEventId last event id seen on a previous connection, may be null
     */
    Flux<StreamFrame> open(String accessToken, String lastEventId);
}
