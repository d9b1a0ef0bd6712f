package com.example.photostatus.client.stream;

import lombok.Getter;

/**
 * The event stream could not be opened or broke off.
 */
@Getter
public class StreamConnectException extends RuntimeException {

    /** HTTP status of the refused request, or null when the failure was not an HTTP response. */
    private final Integer httpStatus;

    public StreamConnectException(String message, Integer httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public StreamConnectException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = null;
    }
}
