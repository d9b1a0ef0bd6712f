package com.example.photostatus.client.stream;

/**
 * The server deliberately refused the stream: real-time delivery is switched off (503) or the
 * user is at the connection cap (429). Retrying with backoff would only flap.
 */
public class StreamRejectedException extends StreamConnectException {

    public StreamRejectedException(int httpStatus) {
        super("Event stream rejected (HTTP " + httpStatus + ")", httpStatus);
    }

    public static boolean isRejection(int httpStatus) {
        return httpStatus == 503 || httpStatus == 429;
    }

    public FallbackReason toFallbackReason() {
        return getHttpStatus() != null && getHttpStatus() == 503
                ? FallbackReason.SERVER_DISABLED
                : FallbackReason.TOO_MANY_CONNECTIONS;
    }
}
