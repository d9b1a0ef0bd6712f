package com.example.photostatus.client.polling;

import lombok.Getter;

@Getter
public class JobStatusQueryException extends RuntimeException {

    private final Integer httpStatus;

    public JobStatusQueryException(String message) {
        this(message, (Integer) null);
    }

    public JobStatusQueryException(String message, Integer httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public JobStatusQueryException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = null;
    }

    public boolean isAuthFailure() {
        return httpStatus != null && (httpStatus == 401 || httpStatus == 403);
    }

    public boolean isNotFound() {
        return httpStatus != null && httpStatus == 404;
    }
}
