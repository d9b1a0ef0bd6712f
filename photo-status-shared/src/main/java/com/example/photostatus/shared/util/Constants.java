package com.example.photostatus.shared.util;

import java.util.Locale;
import java.util.Optional;

public final class Constants {

    // Private constructor to prevent instantiation
    private Constants() {}

    public static final String PHOTO_PROCESSING_EVENT = "photo.processing";
    public static final String PHOTO_STATUS_CHANNEL = "photo:status:v1";

    public static final class Headers {
        private Headers() {}
        public static final String LAST_EVENT_ID = "Last-Event-ID";
        public static final String REQUEST_ID = "X-Request-Id";
        public static final String AUTHENTICATED_USER_ID = "X-Authenticated-User-Id";
    }

    /**
     * Processing status carried by {@code photo.processing} events.
     */
    public enum ProcessingStatus {
        QUEUED("queued"),
        PROCESSING("processing"),
        FINISHED("finished"),
        FAILED("failed");

        private final String wireValue;

        ProcessingStatus(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }

        public static Optional<ProcessingStatus> fromWire(String value) {
            if (value == null) {
                return Optional.empty();
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ProcessingStatus status : values()) {
                if (status.wireValue.equals(normalized)) {
                    return Optional.of(status);
                }
            }
            return Optional.empty();
        }

        public PhotoState toPhotoState() {
            switch (this) {
                case FINISHED:
                    return PhotoState.FINISHED;
                case FAILED:
                    return PhotoState.ERROR;
                default:
                    return PhotoState.IN_PROGRESS;
            }
        }
    }

    /**
     * The only three states a photo is ever displayed in.
     */
    public enum PhotoState {
        IN_PROGRESS("inprogress"),
        FINISHED("finished"),
        ERROR("error");

        private final String wireValue;

        PhotoState(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }

        public boolean isTerminal() {
            return this != IN_PROGRESS;
        }

        /**
         * Maps a job state reported by the job-status query. Unknown values count as still running.
         */
        public static PhotoState fromJobState(String jobState) {
            String normalized = jobState == null ? "" : jobState.trim().toLowerCase(Locale.ROOT);
            switch (normalized) {
                case "finished":
                    return FINISHED;
                case "error":
                case "failed":
                    return ERROR;
                default:
                    return IN_PROGRESS;
            }
        }
    }
}
