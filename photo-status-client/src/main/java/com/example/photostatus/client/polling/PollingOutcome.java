package com.example.photostatus.client.polling;

import com.example.photostatus.shared.util.Constants.PhotoState;

import java.util.Optional;

/**
 * Why a polling task ended.
 */
public enum PollingOutcome {
    SUCCEEDED(PhotoState.FINISHED),
    JOB_FAILED(PhotoState.ERROR),
    HARD_TIMEOUT(PhotoState.ERROR),
    TOO_MANY_ERRORS(PhotoState.ERROR),
    STOPPED(null),
    AUTH_FAILED(null),
    NOT_FOUND(null);

    private final PhotoState photoState;

    PollingOutcome(PhotoState photoState) {
        this.photoState = photoState;
    }

    /**
     * The state the photo is shown in after this outcome, if the outcome decides one.
     */
    public Optional<PhotoState> getPhotoState() {
        return Optional.ofNullable(photoState);
    }
}
