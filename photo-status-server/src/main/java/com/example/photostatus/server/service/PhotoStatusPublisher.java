package com.example.photostatus.server.service;

import com.example.photostatus.shared.dto.PhotoStatusUpdate;
import com.example.photostatus.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for status updates coming out of the processing pipeline. Each update goes into the
 * owner's history and then to the owner's open streams only.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PhotoStatusPublisher {

    private final PhotoEventBroadcaster broadcaster;
    private final PhotoEventHistory history;

    /**
     * @throws IllegalArgumentException if the update is missing a field or carries an unknown status
     */
    public PublishResult publish(PhotoStatusUpdate update) {
        if (update == null || !update.isDeliverable()) {
            throw new IllegalArgumentException("Photo status update is incomplete or has an unknown status");
        }
        history.append(update);
        PublishResult result = broadcaster.publish(update.getUserId(), Constants.PHOTO_PROCESSING_EVENT, update);
        log.info("Forwarded photo status event. userId='{}', photoId='{}', status='{}', eventId='{}', delivered={}",
                update.getUserId(), update.getPhotoId(), update.getStatus(), update.getEventId(), result.getDelivered());
        return result;
    }
}
