package com.example.photostatus.server.controller;

import com.example.photostatus.server.service.PhotoStatusPublisher;
import com.example.photostatus.server.service.PublishResult;
import com.example.photostatus.shared.dto.PhotoStatusUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Internal ingestion endpoint for pipelines that cannot publish to Redis. Meant to sit behind the
 * service mesh, not the public gateway.
 */
@RestController
@RequestMapping("/api/internal/photo-status")
@RequiredArgsConstructor
@Slf4j
public class PhotoStatusController {

    private final PhotoStatusPublisher publisher;

    @PostMapping
    public ResponseEntity<PublishResult> publish(@RequestBody PhotoStatusUpdate update) {
        log.debug("Received photo status update for photoId='{}'", update.getPhotoId());
        return ResponseEntity.accepted().body(publisher.publish(update));
    }
}
