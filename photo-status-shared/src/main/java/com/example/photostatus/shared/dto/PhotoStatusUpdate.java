package com.example.photostatus.shared.dto;

import com.example.photostatus.shared.util.Constants.ProcessingStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Optional;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PhotoStatusUpdate implements Serializable {
    private String userId;
    private String eventId;
    private String photoId;
    private String status; // queued, processing, finished, failed
    private String updatedAt;
    private Double progress;

    @JsonIgnore
    public Optional<ProcessingStatus> getProcessingStatus() {
        return ProcessingStatus.fromWire(status);
    }

    /**
     * An update is deliverable only when every identifying field is present and the status is known.
     */
    @JsonIgnore
    public boolean isDeliverable() {
        return isNonBlank(userId)
                && isNonBlank(eventId)
                && isNonBlank(photoId)
                && isNonBlank(updatedAt)
                && getProcessingStatus().isPresent()
                && (progress == null || Double.isFinite(progress));
    }

    private static boolean isNonBlank(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
