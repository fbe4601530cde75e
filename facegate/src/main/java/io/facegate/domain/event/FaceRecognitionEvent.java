package io.facegate.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Face recognition result pushed to dashboards.
 * userId is null for unknown faces; cameraId, location, imageUrl and metadata are optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FaceRecognitionEvent(
    String eventId,
    FaceEventKind eventType,
    String faceId,
    String userId,
    double confidence,
    String cameraId,
    String location,
    String imageUrl,
    Map<String, Object> metadata,
    String timestamp,
    long recognitionTime
) {
    public FaceRecognitionEvent {
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
