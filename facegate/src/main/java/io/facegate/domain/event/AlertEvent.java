package io.facegate.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertEvent(
    String alertId,
    AlertType type,
    AlertSeverity severity,
    String title,
    String message,
    String timestamp,
    @JsonProperty("isRead") boolean isRead,
    Map<String, Object> metadata
) {
    public AlertEvent {
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
