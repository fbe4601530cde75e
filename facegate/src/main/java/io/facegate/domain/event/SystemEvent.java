package io.facegate.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SystemEvent(
    String eventId,
    SystemEventKind eventType,
    Severity severity,
    String message,
    String timestamp,
    Map<String, Object> metadata
) {
    public SystemEvent {
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
