package io.facegate.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit trail entry for an action performed through the back office.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActivityLogEvent(
    String logId,
    String userId,
    String action,
    String resource,
    Map<String, Object> details,
    String timestamp,
    String ipAddress,
    String userAgent
) {
    public ActivityLogEvent {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
