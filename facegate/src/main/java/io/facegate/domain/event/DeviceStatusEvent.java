package io.facegate.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Device health report. metrics and alerts are optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceStatusEvent(
    String deviceId,
    DeviceType deviceType,
    DeviceStatus status,
    String lastUpdate,
    Map<String, Object> metrics,
    List<String> alerts
) {
    public DeviceStatusEvent {
        metrics = metrics == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        alerts = alerts == null ? null : List.copyOf(alerts);
    }
}
