package io.facegate.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * User-facing notification. Global notifications have no target users.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationEvent(
    String notificationId,
    NotificationKind type,
    String title,
    String message,
    String timestamp,
    List<String> targetUsers,
    @JsonProperty("isGlobal") boolean isGlobal,
    String expiresAt
) {
    public NotificationEvent {
        targetUsers = targetUsers == null ? null : List.copyOf(targetUsers);
    }
}
