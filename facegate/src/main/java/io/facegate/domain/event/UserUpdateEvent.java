package io.facegate.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A user account was created, changed or removed.
 * Presence updates also carry {@code online}; account updates leave it null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserUpdateEvent(
    String userId,
    UserUpdateKind updateType,
    UserSummary userData,
    String timestamp,
    Boolean online
) {
    public UserUpdateEvent(String userId, UserUpdateKind updateType, UserSummary userData, String timestamp) {
        this(userId, updateType, userData, timestamp, null);
    }
}
