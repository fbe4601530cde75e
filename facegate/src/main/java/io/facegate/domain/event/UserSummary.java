package io.facegate.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of a user account carried in user update events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserSummary(
    String id,
    String email,
    String firstName,
    String lastName,
    String role,
    @JsonProperty("isActive") boolean isActive,
    String lastLogin
) {
    public static UserSummary of(String id, String email, String role) {
        return new UserSummary(id, email, null, null, role, true, null);
    }
}
