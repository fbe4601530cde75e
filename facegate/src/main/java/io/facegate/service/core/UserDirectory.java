package io.facegate.service.core;

import io.facegate.domain.event.UserSummary;

import java.util.Optional;

/**
 * Lookup of user accounts for user update events.
 */
@FunctionalInterface
public interface UserDirectory {
    Optional<UserSummary> findById(String userId);
}
