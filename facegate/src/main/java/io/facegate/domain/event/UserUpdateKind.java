package io.facegate.domain.event;

/**
 * Lifecycle change reported for a user account.
 */
public enum UserUpdateKind {
    CREATED,
    UPDATED,
    DELETED,
    ACTIVATED,
    DEACTIVATED
}
