package io.facegate.domain.event;

/**
 * Alert category.
 */
public enum AlertType {
    SECURITY,
    SYSTEM,
    PERFORMANCE,
    MAINTENANCE
}
