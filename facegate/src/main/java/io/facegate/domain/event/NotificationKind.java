package io.facegate.domain.event;

/**
 * Presentation level of a user notification.
 */
public enum NotificationKind {
    INFO,
    WARNING,
    SUCCESS,
    ERROR
}
