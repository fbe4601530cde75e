package io.facegate.domain.event;

/**
 * Alert urgency.
 */
public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
