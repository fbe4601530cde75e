package io.facegate.domain.event;

/**
 * Severity of a system event.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
