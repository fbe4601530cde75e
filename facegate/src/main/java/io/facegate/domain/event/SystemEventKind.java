package io.facegate.domain.event;

/**
 * System-level occurrences.
 */
public enum SystemEventKind {
    SYSTEM_START,
    SYSTEM_STOP,
    CONFIG_UPDATE,
    BACKUP_COMPLETE,
    ERROR_OCCURRED
}
