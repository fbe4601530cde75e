package io.facegate.domain.event;

/**
 * Reported device state.
 */
public enum DeviceStatus {
    ONLINE,
    OFFLINE,
    ERROR,
    MAINTENANCE
}
