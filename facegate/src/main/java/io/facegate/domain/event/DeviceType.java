package io.facegate.domain.event;

/**
 * Kind of monitored device.
 */
public enum DeviceType {
    CAMERA,
    SERVER,
    DATABASE,
    CACHE
}
