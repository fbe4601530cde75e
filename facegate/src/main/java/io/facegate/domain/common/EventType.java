package io.facegate.domain.common;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event types a client can subscribe to.
 * The wire name of each constant is its {@link #name()}.
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // DOMAIN EVENTS
    // ═══════════════════════════════════════════════════════════════
    FACE_RECOGNITION,
    USER_UPDATE,
    SYSTEM_EVENT,
    STATISTICS_UPDATE,
    ACTIVITY_LOG,
    DEVICE_STATUS,
    ALERT,
    NOTIFICATION,

    // ═══════════════════════════════════════════════════════════════
    // CONNECTION PROTOCOL
    // ═══════════════════════════════════════════════════════════════
    HEARTBEAT,
    CONNECTION_STATUS,
    ERROR;

    /**
     * Case-sensitive lookup by wire name.
     */
    public static Optional<EventType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(t -> t.name().equals(name))
            .findFirst();
    }
}
