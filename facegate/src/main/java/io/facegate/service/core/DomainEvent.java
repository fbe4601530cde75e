package io.facegate.service.core;

import io.facegate.domain.common.EventType;
import io.facegate.gateway.BroadcastTarget;

/**
 * Event published on the in-process bus: a typed payload and who should receive it.
 */
public record DomainEvent(EventType type, Object payload, BroadcastTarget target) {
    public DomainEvent {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        target = target == null ? BroadcastTarget.all() : target;
    }

    public static DomainEvent toAll(EventType type, Object payload) {
        return new DomainEvent(type, payload, BroadcastTarget.all());
    }
}
