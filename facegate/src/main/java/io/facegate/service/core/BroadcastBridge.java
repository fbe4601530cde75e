package io.facegate.service.core;

import io.facegate.gateway.Broadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards every bus event to the gateway broadcaster.
 */
public final class BroadcastBridge {
    private static final Logger log = LoggerFactory.getLogger(BroadcastBridge.class);

    private final Broadcaster broadcaster;

    public BroadcastBridge(Broadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    public void attach(EventBus bus) {
        bus.subscribeAll(this::forward);
        log.info("Broadcast bridge attached to event bus");
    }

    void forward(DomainEvent event) {
        broadcaster.broadcast(event.type(), event.payload(), event.target());
    }
}
