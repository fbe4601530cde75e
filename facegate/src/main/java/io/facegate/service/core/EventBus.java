package io.facegate.service.core;

import io.facegate.domain.common.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe keyed by event type.
 *
 * Handlers are registered at startup and run synchronously on the
 * publisher's thread in registration order. A failing handler is logged
 * and does not stop the others.
 */
public final class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<EventType, List<Consumer<DomainEvent>>> handlers = new EnumMap<>(EventType.class);

    public EventBus() {
        for (EventType type : EventType.values()) {
            handlers.put(type, new CopyOnWriteArrayList<>());
        }
    }

    public void subscribe(EventType type, Consumer<DomainEvent> handler) {
        handlers.get(type).add(handler);
    }

    public void subscribeAll(Consumer<DomainEvent> handler) {
        for (EventType type : EventType.values()) {
            subscribe(type, handler);
        }
    }

    /**
     * @return number of handlers that completed without throwing
     */
    public int publish(DomainEvent event) {
        List<Consumer<DomainEvent>> registered = handlers.get(event.type());
        if (registered.isEmpty()) {
            log.debug("No handlers for {}", event.type());
            return 0;
        }

        int ok = 0;
        for (Consumer<DomainEvent> handler : registered) {
            try {
                handler.accept(event);
                ok++;
            } catch (Exception e) {
                log.error("Handler failed for {}: {}", event.type(), e.getMessage(), e);
            }
        }
        return ok;
    }

    public int handlerCount(EventType type) {
        return handlers.get(type).size();
    }
}
