package io.facegate.gateway;

import io.facegate.domain.common.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Per-connection event type filters.
 *
 * An empty subscription set means "receive everything". Removing types from
 * an empty set leaves it empty: the connection keeps receiving everything
 * rather than switching to "everything except".
 */
public final class SubscriptionManager {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

    private final ConnectionRegistry registry;

    public SubscriptionManager(ConnectionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Replace the full subscription set of a connection.
     *
     * @return the new set, or empty if the connection is not registered
     * @throws ValidationException if any name is not an event type; the prior set is kept
     */
    public Optional<Set<EventType>> setSubscriptions(String connectionId, Collection<String> names) {
        return setSubscriptionTypes(connectionId, parse(names));
    }

    public Optional<Set<EventType>> setSubscriptionTypes(String connectionId, Set<EventType> types) {
        Set<EventType> replacement = types.isEmpty() ? Collections.emptySet() : EnumSet.copyOf(types);
        return registry.update(connectionId, c -> c.withSubscriptions(replacement, registry.now()))
            .map(c -> {
                log.info("Connection {} subscribed to {}", connectionId, c.getSubscriptions());
                return c.getSubscriptions();
            });
    }

    /**
     * Remove types from a connection's subscription set.
     *
     * @return the remaining set, or empty if the connection is not registered
     * @throws ValidationException if any name is not an event type; the prior set is kept
     */
    public Optional<Set<EventType>> removeSubscriptions(String connectionId, Collection<String> names) {
        return removeSubscriptionTypes(connectionId, parse(names));
    }

    public Optional<Set<EventType>> removeSubscriptionTypes(String connectionId, Set<EventType> types) {
        return registry.update(connectionId, c -> {
            if (c.getSubscriptions().isEmpty()) {
                return c.withLastActivity(registry.now());
            }
            Set<EventType> remaining = EnumSet.copyOf(c.getSubscriptions());
            remaining.removeAll(types);
            return c.withSubscriptions(remaining, registry.now());
        }).map(c -> {
            log.info("Connection {} unsubscribed from {} (remaining {})", connectionId, types, c.getSubscriptions());
            return c.getSubscriptions();
        });
    }

    /**
     * True if the connection should receive events of this type.
     */
    public boolean matches(Connection connection, EventType type) {
        Set<EventType> subscriptions = connection.getSubscriptions();
        return subscriptions.isEmpty() || subscriptions.contains(type);
    }

    /**
     * Parse wire names, rejecting the whole request if any is unknown.
     */
    public static Set<EventType> parse(Collection<String> names) {
        if (names == null) {
            throw new ValidationException("Missing 'events'", List.of());
        }
        Set<EventType> types = EnumSet.noneOf(EventType.class);
        List<String> unknown = new ArrayList<>();
        for (String name : names) {
            Optional<EventType> type = EventType.fromName(name);
            if (type.isPresent()) {
                types.add(type.get());
            } else {
                unknown.add(String.valueOf(name));
            }
        }
        if (!unknown.isEmpty()) {
            throw new ValidationException("Unknown event type(s): " + String.join(", ", unknown), unknown);
        }
        return types;
    }
}
