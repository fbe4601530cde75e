package io.facegate.gateway;

import io.facegate.auth.Identity;
import io.facegate.domain.common.EventType;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Authenticated client connection.
 *
 * Immutable: the registry replaces the whole snapshot on every change, so a
 * reader holding a reference always sees a consistent view.
 */
public final class Connection {
    private final String id;
    private final String userId;
    private final String email;
    private final String role;
    private final Instant connectedAt;
    private final Instant lastActivityAt;
    private final Set<EventType> subscriptions;   // empty = everything
    private final ClientTransport transport;

    private Connection(String id, String userId, String email, String role,
                       Instant connectedAt, Instant lastActivityAt,
                       Set<EventType> subscriptions, ClientTransport transport) {
        this.id = id;
        this.userId = userId;
        this.email = email;
        this.role = role;
        this.connectedAt = connectedAt;
        this.lastActivityAt = lastActivityAt;
        this.subscriptions = subscriptions;
        this.transport = transport;
    }

    static Connection open(String id, Identity identity, ClientTransport transport, Instant now) {
        return new Connection(id, identity.subject(), identity.email(), identity.role(),
            now, now, Collections.emptySet(), transport);
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    public String getRole() {
        return role;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    /**
     * Subscribed event types; empty means the connection receives every type.
     */
    public Set<EventType> getSubscriptions() {
        return subscriptions;
    }

    public ClientTransport getTransport() {
        return transport;
    }

    Connection withSubscriptions(Set<EventType> types, Instant now) {
        Set<EventType> copy = types.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(types));
        return new Connection(id, userId, email, role, connectedAt, now, copy, transport);
    }

    Connection withLastActivity(Instant now) {
        return new Connection(id, userId, email, role, connectedAt, now, subscriptions, transport);
    }

    @Override
    public String toString() {
        return String.format("Connection[%s user=%s role=%s subs=%s]", id, userId, role, subscriptions);
    }
}
