package io.facegate.gateway;

import io.facegate.auth.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Table of live, authenticated connections.
 *
 * Every mutation of one id runs inside a single {@code compute*} call, so they
 * are atomic per id. Listing methods return snapshots that are safe to iterate
 * while connections come and go.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    // ConnectionId -> Connection
    private final ConcurrentMap<String, Connection> connections = new ConcurrentHashMap<>();

    // UserId -> ConnectionIds (for targeted delivery)
    private final ConcurrentMap<String, Set<String>> userConnections = new ConcurrentHashMap<>();

    private final Clock clock;

    public ConnectionRegistry() {
        this(Clock.systemUTC());
    }

    public ConnectionRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Register (or re-register) an authenticated connection with empty subscriptions.
     *
     * If the transport is already closed when the insert commits, the entry is
     * rolled back so a dead transport never stays registered.
     *
     * @return the stored connection, or empty if the transport closed meanwhile
     */
    public Optional<Connection> add(String id, Identity identity, ClientTransport transport) {
        Objects.requireNonNull(transport, "transport");
        Connection stored = connections.compute(id, (key, existing) -> {
            if (existing != null) {
                unindex(existing);
            }
            Connection fresh = Connection.open(key, identity, transport, clock.instant());
            index(fresh);
            return fresh;
        });

        if (!transport.isOpen()) {
            remove(id, transport);
            log.debug("Discarded registration of {}: transport already closed", id);
            return Optional.empty();
        }
        return Optional.of(stored);
    }

    /**
     * Remove a connection regardless of its transport. No-op if absent.
     */
    public Optional<Connection> remove(String id) {
        Connection[] removed = new Connection[1];
        connections.computeIfPresent(id, (key, existing) -> {
            unindex(existing);
            removed[0] = existing;
            return null;
        });
        return Optional.ofNullable(removed[0]);
    }

    /**
     * Remove a connection only if it is still bound to the given transport.
     */
    public Optional<Connection> remove(String id, ClientTransport transport) {
        Connection[] removed = new Connection[1];
        connections.computeIfPresent(id, (key, existing) -> {
            if (existing.getTransport() != transport) {
                return existing;
            }
            unindex(existing);
            removed[0] = existing;
            return null;
        });
        return Optional.ofNullable(removed[0]);
    }

    public Optional<Connection> get(String id) {
        return Optional.ofNullable(connections.get(id));
    }

    public List<Connection> listAll() {
        return List.copyOf(connections.values());
    }

    public List<Connection> listByUser(String userId) {
        Set<String> ids = userConnections.get(userId);
        if (ids == null) {
            return List.of();
        }
        List<Connection> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            Connection c = connections.get(id);
            if (c != null && c.getUserId().equals(userId)) {
                result.add(c);
            }
        }
        return result;
    }

    public List<Connection> listByRole(String role) {
        return connections.values().stream()
            .filter(c -> Objects.equals(c.getRole(), role))
            .toList();
    }

    /**
     * Record client activity.
     */
    public Optional<Connection> touch(String id) {
        Instant now = clock.instant();
        return update(id, c -> c.withLastActivity(now));
    }

    /**
     * Atomically replace the snapshot for {@code id}. No-op if absent.
     */
    public Optional<Connection> update(String id, UnaryOperator<Connection> change) {
        return Optional.ofNullable(connections.computeIfPresent(id, (key, existing) -> change.apply(existing)));
    }

    public boolean contains(String id) {
        return connections.containsKey(id);
    }

    public int size() {
        return connections.size();
    }

    /**
     * Number of distinct users with at least one connection.
     */
    public int userCount() {
        return userConnections.size();
    }

    Instant now() {
        return clock.instant();
    }

    private void index(Connection c) {
        userConnections.compute(c.getUserId(), (userId, ids) -> {
            Set<String> set = ids != null ? ids : ConcurrentHashMap.newKeySet();
            set.add(c.getId());
            return set;
        });
    }

    private void unindex(Connection c) {
        userConnections.computeIfPresent(c.getUserId(), (userId, ids) -> {
            ids.remove(c.getId());
            return ids.isEmpty() ? null : ids;
        });
    }
}
