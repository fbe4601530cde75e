package io.facegate.gateway;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Selects which connections a broadcast goes to. Evaluated at dispatch time.
 */
public interface BroadcastTarget {

    /**
     * Snapshot of the connections selected by this target.
     */
    List<Connection> resolve(ConnectionRegistry registry);

    /**
     * False for targets that cannot be described to another instance.
     */
    default boolean isDistributable() {
        return true;
    }

    static BroadcastTarget all() {
        return All.INSTANCE;
    }

    static BroadcastTarget users(Set<String> userIds) {
        return new ByUser(userIds);
    }

    static BroadcastTarget user(String userId) {
        return new ByUser(Set.of(userId));
    }

    static BroadcastTarget role(String role) {
        return new ByRole(role);
    }

    static BroadcastTarget excluding(Set<String> userIds) {
        return new ExcludingUsers(userIds);
    }

    static BroadcastTarget matching(Predicate<Connection> predicate) {
        return new Matching(predicate);
    }

    final class All implements BroadcastTarget {
        static final All INSTANCE = new All();

        private All() {}

        @Override
        public List<Connection> resolve(ConnectionRegistry registry) {
            return registry.listAll();
        }

        @Override
        public String toString() {
            return "All";
        }
    }

    record ByUser(Set<String> userIds) implements BroadcastTarget {
        public ByUser {
            userIds = Set.copyOf(userIds);
        }

        @Override
        public List<Connection> resolve(ConnectionRegistry registry) {
            return userIds.stream()
                .flatMap(id -> registry.listByUser(id).stream())
                .toList();
        }
    }

    record ByRole(String role) implements BroadcastTarget {
        public ByRole {
            Objects.requireNonNull(role, "role");
        }

        @Override
        public List<Connection> resolve(ConnectionRegistry registry) {
            return registry.listByRole(role);
        }
    }

    record ExcludingUsers(Set<String> userIds) implements BroadcastTarget {
        public ExcludingUsers {
            userIds = Set.copyOf(userIds);
        }

        @Override
        public List<Connection> resolve(ConnectionRegistry registry) {
            return registry.listAll().stream()
                .filter(c -> !userIds.contains(c.getUserId()))
                .toList();
        }
    }

    /**
     * Arbitrary local filter. Never leaves this process.
     */
    record Matching(Predicate<Connection> predicate) implements BroadcastTarget {
        public Matching {
            Objects.requireNonNull(predicate, "predicate");
        }

        @Override
        public List<Connection> resolve(ConnectionRegistry registry) {
            return registry.listAll().stream().filter(predicate).toList();
        }

        @Override
        public boolean isDistributable() {
            return false;
        }
    }
}
