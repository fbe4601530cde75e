package io.facegate.backplane;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Process-local backplane.
 *
 * Used when the gateway runs as a single instance. Several gateways built in
 * one JVM behave like a cluster when each takes its own handle from
 * {@link #connect()}: closing a handle detaches only that handle's
 * subscribers. Handlers run synchronously on the publishing thread.
 */
public final class InMemoryBackplane implements Backplane {
    private static final Logger log = LoggerFactory.getLogger(InMemoryBackplane.class);

    private final ConcurrentMap<String, List<Consumer<String>>> handlers = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    @Override
    public CompletableFuture<Void> publish(String channel, String message) {
        if (closed) {
            return CompletableFuture.failedFuture(new BackplaneException("Backplane closed"));
        }
        for (Consumer<String> handler : handlers.getOrDefault(channel, List.of())) {
            try {
                handler.accept(message);
            } catch (RuntimeException e) {
                log.warn("[BUS] In-memory subscriber on {} failed: {}", channel, e.toString());
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void subscribe(String channel, Consumer<String> handler) {
        handlers.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>()).add(handler);
    }

    /**
     * Detach one subscriber, as if its process had exited.
     */
    public void unsubscribe(String channel, Consumer<String> handler) {
        List<Consumer<String>> list = handlers.get(channel);
        if (list != null) {
            list.remove(handler);
        }
    }

    /**
     * New handle on this backplane for one gateway instance.
     */
    public Backplane connect() {
        return new Handle();
    }

    /**
     * Close the whole backplane: every handle stops publishing and receiving.
     */
    @Override
    public void close() {
        closed = true;
        handlers.clear();
    }

    private final class Handle implements Backplane {
        private final ConcurrentMap<Consumer<String>, String> own = new ConcurrentHashMap<>();
        private volatile boolean handleClosed = false;

        @Override
        public CompletableFuture<Void> publish(String channel, String message) {
            if (handleClosed) {
                return CompletableFuture.failedFuture(new BackplaneException("Backplane handle closed"));
            }
            return InMemoryBackplane.this.publish(channel, message);
        }

        @Override
        public void subscribe(String channel, Consumer<String> handler) {
            if (handleClosed) {
                throw new BackplaneException("Backplane handle closed");
            }
            own.put(handler, channel);
            InMemoryBackplane.this.subscribe(channel, handler);
        }

        @Override
        public void close() {
            handleClosed = true;
            for (Map.Entry<Consumer<String>, String> e : own.entrySet()) {
                unsubscribe(e.getValue(), e.getKey());
            }
            own.clear();
        }
    }
}
