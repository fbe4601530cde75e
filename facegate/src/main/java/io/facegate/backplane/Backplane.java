package io.facegate.backplane;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Shared publish/subscribe channel between gateway instances.
 * One publishing handle and one subscribing handle per process.
 */
public interface Backplane extends AutoCloseable {

    /**
     * Publish without blocking the caller.
     *
     * @return completes when the backplane accepted the message, or exceptionally
     */
    CompletableFuture<Void> publish(String channel, String message);

    /**
     * Register the handler invoked for every message on {@code channel},
     * including messages published by this process.
     */
    void subscribe(String channel, Consumer<String> handler);

    /**
     * Close both handles. In-flight messages are not drained.
     */
    @Override
    void close();
}
