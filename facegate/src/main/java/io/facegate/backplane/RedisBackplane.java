package io.facegate.backplane;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Redis pub/sub backplane.
 *
 * Redis requires a dedicated connection for SUBSCRIBE, so the process holds
 * two: one for PUBLISH and one for the subscription. Publishing uses the async
 * API and never blocks the broadcaster.
 */
public final class RedisBackplane implements Backplane {
    private static final Logger log = LoggerFactory.getLogger(RedisBackplane.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> publisher;
    private final StatefulRedisPubSubConnection<String, String> subscriber;

    public RedisBackplane(String host, int port, String password, int database) {
        RedisURI.Builder uri = RedisURI.builder()
            .withHost(host)
            .withPort(port)
            .withDatabase(database)
            .withTimeout(Duration.ofSeconds(5));
        if (password != null && !password.isEmpty()) {
            uri.withPassword(password.toCharArray());
        }

        this.client = RedisClient.create(uri.build());
        try {
            this.publisher = client.connect();
            this.subscriber = client.connectPubSub();
        } catch (RuntimeException e) {
            client.shutdown(Duration.ZERO, Duration.ofSeconds(2));
            throw new BackplaneException("Failed to connect to Redis at " + host + ":" + port, e);
        }
        log.info("[BUS] Connected to Redis {}:{} db={}", host, port, database);
    }

    RedisBackplane(RedisClient client,
                   StatefulRedisConnection<String, String> publisher,
                   StatefulRedisPubSubConnection<String, String> subscriber) {
        this.client = client;
        this.publisher = publisher;
        this.subscriber = subscriber;
    }

    @Override
    public CompletableFuture<Void> publish(String channel, String message) {
        try {
            return publisher.async().publish(channel, message)
                .toCompletableFuture()
                .thenApply(receivers -> {
                    log.trace("[BUS] Published to {} ({} receivers)", channel, receivers);
                    return null;
                });
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new BackplaneException("Redis publish failed", e));
        }
    }

    @Override
    public void subscribe(String channel, Consumer<String> handler) {
        subscriber.addListener(new RedisPubSubAdapter<>() {
            @Override
            public void message(String ch, String message) {
                if (channel.equals(ch)) {
                    handler.accept(message);
                }
            }
        });
        subscriber.async().subscribe(channel).whenComplete((ok, error) -> {
            if (error != null) {
                log.error("[BUS] Failed to subscribe to {}: {}", channel, error.toString());
            } else {
                log.info("[BUS] Subscribed to {}", channel);
            }
        });
    }

    @Override
    public void close() {
        try {
            subscriber.close();
            publisher.close();
        } finally {
            client.shutdown(Duration.ZERO, Duration.ofSeconds(2));
        }
        log.info("[BUS] Redis connections closed");
    }
}
