package io.facegate.config;

import io.facegate.util.Env;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Gateway configuration, read once at startup.
 *
 * @param instanceId      identifies this process on the backplane
 * @param allowedOrigins  WebSocket handshake origins; "*" allows any
 * @param backplane       "redis" or "memory"
 */
public record GatewayConfig(
    String instanceId,
    int port,
    String wsPath,
    String jwtSecret,
    long jwtExpirationMs,
    Duration heartbeatInterval,
    Duration authTimeout,
    Duration sendTimeout,
    int authWorkers,
    List<String> allowedOrigins,
    String backplane,
    String redisHost,
    int redisPort,
    String redisPassword,
    int redisDb,
    String backplaneChannel,
    boolean presenceBroadcast,
    boolean productionMode
) {
    public static final String DEFAULT_JWT_SECRET = "facegate-secret-key-change-in-production";
    public static final String DEFAULT_CHANNEL = "websocket:broadcast";

    public static final String BACKPLANE_REDIS = "redis";
    public static final String BACKPLANE_MEMORY = "memory";

    /**
     * Load from environment variables (system properties as fallback).
     */
    public static GatewayConfig fromEnv() {
        return new GatewayConfig(
            Env.get("INSTANCE_ID", "gw-" + UUID.randomUUID().toString().substring(0, 8)),
            Env.getInt("PORT", 9090),
            Env.get("WS_PATH", "/ws"),
            Env.get("JWT_SECRET", DEFAULT_JWT_SECRET),
            Env.getInt("JWT_EXPIRATION_HOURS", 24) * 3600000L,
            Duration.ofMillis(Env.getLong("HEARTBEAT_INTERVAL_MS", 30_000)),
            Duration.ofMillis(Env.getLong("AUTH_TIMEOUT_MS", 10_000)),
            Duration.ofMillis(Env.getLong("SEND_TIMEOUT_MS", 5_000)),
            Env.getInt("AUTH_WORKERS", 4),
            Env.getList("ALLOWED_ORIGINS", "*"),
            Env.get("BACKPLANE", BACKPLANE_MEMORY).toLowerCase(),
            Env.get("REDIS_HOST", "localhost"),
            Env.getInt("REDIS_PORT", 6379),
            Env.get("REDIS_PASSWORD", null),
            Env.getInt("REDIS_DB", 0),
            Env.get("BACKPLANE_CHANNEL", DEFAULT_CHANNEL),
            Env.getBool("PRESENCE_BROADCAST", true),
            Env.getBool("PRODUCTION_MODE", false)
        );
    }

    public boolean allowsAnyOrigin() {
        return allowedOrigins.isEmpty() || allowedOrigins.contains("*");
    }

    public boolean isOriginAllowed(String origin) {
        if (allowsAnyOrigin()) {
            return true;
        }
        // Non-browser clients send no Origin header
        return origin == null || allowedOrigins.contains(origin);
    }

    public boolean usesRedis() {
        return BACKPLANE_REDIS.equals(backplane);
    }
}
