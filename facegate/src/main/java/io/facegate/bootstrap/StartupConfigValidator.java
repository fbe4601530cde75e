package io.facegate.bootstrap;

import io.facegate.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Runs before any component is built. In production mode every check is a
 * hard gate: the process refuses to start with an {@link IllegalStateException}.
 * Outside production the same findings are only logged.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {
    }

    /**
     * @throws IllegalStateException if the configuration is not acceptable
     */
    public static void validate(GatewayConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        checkBasics(config);

        log.info("Production mode: {}", config.productionMode());
        if (config.productionMode()) {
            validateProductionMode(config);
        } else {
            warnNonProductionMode(config);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void checkBasics(GatewayConfig config) {
        if (config.port() <= 0 || config.port() > 65_535) {
            throw new IllegalStateException("❌ INVALID CONFIG: PORT out of range: " + config.port());
        }
        if (config.wsPath() == null || !config.wsPath().startsWith("/")) {
            throw new IllegalStateException("❌ INVALID CONFIG: WS_PATH must start with '/': " + config.wsPath());
        }
        if (config.jwtSecret() == null || config.jwtSecret().isBlank()) {
            throw new IllegalStateException("❌ INVALID CONFIG: JWT_SECRET is empty");
        }
        if (config.heartbeatInterval().isNegative() || config.heartbeatInterval().isZero()) {
            throw new IllegalStateException("❌ INVALID CONFIG: HEARTBEAT_INTERVAL_MS must be positive");
        }
        if (config.authTimeout().isNegative() || config.authTimeout().isZero()) {
            throw new IllegalStateException("❌ INVALID CONFIG: AUTH_TIMEOUT_MS must be positive");
        }
        if (config.authWorkers() < 1) {
            throw new IllegalStateException("❌ INVALID CONFIG: AUTH_WORKERS must be at least 1");
        }
        if (!config.usesRedis() && !GatewayConfig.BACKPLANE_MEMORY.equals(config.backplane())) {
            throw new IllegalStateException("❌ INVALID CONFIG: unknown BACKPLANE '" + config.backplane()
                + "' (expected redis or memory)");
        }
    }

    private static void validateProductionMode(GatewayConfig config) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");

        if (GatewayConfig.DEFAULT_JWT_SECRET.equals(config.jwtSecret())) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE requires a non-default JWT_SECRET\n" +
                "System refuses to start."
            );
        }
        log.info("✓ JWT secret configured");

        if (config.allowsAnyOrigin()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE forbids ALLOWED_ORIGINS=*\n" +
                "List the dashboard origins explicitly."
            );
        }
        log.info("✓ Allowed origins: {}", config.allowedOrigins());

        if (!config.usesRedis()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE requires BACKPLANE=redis\n" +
                "An in-memory backplane does not reach other instances."
            );
        }
        log.info("✓ Redis backplane: {}:{} channel={}", config.redisHost(), config.redisPort(),
            config.backplaneChannel());
    }

    private static void warnNonProductionMode(GatewayConfig config) {
        if (GatewayConfig.DEFAULT_JWT_SECRET.equals(config.jwtSecret())) {
            log.warn("⚠️  Using the default JWT_SECRET (set PRODUCTION_MODE=true to enforce)");
        }
        if (config.allowsAnyOrigin()) {
            log.warn("⚠️  Accepting WebSocket connections from any origin");
        }
        if (!config.usesRedis()) {
            log.warn("⚠️  In-memory backplane: events stay on this instance");
        }
    }
}
