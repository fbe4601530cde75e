package io.facegate.bootstrap;

import io.facegate.config.GatewayConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StartupConfigValidatorTest {

    private static GatewayConfig config(List<String> origins, String backplane, String secret,
                                        boolean production, int port) {
        return new GatewayConfig("gw-test", port, "/ws", secret, 3_600_000L,
            Duration.ofSeconds(30), Duration.ofSeconds(10), Duration.ofSeconds(5), 2,
            origins, backplane, "localhost", 6379, null, 0, GatewayConfig.DEFAULT_CHANNEL, true, production);
    }

    @Test
    void testDevelopmentDefaultsPassWithWarnings() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(
            config(List.of("*"), "memory", GatewayConfig.DEFAULT_JWT_SECRET, false, 9090)));
    }

    @Test
    void testProductionRejectsDefaultSecret() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(
            config(List.of("https://dash.example.com"), "redis", GatewayConfig.DEFAULT_JWT_SECRET, true, 9090)));
        assertTrue(e.getMessage().contains("JWT_SECRET"));
    }

    @Test
    void testProductionRejectsWildcardOrigins() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(
            config(List.of("*"), "redis", "prod-secret", true, 9090)));
        assertTrue(e.getMessage().contains("ALLOWED_ORIGINS"));
    }

    @Test
    void testProductionRequiresRedis() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(
            config(List.of("https://dash.example.com"), "memory", "prod-secret", true, 9090)));
        assertTrue(e.getMessage().contains("BACKPLANE=redis"));
    }

    @Test
    void testProductionConfigPasses() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(
            config(List.of("https://dash.example.com"), "redis", "prod-secret", true, 9090)));
    }

    @Test
    void testUnknownBackplaneAndBadPortRejected() {
        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(
            config(List.of("*"), "kafka", "s", false, 9090)));
        assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(
            config(List.of("*"), "memory", "s", false, 70_000)));
    }
}
