package io.facegate.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.facegate.gateway.ConnectionRegistry;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.lang.management.ManagementFactory;
import java.time.Instant;

/**
 * GET /health
 */
public final class HealthHandler implements HttpHandler {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String instanceId;
    private final String backplane;
    private final ConnectionRegistry registry;

    public HealthHandler(String instanceId, String backplane, ConnectionRegistry registry) {
        this.instanceId = instanceId;
        this.backplane = backplane;
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());
        health.put("instanceId", instanceId);
        health.put("backplane", backplane);
        health.put("connections", registry.size());
        health.put("users", registry.userCount());
        health.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(MAPPER.writeValueAsString(health));
    }
}
