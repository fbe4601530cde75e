package io.facegate.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.facegate.gateway.Connection;
import io.facegate.gateway.ConnectionRegistry;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.List;

/**
 * GET /api/gateway/connections[?userId=...]
 *
 * Lists live connections of this instance. Transports are never exposed.
 */
public final class ConnectionsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(ConnectionsHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ConnectionRegistry registry;

    public ConnectionsHandler(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        Deque<String> userParam = exchange.getQueryParameters().get("userId");
        String userId = userParam == null ? null : userParam.peekFirst();

        List<Connection> connections = userId == null || userId.isBlank()
            ? registry.listAll()
            : registry.listByUser(userId);

        ObjectNode body = MAPPER.createObjectNode();
        body.put("count", connections.size());
        ArrayNode items = body.putArray("connections");
        for (Connection c : connections) {
            ObjectNode item = items.addObject();
            item.put("id", c.getId());
            item.put("userId", c.getUserId());
            item.put("email", c.getEmail());
            item.put("role", c.getRole());
            item.put("connectedAt", c.getConnectedAt().toString());
            item.put("lastActivityAt", c.getLastActivityAt().toString());
            ArrayNode subs = item.putArray("subscriptions");
            c.getSubscriptions().forEach(t -> subs.add(t.name()));
        }

        log.debug("Listed {} connections", connections.size());
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(MAPPER.writeValueAsString(body));
    }
}
