package io.facegate.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.facegate.domain.common.EventType;

import java.time.Instant;
import java.util.Collection;

/**
 * Server-to-client frames: {@code {"event": <name>, "data": {...}}}.
 */
public final class ServerFrames {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String AUTHENTICATED = "authenticated";
    public static final String SUBSCRIBED = "subscribed";
    public static final String UNSUBSCRIBED = "unsubscribed";
    public static final String HEARTBEAT = "heartbeat";
    public static final String PONG = "pong";
    public static final String MESSAGE = "message";
    public static final String CONNECTION_STATUS = "connection_status";
    public static final String ERROR = "error";

    /**
     * Status values of a connection_status frame.
     */
    public enum ConnectionStatus {
        CONNECTED,
        DISCONNECTED,
        RECONNECTING,
        AUTHENTICATED,
        ERROR
    }

    public static String message(Envelope envelope) {
        ObjectNode data = MAPPER.createObjectNode();
        data.put("type", envelope.type().name());
        data.put("timestamp", envelope.timestamp());
        data.set("data", envelope.data());
        data.put("messageId", envelope.messageId());
        return frame(MESSAGE, data);
    }

    public static String authenticated(String userId) {
        ObjectNode data = MAPPER.createObjectNode();
        data.put("success", true);
        data.put("userId", userId);
        return frame(AUTHENTICATED, data);
    }

    public static String authenticationFailed(String error) {
        ObjectNode data = MAPPER.createObjectNode();
        data.put("success", false);
        data.put("error", error);
        return frame(AUTHENTICATED, data);
    }

    public static String subscribed(Collection<EventType> events) {
        return eventsFrame(SUBSCRIBED, events);
    }

    public static String unsubscribed(Collection<EventType> events) {
        return eventsFrame(UNSUBSCRIBED, events);
    }

    public static String heartbeat(String clientId, Instant now, double uptimeSeconds, int connectedClients) {
        ObjectNode data = MAPPER.createObjectNode();
        data.put("timestamp", now.toString());
        data.put("clientId", clientId);
        data.put("serverTime", now.toString());
        data.put("uptime", uptimeSeconds);
        data.put("connectedClients", connectedClients);
        return frame(HEARTBEAT, data);
    }

    public static String pong(Instant now) {
        ObjectNode data = MAPPER.createObjectNode();
        data.put("timestamp", now.toString());
        return frame(PONG, data);
    }

    public static String connectionStatus(ConnectionStatus status, String clientId, Instant now) {
        ObjectNode data = MAPPER.createObjectNode();
        data.put("status", status.name());
        data.put("clientId", clientId);
        data.put("timestamp", now.toString());
        return frame(CONNECTION_STATUS, data);
    }

    public static String error(String message) {
        ObjectNode data = MAPPER.createObjectNode();
        data.put("message", message);
        return frame(ERROR, data);
    }

    private static String eventsFrame(String event, Collection<EventType> events) {
        ObjectNode data = MAPPER.createObjectNode();
        data.set("events", MAPPER.valueToTree(events.stream().map(Enum::name).toList()));
        return frame(event, data);
    }

    private static String frame(String event, JsonNode data) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("event", event);
        root.set("data", data);
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + event + " frame", e);
        }
    }

    private ServerFrames() {}
}
