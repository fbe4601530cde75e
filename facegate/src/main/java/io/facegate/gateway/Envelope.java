package io.facegate.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.facegate.domain.common.EventType;

/**
 * Wrapper around every domain event delivered to clients.
 * The payload is copied on construction and on every read, so it cannot be
 * modified once built.
 */
public record Envelope(
    EventType type,
    String timestamp,
    String messageId,
    JsonNode data
) {
    public Envelope {
        data = data == null ? NullNode.getInstance() : data.deepCopy();
    }

    @Override
    public JsonNode data() {
        return data.deepCopy();
    }
}
