package io.facegate.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.facegate.domain.common.EventType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void testPayloadCannotBeChangedThroughAccessor() {
        ObjectNode payload = MAPPER.createObjectNode().put("a", 1);
        Envelope envelope = new Envelope(EventType.ALERT, "t", "msg_1", payload);

        ((ObjectNode) envelope.data()).put("a", 2);

        assertEquals(1, envelope.data().path("a").asInt());
    }

    @Test
    void testPayloadIsDetachedFromCallerNode() {
        ObjectNode payload = MAPPER.createObjectNode().put("a", 1);
        Envelope envelope = new Envelope(EventType.ALERT, "t", "msg_1", payload);

        payload.put("a", 3);

        assertEquals(1, envelope.data().path("a").asInt());
    }

    @Test
    void testMissingPayloadIsJsonNull() {
        Envelope envelope = new Envelope(EventType.HEARTBEAT, "t", "msg_1", null);

        assertTrue(envelope.data().isNull());
    }
}
