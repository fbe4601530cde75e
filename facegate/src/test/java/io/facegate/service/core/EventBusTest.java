package io.facegate.service.core;

import io.facegate.domain.common.EventType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    @Test
    void testHandlersRunInRegistrationOrder() {
        EventBus bus = new EventBus();
        List<String> calls = new ArrayList<>();
        bus.subscribe(EventType.ALERT, e -> calls.add("first"));
        bus.subscribe(EventType.ALERT, e -> calls.add("second"));

        assertEquals(2, bus.publish(DomainEvent.toAll(EventType.ALERT, "x")));
        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void testOnlyMatchingTopicIsDispatched() {
        EventBus bus = new EventBus();
        List<EventType> seen = new ArrayList<>();
        bus.subscribe(EventType.ALERT, e -> seen.add(e.type()));

        assertEquals(0, bus.publish(DomainEvent.toAll(EventType.DEVICE_STATUS, "x")));
        assertTrue(seen.isEmpty());
    }

    @Test
    void testFailingHandlerIsIsolated() {
        EventBus bus = new EventBus();
        List<Object> received = new ArrayList<>();
        bus.subscribe(EventType.ALERT, e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(EventType.ALERT, e -> received.add(e.payload()));

        assertEquals(1, bus.publish(DomainEvent.toAll(EventType.ALERT, "payload")));
        assertEquals(List.of("payload"), received);
    }

    @Test
    void testSubscribeAllCoversEveryType() {
        EventBus bus = new EventBus();
        bus.subscribeAll(e -> {});

        for (EventType type : EventType.values()) {
            assertEquals(1, bus.handlerCount(type));
        }
    }
}
