package io.facegate.backplane;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBackplaneTest {

    @Test
    void testEverySubscriberOfTheChannelReceives() {
        InMemoryBackplane backplane = new InMemoryBackplane();
        List<String> a = new ArrayList<>();
        List<String> b = new ArrayList<>();
        List<String> other = new ArrayList<>();
        backplane.subscribe("ch", a::add);
        backplane.subscribe("ch", b::add);
        backplane.subscribe("other", other::add);

        backplane.publish("ch", "hello").join();

        assertEquals(List.of("hello"), a);
        assertEquals(List.of("hello"), b);
        assertTrue(other.isEmpty());
    }

    @Test
    void testFailingSubscriberIsIsolated() {
        InMemoryBackplane backplane = new InMemoryBackplane();
        List<String> received = new ArrayList<>();
        backplane.subscribe("ch", m -> {
            throw new IllegalStateException("boom");
        });
        backplane.subscribe("ch", received::add);

        backplane.publish("ch", "x").join();

        assertEquals(List.of("x"), received);
    }

    @Test
    void testUnsubscribedHandlerStopsReceiving() {
        InMemoryBackplane backplane = new InMemoryBackplane();
        List<String> received = new ArrayList<>();
        Consumer<String> handler = received::add;
        backplane.subscribe("ch", handler);

        backplane.unsubscribe("ch", handler);
        backplane.publish("ch", "x").join();

        assertTrue(received.isEmpty());
    }

    @Test
    void testPublishAfterCloseFails() {
        InMemoryBackplane backplane = new InMemoryBackplane();
        backplane.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> backplane.publish("ch", "x").get());
        assertInstanceOf(BackplaneException.class, e.getCause());
    }

    @Test
    void testClosingHandleDetachesOnlyItsOwnSubscribers() {
        InMemoryBackplane backplane = new InMemoryBackplane();
        Backplane first = backplane.connect();
        Backplane second = backplane.connect();
        List<String> toFirst = new ArrayList<>();
        List<String> toSecond = new ArrayList<>();
        first.subscribe("ch", toFirst::add);
        second.subscribe("ch", toSecond::add);

        first.close();
        second.publish("ch", "still here").join();

        assertTrue(toFirst.isEmpty());
        assertEquals(List.of("still here"), toSecond);
        assertThrows(ExecutionException.class, () -> first.publish("ch", "x").get());
    }
}
