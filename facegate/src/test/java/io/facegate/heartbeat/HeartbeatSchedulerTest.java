package io.facegate.heartbeat;

import com.fasterxml.jackson.databind.JsonNode;
import io.facegate.auth.Identity;
import io.facegate.backplane.CrossInstanceBus;
import io.facegate.backplane.InMemoryBackplane;
import io.facegate.gateway.Broadcaster;
import io.facegate.gateway.ConnectionRegistry;
import io.facegate.gateway.MutableClock;
import io.facegate.gateway.RecordingTransport;
import io.facegate.gateway.SubscriptionManager;
import io.facegate.metrics.GatewayMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HeartbeatSchedulerTest {

    @Mock
    private GatewayMetrics metrics;

    private MutableClock clock;
    private ConnectionRegistry registry;
    private SubscriptionManager subscriptions;
    private HeartbeatScheduler heartbeat;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        registry = new ConnectionRegistry(clock);
        subscriptions = new SubscriptionManager(registry);
        Broadcaster broadcaster = new Broadcaster("gw-1", registry, subscriptions,
            new CrossInstanceBus("gw-1", "ch", new InMemoryBackplane(), metrics), metrics, clock);
        heartbeat = new HeartbeatScheduler(registry, broadcaster, metrics, Duration.ofMillis(100), clock, () -> 90_500L);
    }

    @AfterEach
    void tearDown() {
        heartbeat.stop();
    }

    @Test
    void testTickReachesEveryConnectionRegardlessOfSubscriptions() {
        RecordingTransport a = connect("c1", "u1");
        RecordingTransport b = connect("c2", "u2");
        subscriptions.setSubscriptions("c2", List.of("ALERT"));

        int reached = heartbeat.tick();

        assertEquals(2, reached);
        JsonNode frame = b.last();
        assertEquals("heartbeat", frame.path("event").asText());
        JsonNode data = frame.path("data");
        assertEquals("server", data.path("clientId").asText());
        assertEquals("2024-05-01T12:00:00Z", data.path("serverTime").asText());
        assertEquals(90.5, data.path("uptime").asDouble(), 0.0001);
        assertEquals(2, data.path("connectedClients").asInt());
        assertEquals(1, a.framesOf("heartbeat").size());
        verify(metrics).recordHeartbeat(2);
    }

    @Test
    void testTickWithNoConnectionsSendsNothing() {
        assertEquals(0, heartbeat.tick());
        verify(metrics).recordHeartbeat(0);
    }

    @Test
    void testReplyTouchesAndAnswersOnlyTheCaller() {
        RecordingTransport caller = connect("c1", "u1");
        RecordingTransport bystander = connect("c2", "u2");
        clock.advance(Duration.ofSeconds(10));

        assertTrue(heartbeat.reply("c1"));

        JsonNode data = caller.last().path("data");
        assertEquals("c1", data.path("clientId").asText());
        assertTrue(bystander.frames().isEmpty());
        assertEquals(clock.instant(), registry.get("c1").orElseThrow().getLastActivityAt());
    }

    @Test
    void testReplyToUnknownConnection() {
        assertFalse(heartbeat.reply("missing"));
    }

    @Test
    void testStartSchedulesPeriodicTicks() {
        RecordingTransport t = connect("c1", "u1");

        heartbeat.start();
        assertTrue(heartbeat.isRunning());

        verify(metrics, timeout(2000).atLeast(2)).recordHeartbeat(1);
        assertTrue(t.framesOf("heartbeat").size() >= 2);

        heartbeat.stop();
        assertFalse(heartbeat.isRunning());
    }

    private RecordingTransport connect(String id, String userId) {
        RecordingTransport t = new RecordingTransport(id);
        registry.add(id, new Identity(userId, userId + "@example.com", "USER"), t);
        return t;
    }
}
