package io.facegate.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.facegate.backplane.InMemoryBackplane;
import io.facegate.config.GatewayConfig;
import io.facegate.metrics.PrometheusGatewayMetrics;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives a real Undertow server over HTTP and WebSocket.
 */
class AppEndToEndTest {

    private static final int TEST_PORT = 19192;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private App app;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        GatewayConfig config = new GatewayConfig("gw-e2e", TEST_PORT, "/ws", "e2e-secret", 3_600_000L,
            Duration.ofSeconds(30), Duration.ofSeconds(5), Duration.ofSeconds(5), 2,
            List.of("https://dash.example.com"), GatewayConfig.BACKPLANE_MEMORY,
            "localhost", 6379, null, 0, GatewayConfig.DEFAULT_CHANNEL, true, false);
        app = App.start(config, new InMemoryBackplane(), new PrometheusGatewayMetrics(new CollectorRegistry()));
        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.stop();
        }
    }

    @Test
    void testSubscribedClientReceivesEmittedEvent() throws Exception {
        String token = app.jwtService().generateToken("u-e2e", "e2e@example.com", "ADMIN");
        FrameCollector client = new FrameCollector();
        WebSocket ws = httpClient.newWebSocketBuilder()
            .buildAsync(URI.create("ws://localhost:" + TEST_PORT + "/ws?token=" + token), client)
            .get(5, TimeUnit.SECONDS);

        JsonNode auth = client.await("authenticated");
        assertTrue(auth.path("data").path("success").asBoolean());
        assertEquals("u-e2e", auth.path("data").path("userId").asText());

        ws.sendText("{\"action\":\"subscribe\",\"events\":[\"ALERT\"]}", true).get(5, TimeUnit.SECONDS);
        assertEquals("ALERT", client.await("subscribed").path("data").path("events").get(0).asText());

        app.events().emitSecurityAlert("Badge reuse detected", null);

        JsonNode message = client.await("message");
        assertEquals("ALERT", message.path("data").path("type").asText());
        assertEquals("Badge reuse detected", message.path("data").path("data").path("message").asText());

        HttpResponse<String> connections = get("/api/gateway/connections", null);
        assertEquals(1, MAPPER.readTree(connections.body()).path("count").asInt());

        ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);
    }

    @Test
    void testInvalidTokenIsRejected() throws Exception {
        FrameCollector client = new FrameCollector();
        httpClient.newWebSocketBuilder()
            .header("Authorization", "Bearer not-a-token")
            .buildAsync(URI.create("ws://localhost:" + TEST_PORT + "/ws"), client)
            .get(5, TimeUnit.SECONDS);

        JsonNode reply = client.await("authenticated");
        assertFalse(reply.path("data").path("success").asBoolean());
        assertEquals(0, app.registry().size());
    }

    @Test
    void testHealthEndpoint() throws Exception {
        HttpResponse<String> response = get("/health", null);

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("ok", body.path("status").asText());
        assertEquals("gw-e2e", body.path("instanceId").asText());
        assertEquals("memory", body.path("backplane").asText());
    }

    @Test
    void testDisallowedOriginIsForbidden() throws Exception {
        HttpResponse<String> response = get("/ws", "https://evil.example.com");

        assertEquals(403, response.statusCode());
    }

    private HttpResponse<String> get(String path, String origin) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET();
        if (origin != null) {
            request.header("Origin", origin);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static final class FrameCollector implements WebSocket.Listener {
        private final BlockingQueue<JsonNode> frames = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                try {
                    frames.add(MAPPER.readTree(partial.toString()));
                } catch (Exception e) {
                    throw new IllegalStateException("Server sent non-JSON frame: " + partial, e);
                } finally {
                    partial.setLength(0);
                }
            }
            webSocket.request(1);
            return null;
        }

        /**
         * Next frame with the given event name, skipping others.
         */
        JsonNode await(String event) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (System.nanoTime() < deadline) {
                JsonNode frame = frames.poll(100, TimeUnit.MILLISECONDS);
                if (frame != null && event.equals(frame.path("event").asText())) {
                    return frame;
                }
            }
            throw new AssertionError("No '" + event + "' frame within 5s");
        }
    }
}
