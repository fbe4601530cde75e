package io.facegate.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport that records every frame written to it.
 */
public class RecordingTransport implements ClientTransport {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private final AtomicInteger closeCalls = new AtomicInteger(0);
    private volatile boolean open = true;
    private volatile boolean failSends = false;

    public RecordingTransport(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String frame) {
        if (failSends) {
            throw new DeliveryException(id, "simulated write failure");
        }
        frames.add(frame);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        closeCalls.incrementAndGet();
    }

    @Override
    public SocketAddress remoteAddress() {
        return new InetSocketAddress("127.0.0.1", 50000);
    }

    public void failSends() {
        this.failSends = true;
    }

    /**
     * Mark closed without going through {@link #close()}, as a peer disconnect would.
     */
    public void drop() {
        this.open = false;
    }

    public int closeCalls() {
        return closeCalls.get();
    }

    public List<String> frames() {
        return frames;
    }

    public List<JsonNode> parsed() {
        return frames.stream().map(RecordingTransport::parse).toList();
    }

    /**
     * Frames whose "event" field equals {@code event}.
     */
    public List<JsonNode> framesOf(String event) {
        return parsed().stream().filter(f -> event.equals(f.path("event").asText())).toList();
    }

    /**
     * "message" frames carrying the given event type.
     */
    public List<JsonNode> messagesOf(String type) {
        return framesOf(ServerFrames.MESSAGE).stream()
            .filter(f -> type.equals(f.path("data").path("type").asText()))
            .toList();
    }

    public JsonNode last() {
        return parse(frames.get(frames.size() - 1));
    }

    public void clear() {
        frames.clear();
    }

    private static JsonNode parse(String frame) {
        try {
            return MAPPER.readTree(frame);
        } catch (Exception e) {
            throw new AssertionError("Frame is not JSON: " + frame, e);
        }
    }
}
