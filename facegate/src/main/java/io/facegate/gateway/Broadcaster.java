package io.facegate.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.facegate.backplane.CrossInstanceBus;
import io.facegate.domain.common.EventType;
import io.facegate.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans envelopes out to matching local connections, then forwards them to
 * sibling instances through the cross-instance bus.
 *
 * Delivery runs on the caller's thread and each transport queues frames in
 * call order, so two broadcasts issued in sequence reach a connection in that
 * order. Nothing is ordered across instances.
 */
public final class Broadcaster implements LocalDelivery {
    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String instanceId;
    private final ConnectionRegistry registry;
    private final SubscriptionManager subscriptions;
    private final CrossInstanceBus bus;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final AtomicLong messageSeq = new AtomicLong(0);

    public Broadcaster(String instanceId, ConnectionRegistry registry, SubscriptionManager subscriptions,
                       CrossInstanceBus bus, GatewayMetrics metrics) {
        this(instanceId, registry, subscriptions, bus, metrics, Clock.systemUTC());
    }

    public Broadcaster(String instanceId, ConnectionRegistry registry, SubscriptionManager subscriptions,
                       CrossInstanceBus bus, GatewayMetrics metrics, Clock clock) {
        this.instanceId = instanceId;
        this.registry = registry;
        this.subscriptions = subscriptions;
        this.bus = bus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Broadcast to every connection subscribed to {@code type}.
     */
    public Envelope broadcast(EventType type, Object payload) {
        return broadcast(type, payload, BroadcastTarget.all());
    }

    /**
     * Deliver locally to the target connections that subscribe to {@code type},
     * then publish to the other instances.
     */
    public Envelope broadcast(EventType type, Object payload, BroadcastTarget target) {
        Envelope envelope = newEnvelope(type, payload);
        int delivered = deliverLocal(envelope, target);
        bus.publish(envelope, target);

        log.debug("Broadcast {} type={} target={} delivered={}",
            envelope.messageId(), type, target, delivered);
        return envelope;
    }

    @Override
    public int deliver(Envelope envelope, BroadcastTarget target) {
        return deliverLocal(envelope, target);
    }

    /**
     * Deliver to this process's connections only. Never publishes.
     */
    public int deliverLocal(Envelope envelope, BroadcastTarget target) {
        List<Connection> candidates = target.resolve(registry);
        String frame = null;
        int delivered = 0;

        for (Connection connection : candidates) {
            if (!subscriptions.matches(connection, envelope.type())) {
                continue;
            }
            if (frame == null) {
                frame = ServerFrames.message(envelope);
            }
            if (send(connection, frame)) {
                delivered++;
            }
        }

        metrics.recordDelivery(envelope.type(), delivered);
        return delivered;
    }

    /**
     * Write a frame to every registered connection, ignoring subscriptions.
     */
    public int sendToAll(String frame) {
        int delivered = 0;
        for (Connection connection : registry.listAll()) {
            if (send(connection, frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Write a frame to one registered connection, ignoring subscriptions.
     */
    public boolean sendTo(String connectionId, String frame) {
        return registry.get(connectionId)
            .map(c -> send(c, frame))
            .orElse(false);
    }

    public Envelope newEnvelope(EventType type, Object payload) {
        JsonNode data = payload instanceof JsonNode node ? node : MAPPER.valueToTree(payload);
        String messageId = "msg_" + instanceId + "_" + clock.millis() + "_" + messageSeq.incrementAndGet();
        return new Envelope(type, clock.instant().toString(), messageId, data);
    }

    private boolean send(Connection connection, String frame) {
        ClientTransport transport = connection.getTransport();
        if (!transport.isOpen()) {
            // Close callback removes it from the registry
            return false;
        }
        try {
            transport.send(frame);
            return true;
        } catch (DeliveryException e) {
            log.warn("Delivery to {} failed: {}", connection.getId(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Delivery to {} failed", connection.getId(), e);
        }
        metrics.recordDeliveryFailure();
        return false;
    }
}
