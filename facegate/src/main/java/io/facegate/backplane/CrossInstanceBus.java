package io.facegate.backplane;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.facegate.domain.common.EventType;
import io.facegate.gateway.BroadcastTarget;
import io.facegate.gateway.Envelope;
import io.facegate.gateway.LocalDelivery;
import io.facegate.metrics.GatewayMetrics;
import io.facegate.metrics.GatewayMetrics.Direction;
import io.facegate.metrics.GatewayMetrics.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Relays envelopes between gateway instances over a {@link Backplane}.
 *
 * Outbound envelopes are tagged with this instance's id; inbound ones carrying
 * the same id are our own echo and are dropped. Inbound envelopes go to the
 * {@link LocalDelivery} path only and are never published again.
 * Delivery is at-most-once per instance and unordered across instances.
 */
public final class CrossInstanceBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CrossInstanceBus.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String TARGET_ALL = "ALL";
    static final String TARGET_USERS = "USERS";
    static final String TARGET_ROLE = "ROLE";
    static final String TARGET_EXCLUDING = "EXCLUDING";

    private final String instanceId;
    private final String channel;
    private final Backplane backplane;
    private final GatewayMetrics metrics;
    private final AtomicBoolean subscribed = new AtomicBoolean(false);
    private volatile boolean closed = false;

    public CrossInstanceBus(String instanceId, String channel, Backplane backplane, GatewayMetrics metrics) {
        this.instanceId = instanceId;
        this.channel = channel;
        this.backplane = backplane;
        this.metrics = metrics;
    }

    /**
     * Publish an envelope to sibling instances. Failures are logged, never thrown.
     */
    public void publish(Envelope envelope, BroadcastTarget target) {
        if (closed) {
            return;
        }
        if (!target.isDistributable()) {
            log.debug("[BUS] {} has a local-only target, not published", envelope.messageId());
            metrics.recordBackplane(Direction.OUTBOUND, Outcome.SKIPPED);
            return;
        }

        String json;
        try {
            json = encode(envelope, target);
        } catch (BackplaneException e) {
            log.error("[BUS] {}", e.getMessage(), e);
            metrics.recordBackplane(Direction.OUTBOUND, Outcome.FAILED);
            return;
        }

        backplane.publish(channel, json).whenComplete((ok, error) -> {
            if (error != null) {
                log.warn("[BUS] Publish of {} to {} failed: {}", envelope.messageId(), channel, error.toString());
                metrics.recordBackplane(Direction.OUTBOUND, Outcome.FAILED);
            } else {
                metrics.recordBackplane(Direction.OUTBOUND, Outcome.OK);
            }
        });
    }

    /**
     * Attach the single inbound handler for this process.
     *
     * @throws IllegalStateException if already subscribed
     */
    public void subscribe(LocalDelivery localDelivery) {
        if (!subscribed.compareAndSet(false, true)) {
            throw new IllegalStateException("CrossInstanceBus already subscribed to " + channel);
        }
        backplane.subscribe(channel, raw -> onInbound(raw, localDelivery));
        log.info("[BUS] Instance {} listening on {}", instanceId, channel);
    }

    /**
     * Handle one raw inbound message. Never throws.
     */
    void onInbound(String raw, LocalDelivery localDelivery) {
        if (closed) {
            return;
        }
        try {
            BackplaneMessage message = decode(raw);
            if (instanceId.equals(message.origin())) {
                return;
            }
            Envelope envelope = new Envelope(
                EventType.valueOf(message.type()), message.timestamp(), message.messageId(), message.data());
            int delivered = localDelivery.deliver(envelope, toTarget(message.target()));
            metrics.recordBackplane(Direction.INBOUND, Outcome.OK);
            log.debug("[BUS] {} from {} delivered to {} local connections",
                envelope.messageId(), message.origin(), delivered);
        } catch (MalformedMessageException e) {
            log.warn("[BUS] Dropped malformed message: {}", e.getMessage());
            metrics.recordBackplane(Direction.INBOUND, Outcome.MALFORMED);
        } catch (RuntimeException e) {
            log.error("[BUS] Failed to deliver inbound message", e);
            metrics.recordBackplane(Direction.INBOUND, Outcome.FAILED);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            backplane.close();
        } catch (RuntimeException e) {
            log.warn("[BUS] Error closing backplane: {}", e.toString());
        }
    }

    String encode(Envelope envelope, BroadcastTarget target) {
        BackplaneMessage message = new BackplaneMessage(
            instanceId,
            envelope.type().name(),
            envelope.timestamp(),
            envelope.messageId(),
            envelope.data(),
            describe(target));
        try {
            return MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new BackplaneException("Failed to serialize " + envelope.messageId(), e);
        }
    }

    static BackplaneMessage decode(String raw) {
        BackplaneMessage message;
        try {
            message = MAPPER.readValue(raw, BackplaneMessage.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException("Undeserializable payload: " + e.getMessage(), e);
        }
        if (message == null || message.origin() == null || message.messageId() == null) {
            throw new MalformedMessageException("Missing origin or messageId");
        }
        if (message.type() == null || EventType.fromName(message.type()).isEmpty()) {
            throw new MalformedMessageException("Unknown event type: " + message.type());
        }
        return message;
    }

    static BackplaneMessage.Target describe(BroadcastTarget target) {
        if (target instanceof BroadcastTarget.ByUser byUser) {
            return new BackplaneMessage.Target(TARGET_USERS, List.copyOf(byUser.userIds()), null);
        }
        if (target instanceof BroadcastTarget.ByRole byRole) {
            return new BackplaneMessage.Target(TARGET_ROLE, null, byRole.role());
        }
        if (target instanceof BroadcastTarget.ExcludingUsers excluding) {
            return new BackplaneMessage.Target(TARGET_EXCLUDING, List.copyOf(excluding.userIds()), null);
        }
        return new BackplaneMessage.Target(TARGET_ALL, null, null);
    }

    static BroadcastTarget toTarget(BackplaneMessage.Target target) {
        if (target == null || target.kind() == null) {
            return BroadcastTarget.all();
        }
        switch (target.kind()) {
            case TARGET_ALL:
                return BroadcastTarget.all();
            case TARGET_USERS:
                return BroadcastTarget.users(new HashSet<>(requireUsers(target)));
            case TARGET_ROLE:
                if (target.role() == null) {
                    throw new MalformedMessageException("ROLE target without role");
                }
                return BroadcastTarget.role(target.role());
            case TARGET_EXCLUDING:
                return BroadcastTarget.excluding(new HashSet<>(requireUsers(target)));
            default:
                throw new MalformedMessageException("Unknown target kind: " + target.kind());
        }
    }

    private static List<String> requireUsers(BackplaneMessage.Target target) {
        if (target.userIds() == null) {
            throw new MalformedMessageException(target.kind() + " target without userIds");
        }
        return target.userIds();
    }
}
