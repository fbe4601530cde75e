package io.facegate.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.facegate.auth.AuthenticationException;
import io.facegate.auth.AuthenticationGate;
import io.facegate.auth.Identity;
import io.facegate.domain.common.EventType;
import io.facegate.heartbeat.HeartbeatScheduler;
import io.facegate.metrics.GatewayMetrics;
import io.facegate.service.core.EventSourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-connection protocol state machine: Connecting, Authenticated, Closed.
 *
 * A transport is Connecting while it sits in {@code pending}, Authenticated
 * once it is in the registry. Token verification runs on the auth executor,
 * never on the I/O thread that delivered the handshake or message.
 */
public final class ClientProtocolHandler {
    private static final Logger log = LoggerFactory.getLogger(ClientProtocolHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AuthenticationGate authGate;
    private final ConnectionRegistry registry;
    private final SubscriptionManager subscriptions;
    private final HeartbeatScheduler heartbeat;
    private final EventSourceAdapter events;
    private final GatewayMetrics metrics;
    private final Executor authExecutor;
    private final ScheduledExecutorService timeouts;
    private final Duration authTimeout;
    private final boolean presenceBroadcast;
    private final Clock clock;

    private final ConcurrentMap<String, Pending> pending = new ConcurrentHashMap<>();

    public ClientProtocolHandler(AuthenticationGate authGate,
                                 ConnectionRegistry registry,
                                 SubscriptionManager subscriptions,
                                 HeartbeatScheduler heartbeat,
                                 EventSourceAdapter events,
                                 GatewayMetrics metrics,
                                 Executor authExecutor,
                                 ScheduledExecutorService timeouts,
                                 Duration authTimeout,
                                 boolean presenceBroadcast,
                                 Clock clock) {
        this.authGate = authGate;
        this.registry = registry;
        this.subscriptions = subscriptions;
        this.heartbeat = heartbeat;
        this.events = events;
        this.metrics = metrics;
        this.authExecutor = authExecutor;
        this.timeouts = timeouts;
        this.authTimeout = authTimeout;
        this.presenceBroadcast = presenceBroadcast;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * New transport. With a handshake token authentication starts at once,
     * otherwise the client has {@code authTimeout} to send an authenticate message.
     */
    public void onOpen(ClientTransport transport, String bearer) {
        String id = transport.id();
        Pending p = new Pending(transport);
        pending.put(id, p);
        p.timeout = timeouts.schedule(() -> onAuthTimeout(id, p), authTimeout.toMillis(), TimeUnit.MILLISECONDS);

        log.debug("Transport opened: {} from {}", id, transport.remoteAddress());

        if (bearer != null && !bearer.isBlank()) {
            beginAuthentication(transport, bearer);
        }
    }

    public void onMessage(ClientTransport transport, String raw) {
        String id = transport.id();

        ClientMessage msg;
        try {
            msg = MAPPER.readValue(raw, ClientMessage.class);
        } catch (JsonProcessingException e) {
            sendDirect(transport, ServerFrames.error("Invalid JSON: " + e.getOriginalMessage()));
            return;
        }
        if (msg == null || msg.action == null) {
            sendDirect(transport, ServerFrames.error("Missing 'action'"));
            return;
        }

        boolean authenticated = registry.touch(id).isPresent();

        switch (msg.action) {
            case ClientMessage.AUTHENTICATE -> {
                if (authenticated) {
                    registry.get(id).ifPresent(c -> sendDirect(transport, ServerFrames.authenticated(c.getUserId())));
                } else {
                    beginAuthentication(transport, msg.token);
                }
            }
            case ClientMessage.PING -> sendDirect(transport, ServerFrames.pong(clock.instant()));
            case ClientMessage.SUBSCRIBE, ClientMessage.UNSUBSCRIBE, ClientMessage.HEARTBEAT -> {
                if (!authenticated) {
                    sendDirect(transport, ServerFrames.error("Not authenticated"));
                    return;
                }
                handleAuthenticated(transport, msg);
            }
            default -> sendDirect(transport, ServerFrames.error("Unknown action: " + msg.action));
        }
    }

    /**
     * Transport closed by either side. Safe to call more than once.
     */
    public void onClose(ClientTransport transport) {
        String id = transport.id();
        Pending p = pending.remove(id);
        if (p != null) {
            p.cancelTimeout();
        }

        Optional<Connection> removed = registry.remove(id, transport);
        if (removed.isEmpty()) {
            return;
        }

        Connection c = removed.get();
        metrics.recordConnectionCount(registry.size());
        log.info("Client disconnected: {} (user={})", id, c.getUserId());
        emitPresence(new Identity(c.getUserId(), c.getEmail(), c.getRole()), false);
    }

    public int pendingCount() {
        return pending.size();
    }

    // ═══════════════════════════════════════════════════════════════
    // AUTHENTICATION
    // ═══════════════════════════════════════════════════════════════

    private void beginAuthentication(ClientTransport transport, String token) {
        String id = transport.id();
        Pending p = pending.get(id);
        if (p == null) {
            log.debug("Authentication ignored for closed transport {}", id);
            return;
        }
        if (!p.authStarted.compareAndSet(false, true)) {
            sendDirect(transport, ServerFrames.error("Authentication already in progress"));
            return;
        }

        try {
            authExecutor.execute(() -> completeAuthentication(transport, p, token));
        } catch (RejectedExecutionException e) {
            log.warn("Auth executor rejected {}: {}", id, e.getMessage());
            failAuthentication(transport, "Server busy");
        }
    }

    private void completeAuthentication(ClientTransport transport, Pending p, String token) {
        String id = transport.id();

        Identity identity;
        try {
            identity = authGate.authenticate(token);
        } catch (AuthenticationException e) {
            log.warn("Authentication failed for {} from {}: {}", id, transport.remoteAddress(), e.getMessage());
            failAuthentication(transport, e.getMessage());
            return;
        }

        if (!pending.remove(id, p)) {
            // Closed or timed out while the token was being verified
            log.debug("Authentication result discarded for {}", id);
            return;
        }
        p.cancelTimeout();

        Optional<Connection> added = registry.add(id, identity, transport);
        if (added.isEmpty()) {
            log.debug("Transport {} closed before registration", id);
            return;
        }

        metrics.recordAuthentication(true);
        metrics.recordConnectionCount(registry.size());
        log.info("Client connected: {} (user={}, email={})", id, identity.subject(), identity.email());

        sendDirect(transport, ServerFrames.connectionStatus(
            ServerFrames.ConnectionStatus.AUTHENTICATED, id, clock.instant()));
        sendDirect(transport, ServerFrames.authenticated(identity.subject()));
        emitPresence(identity, true);
    }

    private void failAuthentication(ClientTransport transport, String error) {
        Pending p = pending.remove(transport.id());
        if (p == null) {
            // Timed out or closed first; that path already replied and counted
            log.debug("Authentication failure discarded for {}", transport.id());
            return;
        }
        p.cancelTimeout();
        metrics.recordAuthentication(false);
        sendDirect(transport, ServerFrames.authenticationFailed(error));
        transport.close();
    }

    private void onAuthTimeout(String id, Pending p) {
        if (!pending.remove(id, p)) {
            return;
        }
        log.warn("Authentication timeout for {} after {}ms", id, authTimeout.toMillis());
        sendDirect(p.transport, ServerFrames.authenticationFailed("Authentication timeout"));
        p.transport.close();
        metrics.recordAuthentication(false);
    }

    // ═══════════════════════════════════════════════════════════════
    // AUTHENTICATED ACTIONS
    // ═══════════════════════════════════════════════════════════════

    private void handleAuthenticated(ClientTransport transport, ClientMessage msg) {
        String id = transport.id();
        try {
            switch (msg.action) {
                case ClientMessage.SUBSCRIBE -> subscriptions.setSubscriptions(id, msg.events)
                    .ifPresent(types -> sendDirect(transport, ServerFrames.subscribed(types)));
                case ClientMessage.UNSUBSCRIBE -> {
                    Set<EventType> requested = SubscriptionManager.parse(msg.events);
                    subscriptions.removeSubscriptionTypes(id, requested)
                        .ifPresent(remaining -> sendDirect(transport, ServerFrames.unsubscribed(requested)));
                }
                case ClientMessage.HEARTBEAT -> heartbeat.reply(id);
                default -> sendDirect(transport, ServerFrames.error("Unknown action: " + msg.action));
            }
        } catch (ValidationException e) {
            log.debug("Rejected {} from {}: {}", msg.action, id, e.getMessage());
            sendDirect(transport, ServerFrames.error(e.getMessage()));
        }
    }

    private void emitPresence(Identity identity, boolean connected) {
        if (!presenceBroadcast) {
            return;
        }
        try {
            events.emitUserPresence(identity, connected);
        } catch (RuntimeException e) {
            log.warn("Presence broadcast failed for {}: {}", identity.subject(), e.getMessage());
        }
    }

    private void sendDirect(ClientTransport transport, String frame) {
        if (!transport.isOpen()) {
            return;
        }
        try {
            transport.send(frame);
        } catch (DeliveryException e) {
            log.warn("Reply to {} failed: {}", transport.id(), e.getMessage());
            metrics.recordDeliveryFailure();
        }
    }

    private static final class Pending {
        final ClientTransport transport;
        final AtomicBoolean authStarted = new AtomicBoolean(false);
        volatile ScheduledFuture<?> timeout;

        Pending(ClientTransport transport) {
            this.transport = transport;
        }

        void cancelTimeout() {
            ScheduledFuture<?> t = timeout;
            if (t != null) {
                t.cancel(false);
            }
        }
    }
}
