package io.facegate.bootstrap;

import io.facegate.auth.AuthenticationGate;
import io.facegate.auth.JwtService;
import io.facegate.backplane.Backplane;
import io.facegate.backplane.CrossInstanceBus;
import io.facegate.backplane.InMemoryBackplane;
import io.facegate.backplane.RedisBackplane;
import io.facegate.config.GatewayConfig;
import io.facegate.domain.event.UserSummary;
import io.facegate.gateway.Broadcaster;
import io.facegate.gateway.ClientProtocolHandler;
import io.facegate.gateway.Connection;
import io.facegate.gateway.ConnectionRegistry;
import io.facegate.gateway.SubscriptionManager;
import io.facegate.heartbeat.HeartbeatScheduler;
import io.facegate.metrics.PrometheusGatewayMetrics;
import io.facegate.metrics.PrometheusMetricsHandler;
import io.facegate.service.core.BroadcastBridge;
import io.facegate.service.core.EventBus;
import io.facegate.service.core.EventSourceAdapter;
import io.facegate.service.core.UserDirectory;
import io.facegate.transport.http.ConnectionsHandler;
import io.facegate.transport.http.HealthHandler;
import io.facegate.transport.ws.WsGateway;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gateway bootstrap: wires the components and starts Undertow.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);
    private static final int AUTH_QUEUE_CAPACITY = 1024;

    private final GatewayConfig config;
    private final PrometheusGatewayMetrics metrics;
    private final JwtService jwtService;
    private final ConnectionRegistry registry;
    private final CrossInstanceBus bus;
    private final Broadcaster broadcaster;
    private final HeartbeatScheduler heartbeat;
    private final EventSourceAdapter events;
    private final ThreadPoolExecutor authExecutor;
    private final ScheduledExecutorService authTimeouts;
    private final Undertow server;

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== FaceGate realtime gateway starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        GatewayConfig config = GatewayConfig.fromEnv();
        try {
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
        }

        App app = start(config);
        Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "gateway-shutdown"));
    }

    public static App start(GatewayConfig config) {
        return start(config, createBackplane(config), new PrometheusGatewayMetrics());
    }

    public static App start(GatewayConfig config, Backplane backplane, PrometheusGatewayMetrics metrics) {
        App app = new App(config, backplane, metrics);
        app.server.start();
        app.heartbeat.start();
        log.info("✓ Gateway {} listening on http://0.0.0.0:{}{} (backplane={})",
            config.instanceId(), config.port(), config.wsPath(), config.backplane());
        app.events.emitSystemStart();
        return app;
    }

    private App(GatewayConfig config, Backplane backplane, PrometheusGatewayMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Auth
        // ═══════════════════════════════════════════════════════════════
        jwtService = new JwtService(config.jwtSecret(), config.jwtExpirationMs());
        AuthenticationGate authGate = new AuthenticationGate(jwtService);
        authExecutor = new ThreadPoolExecutor(config.authWorkers(), config.authWorkers(),
            60, TimeUnit.SECONDS, new ArrayBlockingQueue<>(AUTH_QUEUE_CAPACITY), daemonThreads("gateway-auth"));
        authTimeouts = Executors.newSingleThreadScheduledExecutor(daemonThreads("gateway-auth-timeout"));
        log.info("✓ JWT authentication ready ({} workers)", config.authWorkers());

        // ═══════════════════════════════════════════════════════════════
        // Registry, backplane, broadcaster
        // ═══════════════════════════════════════════════════════════════
        registry = new ConnectionRegistry(clock);
        SubscriptionManager subscriptions = new SubscriptionManager(registry);
        bus = new CrossInstanceBus(config.instanceId(), config.backplaneChannel(), backplane, metrics);
        broadcaster = new Broadcaster(config.instanceId(), registry, subscriptions, bus, metrics, clock);
        bus.subscribe(broadcaster);
        log.info("✓ Cross-instance bus subscribed to '{}'", config.backplaneChannel());

        // ═══════════════════════════════════════════════════════════════
        // Event sources
        // ═══════════════════════════════════════════════════════════════
        EventBus eventBus = new EventBus();
        new BroadcastBridge(broadcaster).attach(eventBus);
        events = new EventSourceAdapter(eventBus, connectedUsers(registry), clock);

        heartbeat = new HeartbeatScheduler(registry, broadcaster, metrics, config.heartbeatInterval());

        // ═══════════════════════════════════════════════════════════════
        // HTTP + WebSocket
        // ═══════════════════════════════════════════════════════════════
        ClientProtocolHandler protocol = new ClientProtocolHandler(authGate, registry, subscriptions,
            heartbeat, events, metrics, authExecutor, authTimeouts, config.authTimeout(),
            config.presenceBroadcast(), clock);

        RoutingHandler routes = Handlers.routing()
            .get(config.wsPath(), new WsGateway(config, protocol, metrics))
            .get("/health", new HealthHandler(config.instanceId(), config.backplane(), registry))
            .get("/api/gateway/connections", new ConnectionsHandler(registry))
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "FaceGate gateway\n\n" +
                    "WS:   ws://<host>:" + config.port() + config.wsPath() + "?token=<jwt>\n" +
                    "HTTP: GET /health, /api/gateway/connections, /metrics\n"
                );
            });

        server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(routes)
            .build();
    }

    /**
     * Stop heartbeat and auth timers, close the backplane, stop Undertow.
     * Queued frames are not drained.
     */
    public void stop() {
        log.info("Gateway {} stopping...", config.instanceId());
        heartbeat.stop();
        authTimeouts.shutdownNow();
        authExecutor.shutdownNow();
        bus.close();
        server.stop();
        log.info("Gateway {} stopped", config.instanceId());
    }

    public EventSourceAdapter events() {
        return events;
    }

    public JwtService jwtService() {
        return jwtService;
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public Broadcaster broadcaster() {
        return broadcaster;
    }

    public PrometheusGatewayMetrics metrics() {
        return metrics;
    }

    static Backplane createBackplane(GatewayConfig config) {
        if (config.usesRedis()) {
            log.info("✓ Redis backplane {}:{} db={}", config.redisHost(), config.redisPort(), config.redisDb());
            return new RedisBackplane(config.redisHost(), config.redisPort(), config.redisPassword(), config.redisDb());
        }
        log.info("✓ In-memory backplane (single instance)");
        return new InMemoryBackplane();
    }

    /**
     * Without a user store, user updates resolve against identities of live connections.
     */
    static UserDirectory connectedUsers(ConnectionRegistry registry) {
        return userId -> registry.listByUser(userId).stream()
            .findFirst()
            .map((Connection c) -> UserSummary.of(c.getUserId(), c.getEmail(), c.getRole()));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
