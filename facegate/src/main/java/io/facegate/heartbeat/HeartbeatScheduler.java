package io.facegate.heartbeat;

import io.facegate.gateway.Broadcaster;
import io.facegate.gateway.ConnectionRegistry;
import io.facegate.gateway.ServerFrames;
import io.facegate.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Periodic liveness broadcast plus replies to client heartbeat messages.
 *
 * Ticks go to every registered connection regardless of subscriptions.
 * Idle connections are not evicted here; a reaper can use
 * {@code Connection.getLastActivityAt()}.
 *
 * Usage:
 * <pre>
 * HeartbeatScheduler heartbeat = new HeartbeatScheduler(registry, broadcaster, metrics, Duration.ofSeconds(30));
 * heartbeat.start();
 * // On client "heartbeat" message:
 * heartbeat.reply(connectionId);
 * heartbeat.stop();
 * </pre>
 */
public class HeartbeatScheduler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);
    private static final String SERVER_CLIENT_ID = "server";

    private final ConnectionRegistry registry;
    private final Broadcaster broadcaster;
    private final GatewayMetrics metrics;
    private final Duration interval;
    private final Clock clock;
    private final LongSupplier uptimeMillis;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> tickTask;
    private volatile boolean running = false;

    public HeartbeatScheduler(ConnectionRegistry registry, Broadcaster broadcaster,
                              GatewayMetrics metrics, Duration interval) {
        this(registry, broadcaster, metrics, interval, Clock.systemUTC(),
            () -> ManagementFactory.getRuntimeMXBean().getUptime());
    }

    public HeartbeatScheduler(ConnectionRegistry registry, Broadcaster broadcaster,
                              GatewayMetrics metrics, Duration interval,
                              Clock clock, LongSupplier uptimeMillis) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.metrics = metrics;
        this.interval = interval;
        this.clock = clock;
        this.uptimeMillis = uptimeMillis;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-heartbeat");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start periodic ticks.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[HEARTBEAT] Already running");
            return;
        }
        running = true;
        tickTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                tick();
            } catch (Exception e) {
                log.error("[HEARTBEAT] Tick failed", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("[HEARTBEAT] Started (interval: {}ms)", interval.toMillis());
    }

    /**
     * Cancel the timer. In-flight sends are not awaited.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        scheduler.shutdownNow();
        log.info("[HEARTBEAT] Stopped");
    }

    /**
     * Send one heartbeat to every registered connection.
     *
     * @return number of connections reached
     */
    public int tick() {
        String frame = ServerFrames.heartbeat(SERVER_CLIENT_ID, clock.instant(), uptimeSeconds(), registry.size());
        int reached = broadcaster.sendToAll(frame);
        metrics.recordHeartbeat(reached);
        log.debug("[HEARTBEAT] Tick reached {} connections", reached);
        return reached;
    }

    /**
     * Answer a client heartbeat: record activity and reply to that client only.
     *
     * @return false if the connection is not registered
     */
    public boolean reply(String connectionId) {
        if (registry.touch(connectionId).isEmpty()) {
            return false;
        }
        Instant now = clock.instant();
        return broadcaster.sendTo(connectionId,
            ServerFrames.heartbeat(connectionId, now, uptimeSeconds(), registry.size()));
    }

    public boolean isRunning() {
        return running;
    }

    private double uptimeSeconds() {
        return uptimeMillis.getAsLong() / 1000.0;
    }
}
