package io.facegate.metrics;

import io.facegate.domain.common.EventType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

import java.util.Locale;

/**
 * Prometheus implementation of GatewayMetrics.
 *
 * Key Metrics:
 * - gateway_connections - Registered connections
 * - gateway_auth_total{result} - Authentication outcomes
 * - gateway_messages_delivered_total{type} - Envelopes written to clients
 * - gateway_delivery_failures_total - Failed client writes
 * - gateway_backplane_messages_total{direction, status} - Backplane traffic
 * - gateway_heartbeats_total - Heartbeat ticks
 * - gateway_heartbeat_recipients - Connections reached by the last tick
 */
public class PrometheusGatewayMetrics implements GatewayMetrics {

    private final CollectorRegistry registry;

    private final Gauge connections;
    private final Counter authCounter;
    private final Counter deliveredCounter;
    private final Counter deliveryFailureCounter;
    private final Counter backplaneCounter;
    private final Counter heartbeatCounter;
    private final Gauge heartbeatRecipients;

    public PrometheusGatewayMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusGatewayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.connections = Gauge.build()
            .name("gateway_connections")
            .help("Number of registered client connections")
            .register(registry);

        this.authCounter = Counter.build()
            .name("gateway_auth_total")
            .help("Connection authentication attempts")
            .labelNames("result")
            .register(registry);

        this.deliveredCounter = Counter.build()
            .name("gateway_messages_delivered_total")
            .help("Envelopes written to client connections")
            .labelNames("type")
            .register(registry);

        this.deliveryFailureCounter = Counter.build()
            .name("gateway_delivery_failures_total")
            .help("Client writes that failed")
            .register(registry);

        this.backplaneCounter = Counter.build()
            .name("gateway_backplane_messages_total")
            .help("Messages exchanged with the cross-instance backplane")
            .labelNames("direction", "status")
            .register(registry);

        this.heartbeatCounter = Counter.build()
            .name("gateway_heartbeats_total")
            .help("Heartbeat ticks sent")
            .register(registry);

        this.heartbeatRecipients = Gauge.build()
            .name("gateway_heartbeat_recipients")
            .help("Connections reached by the most recent heartbeat tick")
            .register(registry);
    }

    @Override
    public void recordConnectionCount(int count) {
        connections.set(count);
    }

    @Override
    public void recordAuthentication(boolean success) {
        authCounter.labels(success ? "success" : "failure").inc();
    }

    @Override
    public void recordDelivery(EventType type, int recipients) {
        if (recipients > 0) {
            deliveredCounter.labels(type.name()).inc(recipients);
        }
    }

    @Override
    public void recordDeliveryFailure() {
        deliveryFailureCounter.inc();
    }

    @Override
    public void recordBackplane(Direction direction, Outcome outcome) {
        backplaneCounter.labels(
            direction.name().toLowerCase(Locale.ROOT),
            outcome.name().toLowerCase(Locale.ROOT)
        ).inc();
    }

    @Override
    public void recordHeartbeat(int recipients) {
        heartbeatCounter.inc();
        heartbeatRecipients.set(recipients);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
