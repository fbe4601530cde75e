package io.facegate.metrics;

import io.facegate.domain.common.EventType;

/**
 * Metrics collection for the realtime gateway.
 *
 * Tracks:
 * - Live connections
 * - Authentication outcomes
 * - Local deliveries and per-connection delivery failures
 * - Backplane traffic in both directions
 * - Heartbeat ticks
 */
public interface GatewayMetrics {

    /**
     * Current number of registered connections.
     */
    void recordConnectionCount(int connections);

    void recordAuthentication(boolean success);

    /**
     * @param recipients connections the envelope was written to
     */
    void recordDelivery(EventType type, int recipients);

    void recordDeliveryFailure();

    void recordBackplane(Direction direction, Outcome outcome);

    void recordHeartbeat(int recipients);

    // ════════════════════════════════════════════════════════════════════════
    // ENUMS
    // ════════════════════════════════════════════════════════════════════════

    enum Direction {
        OUTBOUND,
        INBOUND
    }

    enum Outcome {
        OK,
        FAILED,
        MALFORMED,
        SKIPPED
    }
}
