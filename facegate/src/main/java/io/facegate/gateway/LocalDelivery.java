package io.facegate.gateway;

/**
 * Delivers an envelope to this process's own connections only.
 * Handed to the cross-instance bus so it can re-inject inbound envelopes
 * without being able to publish them again.
 */
@FunctionalInterface
public interface LocalDelivery {

    /**
     * @return number of connections the envelope was written to
     */
    int deliver(Envelope envelope, BroadcastTarget target);
}
