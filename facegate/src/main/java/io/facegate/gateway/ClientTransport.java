package io.facegate.gateway;

import java.net.SocketAddress;

/**
 * Write side of one client session.
 *
 * Sends must not block the caller: implementations queue the frame and
 * report failures asynchronously (or throw {@link DeliveryException} when the
 * frame cannot even be queued).
 */
public interface ClientTransport {

    /**
     * Opaque id, unique per transport session.
     */
    String id();

    /**
     * Queue a text frame for delivery.
     *
     * @throws DeliveryException if the transport refused the frame
     */
    void send(String frame);

    boolean isOpen();

    /**
     * Close the session. Idempotent.
     */
    void close();

    SocketAddress remoteAddress();
}
