package io.facegate.gateway;

/**
 * A frame could not be written to a client transport.
 * Logged by the caller; the transport's close callback performs the cleanup.
 */
public class DeliveryException extends RuntimeException {

    private final String connectionId;

    public DeliveryException(String connectionId, String message) {
        super(String.format("[%s] %s", connectionId, message));
        this.connectionId = connectionId;
    }

    public DeliveryException(String connectionId, String message, Throwable cause) {
        super(String.format("[%s] %s", connectionId, message), cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
