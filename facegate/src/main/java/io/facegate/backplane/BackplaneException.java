package io.facegate.backplane;

/**
 * Publishing to or subscribing on the backplane failed.
 * Local delivery is unaffected; cross-instance delivery of the message may be lost.
 */
public class BackplaneException extends RuntimeException {

    public BackplaneException(String message) {
        super(message);
    }

    public BackplaneException(String message, Throwable cause) {
        super(message, cause);
    }
}
