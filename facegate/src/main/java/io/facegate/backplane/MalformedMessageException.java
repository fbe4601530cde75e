package io.facegate.backplane;

/**
 * An inbound backplane message could not be decoded. The message is dropped.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
