package io.facegate.gateway;

import java.util.List;

/**
 * A client request named something the gateway does not know.
 * Reported back to the client; the connection stays open.
 */
public class ValidationException extends RuntimeException {

    private final List<String> rejected;

    public ValidationException(String message, List<String> rejected) {
        super(message);
        this.rejected = List.copyOf(rejected);
    }

    public List<String> getRejected() {
        return rejected;
    }
}
