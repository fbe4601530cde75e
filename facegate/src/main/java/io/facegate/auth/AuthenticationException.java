package io.facegate.auth;

/**
 * Thrown when a bearer credential is missing, invalid, expired or revoked.
 * The connection presenting it must be closed and never registered.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
