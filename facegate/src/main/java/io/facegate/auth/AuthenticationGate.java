package io.facegate.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for connection authentication.
 * There is no anonymous mode: a missing token is a failure.
 */
public final class AuthenticationGate {
    private static final Logger log = LoggerFactory.getLogger(AuthenticationGate.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenVerifier verifier;

    public AuthenticationGate(TokenVerifier verifier) {
        this.verifier = verifier;
    }

    /**
     * Verify a bearer credential.
     *
     * @param bearer raw token, optionally prefixed with "Bearer "
     * @return identity claims of the token holder
     * @throws AuthenticationException on any verification failure
     */
    public Identity authenticate(String bearer) {
        if (bearer == null || bearer.isBlank()) {
            throw new AuthenticationException("Missing token");
        }

        Identity identity;
        try {
            identity = verifier.verify(stripBearer(bearer.trim()));
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Token verifier failed: {}", e.toString());
            throw new AuthenticationException("Token verification failed", e);
        }
        log.debug("Token verified for subject={} role={}", identity.subject(), identity.role());
        return identity;
    }

    static String stripBearer(String token) {
        return token.startsWith(BEARER_PREFIX) ? token.substring(BEARER_PREFIX.length()).trim() : token;
    }
}
