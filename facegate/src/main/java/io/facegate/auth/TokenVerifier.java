package io.facegate.auth;

/**
 * Verifies a raw bearer token (no "Bearer " prefix) and extracts its claims.
 * Implementations may consult a revocation list and therefore may block.
 */
@FunctionalInterface
public interface TokenVerifier {

    /**
     * @throws AuthenticationException if the token is malformed, forged, expired or revoked
     */
    Identity verify(String token);
}
