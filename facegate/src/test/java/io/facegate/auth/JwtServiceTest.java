package io.facegate.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JwtServiceTest {

    private static final String SECRET = "test-secret";
    private final JwtService jwt = new JwtService(SECRET, 3_600_000L);

    @Test
    void testGeneratedTokenVerifies() {
        String token = jwt.generateToken("user-1", "a@example.com", "ADMIN");

        Identity identity = jwt.verify(token);

        assertEquals("user-1", identity.subject());
        assertEquals("a@example.com", identity.email());
        assertEquals("ADMIN", identity.role());
        assertTrue(identity.isAdmin());
    }

    @Test
    void testTokenSignedWithOtherSecretIsRejected() {
        String token = new JwtService("other-secret", 3_600_000L).generateToken("user-1", "a@example.com", "USER");

        AuthenticationException e = assertThrows(AuthenticationException.class, () -> jwt.verify(token));
        assertEquals("Invalid token signature", e.getMessage());
    }

    @Test
    void testTamperedPayloadIsRejected() {
        String token = jwt.generateToken("user-1", "a@example.com", "USER");
        String forged = jwt.generateToken("admin", "root@example.com", "ADMIN");
        String[] a = token.split("\\.");
        String[] b = forged.split("\\.");

        String mixed = a[0] + "." + b[1] + "." + a[2];

        assertThrows(AuthenticationException.class, () -> jwt.verify(mixed));
    }

    @Test
    void testExpiredTokenIsRejected() {
        JwtService shortLived = new JwtService(SECRET, -60_000L);
        String token = shortLived.generateToken("user-1", "a@example.com", "USER");

        AuthenticationException e = assertThrows(AuthenticationException.class, () -> jwt.verify(token));
        assertEquals("Token expired", e.getMessage());
    }

    @Test
    void testMalformedTokenIsRejected() {
        AuthenticationException e = assertThrows(AuthenticationException.class, () -> jwt.verify("not-a-jwt"));
        assertEquals("Invalid token format", e.getMessage());

        assertEquals("Missing token",
            assertThrows(AuthenticationException.class, () -> jwt.verify(" ")).getMessage());
    }

    @Test
    void testTokenWithoutSubjectIsRejected() {
        String token = jwt.generateToken(null, "a@example.com", "USER");

        AuthenticationException e = assertThrows(AuthenticationException.class, () -> jwt.verify(token));
        assertEquals("Missing required claims", e.getMessage());
    }

    @Test
    void testBlacklistedTokenIsRejected() {
        String token = jwt.generateToken("user-1", "a@example.com", "USER");
        jwt.blacklistToken("Bearer " + token);

        AuthenticationException e = assertThrows(AuthenticationException.class, () -> jwt.verify(token));
        assertEquals("Token revoked", e.getMessage());

        // Entries younger than the token lifetime survive cleanup
        jwt.cleanupBlacklist();
        assertThrows(AuthenticationException.class, () -> jwt.verify(token));
    }
}
