package io.facegate.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HS256 JWT issuing and verification.
 *
 * Tokens carry sub, email, role, iat and exp (seconds). Verification checks the
 * signature, the expiry and the logout blacklist.
 */
public final class JwtService implements TokenVerifier {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String HEADER = base64Encode("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");

    private final String secret;
    private final long expirationMs;

    // Token blacklist for logout
    private final Map<String, Instant> blacklist = new ConcurrentHashMap<>();

    public JwtService(String secret, long expirationMs) {
        this.secret = secret;
        this.expirationMs = expirationMs;
    }

    /**
     * Generate JWT token for user.
     */
    public String generateToken(String userId, String email, String role) {
        long now = System.currentTimeMillis();
        long exp = now + expirationMs;

        ObjectNode claims = MAPPER.createObjectNode();
        claims.put("sub", userId);
        claims.put("email", email);
        claims.put("role", role);
        claims.put("iat", now / 1000);
        claims.put("exp", exp / 1000);

        String payload = base64Encode(claims.toString());
        return HEADER + "." + payload + "." + sign(HEADER + "." + payload);
    }

    @Override
    public Identity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException("Missing token");
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw new AuthenticationException("Invalid token format");
        }

        String expectedSig = sign(parts[0] + "." + parts[1]);
        if (!MessageDigest.isEqual(
                expectedSig.getBytes(StandardCharsets.US_ASCII),
                parts[2].getBytes(StandardCharsets.US_ASCII))) {
            throw new AuthenticationException("Invalid token signature");
        }

        JsonNode claims;
        try {
            claims = MAPPER.readTree(base64Decode(parts[1]));
        } catch (Exception e) {
            throw new AuthenticationException("Invalid token payload", e);
        }

        String sub = claims.path("sub").asText(null);
        if (sub == null || sub.isEmpty() || !claims.hasNonNull("exp")) {
            throw new AuthenticationException("Missing required claims");
        }

        long expMs = claims.get("exp").asLong() * 1000;
        if (System.currentTimeMillis() >= expMs) {
            throw new AuthenticationException("Token expired");
        }

        if (blacklist.containsKey(token)) {
            throw new AuthenticationException("Token revoked");
        }

        return new Identity(sub, claims.path("email").asText(""), claims.path("role").asText(""));
    }

    /**
     * Blacklist a token (for logout).
     */
    public void blacklistToken(String token) {
        if (token != null) {
            blacklist.put(AuthenticationGate.stripBearer(token), Instant.now());
        }
    }

    /**
     * Drop blacklist entries old enough that the token has expired anyway.
     */
    public void cleanupBlacklist() {
        long now = System.currentTimeMillis();
        int before = blacklist.size();
        blacklist.entrySet().removeIf(e -> e.getValue().toEpochMilli() + expirationMs < now);
        log.debug("Blacklist cleanup removed {} entries", before - blacklist.size());
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    private static String base64Encode(String data) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(data.getBytes(StandardCharsets.UTF_8));
    }

    private static String base64Decode(String data) {
        return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
    }
}
