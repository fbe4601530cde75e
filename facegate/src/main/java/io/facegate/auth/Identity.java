package io.facegate.auth;

/**
 * Identity claims extracted from a verified token.
 */
public record Identity(String subject, String email, String role) {

    public boolean isAdmin() {
        return "ADMIN".equals(role);
    }
}
