package io.facegate.auth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthenticationGateTest {

    @Mock
    private TokenVerifier verifier;

    private AuthenticationGate gate;

    @BeforeEach
    void setUp() {
        gate = new AuthenticationGate(verifier);
    }

    @Test
    void testAuthenticateStripsBearerPrefix() {
        Identity identity = new Identity("u1", "u1@example.com", "USER");
        when(verifier.verify("abc.def.ghi")).thenReturn(identity);

        assertEquals(identity, gate.authenticate("Bearer abc.def.ghi"));
        assertEquals(identity, gate.authenticate("abc.def.ghi"));
    }

    @Test
    void testAuthenticateMissingTokenNeverReachesVerifier() {
        assertEquals("Missing token",
            assertThrows(AuthenticationException.class, () -> gate.authenticate(null)).getMessage());
        assertEquals("Missing token",
            assertThrows(AuthenticationException.class, () -> gate.authenticate("  ")).getMessage());

        verifyNoInteractions(verifier);
    }

    @Test
    void testAuthenticatePropagatesVerifierRejection() {
        when(verifier.verify(anyString())).thenThrow(new AuthenticationException("Token expired"));

        AuthenticationException e = assertThrows(AuthenticationException.class, () -> gate.authenticate("t"));
        assertEquals("Token expired", e.getMessage());
    }

    @Test
    void testAuthenticateWrapsUnexpectedVerifierFailure() {
        when(verifier.verify(anyString())).thenThrow(new IllegalStateException("boom"));

        AuthenticationException e = assertThrows(AuthenticationException.class, () -> gate.authenticate("t"));
        assertEquals("Token verification failed", e.getMessage());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
