package io.facegate.transport.ws;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WsGatewayTest {

    @Test
    void testExtractTokenPrefersQueryParameter() {
        assertEquals("q-token", WsGateway.extractToken(Map.of("token", List.of("q-token")), "Bearer h-token"));
    }

    @Test
    void testExtractTokenFallsBackToAuthorizationHeader() {
        assertEquals("Bearer h-token", WsGateway.extractToken(Map.of(), "Bearer h-token"));
        assertEquals("Bearer h-token", WsGateway.extractToken(Map.of("token", List.of(" ")), "Bearer h-token"));
    }

    @Test
    void testExtractTokenNoneGiven() {
        assertNull(WsGateway.extractToken(null, null));
        assertNull(WsGateway.extractToken(Map.of(), " "));
    }
}
