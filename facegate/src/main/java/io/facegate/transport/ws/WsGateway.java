package io.facegate.transport.ws;

import io.facegate.config.GatewayConfig;
import io.facegate.gateway.ClientProtocolHandler;
import io.facegate.metrics.GatewayMetrics;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Undertow WebSocket endpoint.
 *
 * Rejects disallowed origins before the upgrade, then hands each channel to
 * the {@link ClientProtocolHandler}. The token is taken from {@code ?token=}
 * or the {@code Authorization} header; without one the client must send an
 * authenticate message.
 */
public final class WsGateway implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(WsGateway.class);

    private final GatewayConfig config;
    private final ClientProtocolHandler protocol;
    private final GatewayMetrics metrics;
    private final WebSocketProtocolHandshakeHandler handshake;

    public WsGateway(GatewayConfig config, ClientProtocolHandler protocol, GatewayMetrics metrics) {
        this.config = config;
        this.protocol = protocol;
        this.metrics = metrics;
        this.handshake = new WebSocketProtocolHandshakeHandler(new Callback());
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);
        if (!config.isOriginAllowed(origin)) {
            log.warn("[WS] Rejected origin {} from {}", origin, exchange.getSourceAddress());
            exchange.setStatusCode(StatusCodes.FORBIDDEN);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send("Origin not allowed");
            return;
        }
        handshake.handleRequest(exchange);
    }

    static String extractToken(Map<String, List<String>> params, String authorization) {
        List<String> tokens = params == null ? null : params.get("token");
        if (tokens != null && !tokens.isEmpty() && !tokens.get(0).isBlank()) {
            return tokens.get(0);
        }
        if (authorization != null && !authorization.isBlank()) {
            return authorization;
        }
        return null;
    }

    private final class Callback implements WebSocketConnectionCallback {
        @Override
        public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
            String token = extractToken(exchange.getRequestParameters(),
                exchange.getRequestHeader(Headers.AUTHORIZATION_STRING));
            WebSocketClientTransport transport = new WebSocketClientTransport(
                UUID.randomUUID().toString(), channel, config.sendTimeout().toMillis(), metrics);

            channel.getReceiveSetter().set(new AbstractReceiveListener() {
                @Override
                protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                    protocol.onMessage(transport, message.getData());
                }

                @Override
                protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                    protocol.onClose(transport);
                    super.onCloseMessage(cm, ch);
                }

                @Override
                protected void onError(WebSocketChannel ch, Throwable error) {
                    log.warn("[WS] Channel error on {}: {}", transport.id(), error.toString());
                    protocol.onClose(transport);
                    super.onError(ch, error);
                }
            });
            channel.addCloseTask(ch -> protocol.onClose(transport));

            protocol.onOpen(transport, token);
            channel.resumeReceives();
        }
    }
}
