package io.facegate.transport.ws;

import io.facegate.gateway.ClientTransport;
import io.facegate.gateway.DeliveryException;
import io.facegate.metrics.GatewayMetrics;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;

/**
 * {@link ClientTransport} over an Undertow WebSocket channel.
 * Sends are queued by Undertow and complete on the channel's I/O thread.
 * A send that fails or times out there is counted and closes the channel.
 */
final class WebSocketClientTransport implements ClientTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketClientTransport.class);

    private final String id;
    private final WebSocketChannel channel;
    private final long sendTimeoutMs;
    private final GatewayMetrics metrics;
    private final WebSocketCallback<Void> sendCallback;

    WebSocketClientTransport(String id, WebSocketChannel channel, long sendTimeoutMs, GatewayMetrics metrics) {
        this.id = id;
        this.channel = channel;
        this.sendTimeoutMs = sendTimeoutMs;
        this.metrics = metrics;
        this.sendCallback = new WebSocketCallback<>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                onSendFailure(throwable);
            }
        };
    }

    void onSendFailure(Throwable cause) {
        log.warn("[WS] Send to {} failed, closing: {}", id, cause.toString());
        metrics.recordDeliveryFailure();
        // Peer is not reading; skip the close handshake
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[WS] Channel close failed for {}: {}", id, e.getMessage());
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String frame) {
        if (!channel.isOpen()) {
            throw new DeliveryException(id, "Channel closed");
        }
        try {
            WebSockets.sendText(frame, channel, sendCallback, sendTimeoutMs);
        } catch (RuntimeException e) {
            throw new DeliveryException(id, "Send rejected: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public void close() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.sendClose();
        } catch (IOException e) {
            log.debug("[WS] Close frame failed for {}: {}", id, e.getMessage());
            try {
                channel.close();
            } catch (IOException ex) {
                log.debug("[WS] Channel close failed for {}: {}", id, ex.getMessage());
            }
        }
    }

    @Override
    public SocketAddress remoteAddress() {
        return channel.getSourceAddress();
    }

    @Override
    public String toString() {
        return "WebSocketClientTransport{" + id + " " + channel.getSourceAddress() + "}";
    }
}
