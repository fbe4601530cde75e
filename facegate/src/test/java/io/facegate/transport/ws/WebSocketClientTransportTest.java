package io.facegate.transport.ws;

import io.facegate.gateway.DeliveryException;
import io.facegate.metrics.GatewayMetrics;
import io.undertow.websockets.core.WebSocketChannel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebSocketClientTransportTest {

    @Mock
    private WebSocketChannel channel;
    @Mock
    private GatewayMetrics metrics;

    @Test
    void testAsyncSendFailureIsCountedAndClosesChannel() throws IOException {
        WebSocketClientTransport transport = new WebSocketClientTransport("c1", channel, 5000, metrics);

        transport.onSendFailure(new ClosedChannelException());

        verify(metrics).recordDeliveryFailure();
        verify(channel).close();
    }

    @Test
    void testSendTimeoutIsCounted() throws IOException {
        WebSocketClientTransport transport = new WebSocketClientTransport("c1", channel, 5000, metrics);
        doThrow(new IOException("already closed")).when(channel).close();

        assertDoesNotThrow(() -> transport.onSendFailure(new IOException("send timed out")));

        verify(metrics).recordDeliveryFailure();
    }

    @Test
    void testSendOnClosedChannelIsRejected() {
        WebSocketClientTransport transport = new WebSocketClientTransport("c1", channel, 5000, metrics);
        when(channel.isOpen()).thenReturn(false);

        DeliveryException e = assertThrows(DeliveryException.class, () -> transport.send("{}"));

        assertTrue(e.getMessage().contains("Channel closed"));
        verifyNoInteractions(metrics);
    }

    @Test
    void testNotOpenOnceCloseFrameSent() {
        WebSocketClientTransport transport = new WebSocketClientTransport("c1", channel, 5000, metrics);
        when(channel.isOpen()).thenReturn(true);
        when(channel.isCloseFrameSent()).thenReturn(true);

        assertFalse(transport.isOpen());
    }
}
