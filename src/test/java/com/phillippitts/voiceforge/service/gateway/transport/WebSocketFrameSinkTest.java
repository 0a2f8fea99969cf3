package com.phillippitts.voiceforge.service.gateway.transport;

import com.phillippitts.voiceforge.service.gateway.protocol.ServerFrame;
import org.java_websocket.WebSocket;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.framing.CloseFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketFrameSinkTest {

    private WebSocket webSocket;
    private WebSocketFrameSink sink;

    @BeforeEach
    void setUp() {
        webSocket = mock(WebSocket.class);
        sink = new WebSocketFrameSink(webSocket);
    }

    @Test
    void shouldSendEncodedFrameWhileOpen() {
        when(webSocket.isOpen()).thenReturn(true);

        sink.send(ServerFrame.error("INVALID_STATE", "Session already paused", true));

        verify(webSocket).send(contains("\"type\":\"error\""));
    }

    @Test
    void shouldDropFramesAfterClose() {
        when(webSocket.isOpen()).thenReturn(false);

        sink.send(ServerFrame.error("INVALID_STATE", "late", true));
        sink.close("idle_timeout");

        verify(webSocket, never()).send(anyString());
        verify(webSocket, never()).close(anyInt(), anyString());
    }

    @Test
    void shouldTolerateConnectionDroppingMidSend() {
        when(webSocket.isOpen()).thenReturn(true);
        doThrow(new WebsocketNotConnectedException()).when(webSocket).send(anyString());

        assertThatCode(() -> sink.send(ServerFrame.error("INVALID_STATE", "x", true)))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldCloseNormallyWithReason() {
        when(webSocket.isOpen()).thenReturn(true);

        sink.close("client_end");

        verify(webSocket).close(CloseFrame.NORMAL, "client_end");
    }
}
