package com.phillippitts.voiceforge.service.gateway.transport;

import com.phillippitts.voiceforge.exception.SessionErrorKind;
import com.phillippitts.voiceforge.exception.SessionProtocolException;
import com.phillippitts.voiceforge.service.gateway.FrameSink;
import com.phillippitts.voiceforge.service.gateway.SessionGateway;
import org.java_websocket.WebSocket;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RealtimeWebSocketServerTest {

    private SessionGateway gateway;
    private RealtimeWebSocketServer server;
    private WebSocket webSocket;

    @BeforeEach
    void setUp() {
        gateway = mock(SessionGateway.class);
        server = new RealtimeWebSocketServer(new InetSocketAddress("127.0.0.1", 0), gateway);
        webSocket = mock(WebSocket.class);
        when(webSocket.isOpen()).thenReturn(true);
    }

    @Test
    void shouldOpenSessionAndAttachItsId() {
        when(gateway.connect(any(FrameSink.class))).thenReturn("s-1");

        server.onOpen(webSocket, mock(ClientHandshake.class));

        verify(webSocket).setAttachment("s-1");
    }

    @Test
    void shouldForwardTextAndAudioToSession() {
        when(webSocket.<String>getAttachment()).thenReturn("s-1");

        server.onMessage(webSocket, "{\"type\":\"pause\"}");
        server.onMessage(webSocket, ByteBuffer.wrap(new byte[] {1, 2, 3, 4}));

        verify(gateway).onText("s-1", "{\"type\":\"pause\"}");
        verify(gateway).onBinary("s-1", new byte[] {1, 2, 3, 4});
    }

    @Test
    void shouldRejectFramesForUnknownSession() {
        when(webSocket.<String>getAttachment()).thenReturn("gone");
        doThrow(new SessionProtocolException(SessionErrorKind.SESSION_NOT_FOUND, "No session gone"))
                .when(gateway).onText(eq("gone"), anyString());

        server.onMessage(webSocket, "{\"type\":\"end\"}");

        verify(webSocket).send(contains("SESSION_NOT_FOUND"));
        verify(webSocket).close(eq(CloseFrame.POLICY_VALIDATION), anyString());
    }

    @Test
    void shouldPropagateOtherProtocolErrors() {
        when(webSocket.<String>getAttachment()).thenReturn("s-1");
        doThrow(new SessionProtocolException(SessionErrorKind.INVALID_FRAME, "bad"))
                .when(gateway).onBinary(eq("s-1"), any(byte[].class));

        assertThatThrownBy(() -> server.onMessage(webSocket, ByteBuffer.wrap(new byte[] {0, 0})))
                .isInstanceOf(SessionProtocolException.class);
        verify(webSocket, never()).close(eq(CloseFrame.POLICY_VALIDATION), anyString());
    }

    @Test
    void shouldDisconnectSessionOnClose() {
        when(webSocket.<String>getAttachment()).thenReturn("s-1");

        server.onClose(webSocket, CloseFrame.GOING_AWAY, "bye", true);

        verify(gateway).disconnect("s-1");
    }

    @Test
    void shouldIgnoreCloseBeforeSessionWasAttached() {
        server.onClose(webSocket, CloseFrame.ABNORMAL_CLOSE, "", true);

        verify(gateway, never()).disconnect(anyString());
    }
}
