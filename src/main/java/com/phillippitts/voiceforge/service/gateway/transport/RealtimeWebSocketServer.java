package com.phillippitts.voiceforge.service.gateway.transport;

import com.phillippitts.voiceforge.exception.SessionErrorKind;
import com.phillippitts.voiceforge.exception.SessionProtocolException;
import com.phillippitts.voiceforge.service.gateway.SessionGateway;
import com.phillippitts.voiceforge.service.gateway.protocol.FrameCodec;
import com.phillippitts.voiceforge.service.gateway.protocol.ServerFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.java_websocket.WebSocket;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;

/**
 * WebSocket transport for the session gateway. Text messages carry JSON frames; binary
 * messages are raw PCM16LE audio chunks. The gateway session id is kept as the connection's
 * attachment.
 */
public class RealtimeWebSocketServer extends WebSocketServer {

    private static final Logger LOG = LogManager.getLogger(RealtimeWebSocketServer.class);
    private static final int STOP_TIMEOUT_MS = 1000;

    private final SessionGateway gateway;

    public RealtimeWebSocketServer(InetSocketAddress address, SessionGateway gateway) {
        super(address);
        this.gateway = gateway;
        setReuseAddr(true);
    }

    @Override
    public void onOpen(WebSocket webSocket, ClientHandshake handshake) {
        String sessionId = gateway.connect(new WebSocketFrameSink(webSocket));
        webSocket.setAttachment(sessionId);
        LOG.info("Connection {} opened session {}", webSocket.getRemoteSocketAddress(), sessionId);
    }

    @Override
    public void onClose(WebSocket webSocket, int code, String reason, boolean remote) {
        String sessionId = webSocket.getAttachment();
        LOG.info("Connection {} closed (code={}, remote={}, reason={}), session {}",
                webSocket.getRemoteSocketAddress(), code, remote, reason, sessionId);
        if (sessionId != null) {
            gateway.disconnect(sessionId);
        }
    }

    @Override
    public void onMessage(WebSocket webSocket, String message) {
        try {
            gateway.onText(webSocket.getAttachment(), message);
        } catch (SessionProtocolException e) {
            rejectUnknownSession(webSocket, e);
        }
    }

    @Override
    public void onMessage(WebSocket webSocket, ByteBuffer bytes) {
        byte[] audio = new byte[bytes.remaining()];
        bytes.get(audio);
        try {
            gateway.onBinary(webSocket.getAttachment(), audio);
        } catch (SessionProtocolException e) {
            rejectUnknownSession(webSocket, e);
        }
    }

    @Override
    public void onError(WebSocket webSocket, Exception ex) {
        if (webSocket == null) {
            LOG.error("WebSocket server error", ex);
            return;
        }
        LOG.warn("Error on connection {}: {}", webSocket.getRemoteSocketAddress(), ex.toString());
    }

    @Override
    public void onStart() {
        LOG.info("Session gateway listening on ws://{}:{}", getAddress().getHostString(), getPort());
    }

    /**
     * Stops accepting connections and closes open ones.
     */
    public void shutdown() {
        try {
            stop(STOP_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while stopping WebSocket server");
        }
    }

    private static void rejectUnknownSession(WebSocket webSocket, SessionProtocolException e) {
        if (e.getKind() != SessionErrorKind.SESSION_NOT_FOUND) {
            throw e;
        }
        if (webSocket.isOpen()) {
            webSocket.send(FrameCodec.encode(ServerFrame.error(e.getKind().name(), e.getMessage(), false)));
            webSocket.close(CloseFrame.POLICY_VALIDATION, "session not found");
        }
    }
}
