package com.phillippitts.voiceforge.service.gateway.transport;

import com.phillippitts.voiceforge.service.gateway.FrameSink;
import com.phillippitts.voiceforge.service.gateway.protocol.FrameCodec;
import com.phillippitts.voiceforge.service.gateway.protocol.ServerFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.java_websocket.WebSocket;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.framing.CloseFrame;

/**
 * {@link FrameSink} writing JSON text frames to one WebSocket connection.
 */
final class WebSocketFrameSink implements FrameSink {

    private static final Logger LOG = LogManager.getLogger(WebSocketFrameSink.class);

    private final WebSocket webSocket;

    WebSocketFrameSink(WebSocket webSocket) {
        this.webSocket = webSocket;
    }

    @Override
    public void send(ServerFrame frame) {
        if (!webSocket.isOpen()) {
            LOG.debug("Dropping {} for closed connection {}", frame, webSocket.getRemoteSocketAddress());
            return;
        }
        try {
            webSocket.send(FrameCodec.encode(frame));
        } catch (WebsocketNotConnectedException e) {
            LOG.debug("Connection {} closed while sending {}", webSocket.getRemoteSocketAddress(), frame);
        }
    }

    @Override
    public void close(String reason) {
        if (webSocket.isOpen()) {
            webSocket.close(CloseFrame.NORMAL, reason);
        }
    }
}
