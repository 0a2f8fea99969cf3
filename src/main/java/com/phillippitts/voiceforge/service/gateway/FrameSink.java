package com.phillippitts.voiceforge.service.gateway;

import com.phillippitts.voiceforge.service.gateway.protocol.ServerFrame;

/**
 * Outbound side of one client connection. Implementations must tolerate calls after the
 * connection is gone.
 */
public interface FrameSink {

    void send(ServerFrame frame);

    /**
     * Closes the underlying connection.
     */
    void close(String reason);
}
