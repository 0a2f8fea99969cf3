package com.phillippitts.voiceforge.service.gateway;

import com.phillippitts.voiceforge.config.properties.GatewayProperties;
import com.phillippitts.voiceforge.exception.SessionErrorKind;
import com.phillippitts.voiceforge.exception.SessionProtocolException;
import com.phillippitts.voiceforge.service.gateway.context.ContextStore;
import com.phillippitts.voiceforge.service.gateway.protocol.ClientFrame;
import com.phillippitts.voiceforge.service.gateway.protocol.FrameCodec;
import com.phillippitts.voiceforge.service.metrics.PipelineMetrics;
import com.phillippitts.voiceforge.service.metrics.TurnMetricsAggregator;
import com.phillippitts.voiceforge.service.pool.TaskRouter;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Entry point for streaming client connections.
 *
 * <p>A transport calls {@link #connect(FrameSink)} when a client connects, forwards every inbound
 * message with {@link #onText(String, String)} or {@link #onBinary(String, byte[])}, and calls
 * {@link #disconnect(String)} when the connection goes away. Frames are decoded on the
 * transport's thread and then handed to the session's mailbox on the shared session executor.
 */
@Service
public class SessionGateway {

    private static final Logger LOG = LogManager.getLogger(SessionGateway.class);

    private final TaskRouter router;
    private final ContextStore contextStore;
    private final GatewayProperties properties;
    private final TurnMetricsAggregator aggregator;
    private final PipelineMetrics pipelineMetrics;
    private final Executor sessionExecutor;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public SessionGateway(TaskRouter router,
                          ContextStore contextStore,
                          GatewayProperties properties,
                          TurnMetricsAggregator aggregator,
                          PipelineMetrics pipelineMetrics,
                          @Qualifier("sessionExecutor") Executor sessionExecutor) {
        this.router = router;
        this.contextStore = contextStore;
        this.properties = properties;
        this.aggregator = aggregator;
        this.pipelineMetrics = pipelineMetrics;
        this.sessionExecutor = sessionExecutor;
    }

    /**
     * Registers a new connection. The session starts in {@link SessionState#INITIALIZING} and
     * accepts only {@code init} (or {@code end}) until then.
     *
     * @return session id used for all further calls
     */
    public String connect(FrameSink sink) {
        String id = UUID.randomUUID().toString();
        Session session = new Session(id, sink, router, contextStore, properties, aggregator,
                pipelineMetrics, sessionExecutor, this::onSessionEnded);
        sessions.put(id, session);
        pipelineMetrics.sessionOpened();
        LOG.debug("Session {} connected", id);
        return id;
    }

    /**
     * Handles a JSON text frame.
     *
     * @throws SessionProtocolException with {@link SessionErrorKind#SESSION_NOT_FOUND} if the
     *                                  session does not exist (or has ended)
     */
    public void onText(String sessionId, String text) {
        Session session = require(sessionId);
        ClientFrame frame;
        try {
            frame = FrameCodec.decode(text);
        } catch (SessionProtocolException e) {
            LOG.debug("Session {} sent an invalid frame: {}", sessionId, e.getMessage());
            session.reject(e.getKind(), e.getMessage());
            return;
        }
        session.accept(frame);
    }

    /**
     * Handles a binary frame as raw PCM16LE audio.
     *
     * @throws SessionProtocolException if the session does not exist
     */
    public void onBinary(String sessionId, byte[] audio) {
        require(sessionId).accept(FrameCodec.binaryAudio(audio));
    }

    /**
     * Ends the session after its connection closed. No further frames are sent.
     */
    public void disconnect(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session != null) {
            session.end("disconnect");
        }
    }

    public Optional<SessionState> state(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(Session::state);
    }

    public int activeSessions() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${gateway.idle-sweep-ms:5000}")
    public void sweepIdleSessions() {
        Instant now = Instant.now();
        Duration timeout = Duration.ofMillis(properties.getIdleTimeoutMs());
        for (Session session : List.copyOf(sessions.values())) {
            session.expireIfIdle(now, timeout);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (!sessions.isEmpty()) {
            LOG.info("Ending {} active session(s)", sessions.size());
        }
        for (Session session : List.copyOf(sessions.values())) {
            session.end("shutdown");
        }
    }

    private Session require(String sessionId) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionProtocolException(SessionErrorKind.SESSION_NOT_FOUND,
                    "Unknown session: " + sessionId);
        }
        return session;
    }

    private void onSessionEnded(Session session) {
        if (sessions.remove(session.id(), session)) {
            pipelineMetrics.sessionClosed();
        }
    }
}
