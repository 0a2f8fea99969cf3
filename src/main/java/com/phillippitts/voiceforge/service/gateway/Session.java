package com.phillippitts.voiceforge.service.gateway;

import com.phillippitts.voiceforge.config.properties.GatewayProperties;
import com.phillippitts.voiceforge.domain.PipelineStage;
import com.phillippitts.voiceforge.domain.StageResult;
import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.domain.TaskErrorKind;
import com.phillippitts.voiceforge.domain.TaskPriority;
import com.phillippitts.voiceforge.domain.TaskResult;
import com.phillippitts.voiceforge.domain.TurnOutcome;
import com.phillippitts.voiceforge.domain.TurnRecord;
import com.phillippitts.voiceforge.exception.SessionErrorKind;
import com.phillippitts.voiceforge.exception.TaskFailedException;
import com.phillippitts.voiceforge.exception.UnknownTaskTypeException;
import com.phillippitts.voiceforge.service.gateway.context.ContextStore;
import com.phillippitts.voiceforge.service.gateway.context.ConversationContext;
import com.phillippitts.voiceforge.service.gateway.protocol.ClientFrame;
import com.phillippitts.voiceforge.service.gateway.protocol.ServerFrame;
import com.phillippitts.voiceforge.service.metrics.PipelineMetrics;
import com.phillippitts.voiceforge.service.metrics.TurnMetricsAggregator;
import com.phillippitts.voiceforge.service.pool.PoolStatus;
import com.phillippitts.voiceforge.service.pool.TaskRouter;
import com.phillippitts.voiceforge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Base64;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * One client conversation: the turn pipeline state machine.
 *
 * <p>Every state change runs on the session's {@link Mailbox}. Client frames, pool results and
 * streamed chunks are all posted there, so handlers below never race each other. Pool callbacks
 * carry the turn number and task id they were issued for; a callback that no longer matches the
 * outstanding stage (the turn was interrupted or failed) is dropped.
 *
 * <p>A turn runs TRANSCRIBING → GENERATING → SPEAKING. Text sessions skip TRANSCRIBING and
 * sessions with TTS disabled end the turn at the reply. Audio that arrives while a turn is in
 * flight keeps being segmented; each complete utterance is queued and becomes its own turn, in
 * arrival order, once the current turn ends. A session is never expired for idleness while a
 * turn is in flight.
 */
final class Session {

    private static final Logger LOG = LogManager.getLogger(Session.class);

    static final int MAX_PENDING_UTTERANCES = 4;
    static final String INVALID_AUDIO_MESSAGE = "invalid audio in synthesis output";

    private final String id;
    private final FrameSink sink;
    private final TaskRouter router;
    private final ContextStore contextStore;
    private final GatewayProperties properties;
    private final TurnMetricsAggregator aggregator;
    private final PipelineMetrics pipelineMetrics;
    private final Consumer<Session> onEnded;
    private final Mailbox mailbox;
    private final Instant openedAt = Instant.now();

    private volatile Instant lastActivity = openedAt;
    private volatile SessionState state = SessionState.INITIALIZING;

    private SessionConfig config;
    private ConversationContext context;
    private UtteranceDetector detector;
    private final ByteArrayOutputStream audioBuffer = new ByteArrayOutputStream();
    private final Deque<byte[]> pendingUtterances = new ArrayDeque<>();
    private long lastSeq = -1;
    private int turnCounter;
    private TurnState turn;

    private int turnsCompleted;
    private int turnsFailed;
    private int turnsCancelled;
    private long audioBytesReceived;
    private long audioBytesDropped;

    Session(String id, FrameSink sink, TaskRouter router, ContextStore contextStore,
            GatewayProperties properties, TurnMetricsAggregator aggregator,
            PipelineMetrics pipelineMetrics, Executor executor, Consumer<Session> onEnded) {
        this.id = id;
        this.sink = sink;
        this.router = router;
        this.contextStore = contextStore;
        this.properties = properties;
        this.aggregator = aggregator;
        this.pipelineMetrics = pipelineMetrics;
        this.onEnded = onEnded;
        this.mailbox = new Mailbox(id, executor);
    }

    String id() {
        return id;
    }

    SessionState state() {
        return state;
    }

    Instant lastActivity() {
        return lastActivity;
    }

    // ---- entry points: post onto the mailbox ----

    void accept(ClientFrame frame) {
        lastActivity = Instant.now();
        mailbox.execute(() -> onFrame(frame));
    }

    void reject(SessionErrorKind kind, String message) {
        lastActivity = Instant.now();
        mailbox.execute(() -> {
            if (state != SessionState.ENDED) {
                sink.send(ServerFrame.error(kind.name(), message, true));
            }
        });
    }

    void end(String reason) {
        mailbox.execute(() -> terminate(reason));
    }

    void expireIfIdle(Instant now, Duration idleTimeout) {
        if (Duration.between(lastActivity, now).compareTo(idleTimeout) >= 0) {
            mailbox.execute(() -> {
                if (state.isTurnInFlight()) {
                    LOG.debug("Session {} idle for {}ms but turn {} is in flight", id,
                            idleTimeout.toMillis(), turnCounter);
                    return;
                }
                if (Duration.between(lastActivity, Instant.now()).compareTo(idleTimeout) >= 0) {
                    LOG.info("Session {} idle for {}ms, ending", id, idleTimeout.toMillis());
                    terminate("idle");
                }
            });
        }
    }

    // ---- client frames ----

    private void onFrame(ClientFrame frame) {
        if (state == SessionState.ENDED) {
            LOG.debug("Dropping {} frame for ended session {}", frame.type().wireName(), id);
            return;
        }
        if (state == SessionState.INITIALIZING) {
            switch (frame.type()) {
                case INIT -> onInit(frame);
                case END -> terminate("client");
                default -> reply(frame, ServerFrame.error(SessionErrorKind.SESSION_NOT_FOUND.name(),
                        "Session not initialized; send init first", true));
            }
            return;
        }
        switch (frame.type()) {
            case INIT -> {
                LOG.warn("Session {} received a second init, closing", id);
                reply(frame, ServerFrame.error(SessionErrorKind.INVALID_STATE.name(),
                        "Session already initialized", false));
                terminate("protocol_violation");
            }
            case AUDIO_CHUNK -> onAudio(frame.bytes(), frame.seq());
            case TEXT_INPUT -> onTextInput(frame);
            case PAUSE -> onPause(frame);
            case RESUME -> onResume(frame);
            case END -> terminate("client");
            case QUALITY_FEEDBACK -> onQualityFeedback(frame.score());
        }
    }

    private void onInit(ClientFrame frame) {
        GatewayProperties.Utterance u = properties.getUtterance();
        try {
            config = SessionConfig.fromJson(frame.configJson(), u.getSampleRate());
        } catch (IllegalArgumentException e) {
            reply(frame, ServerFrame.error(SessionErrorKind.INVALID_FRAME.name(), e.getMessage(), true));
            return;
        }
        int maxTurns = properties.getContextMaxTurns();
        context = config.conversationId() == null
                ? new ConversationContext(maxTurns)
                : contextStore.load(config.conversationId())
                        .map(history -> ConversationContext.restore(maxTurns, history))
                        .orElseGet(() -> new ConversationContext(maxTurns));
        detector = new UtteranceDetector(u.getSilenceGapMs(), u.getEnergyThreshold(),
                u.getMinSpeechMs(), config.sampleRate());
        state = SessionState.LISTENING;
        LOG.info("Session {} ready (conversation={}, tts={}, contextTurns={})",
                id, config.conversationId(), config.ttsEnabled(), context.size());
        reply(frame, ServerFrame.ready(id, context.size()));
    }

    private void onAudio(byte[] bytes, long seq) {
        if (bytes == null || bytes.length == 0) {
            return;
        }
        if (seq >= 0) {
            if (lastSeq >= 0 && seq != lastSeq + 1) {
                LOG.debug("Session {} audio seq {} after {}, accepting out of order", id, seq, lastSeq);
            }
            lastSeq = Math.max(lastSeq, seq);
        }
        if (state == SessionState.PAUSED) {
            audioBytesDropped += bytes.length;
            return;
        }
        audioBytesReceived += bytes.length;
        byte[] rest = bytes;
        while (rest.length > 0) {
            if (audioBuffer.size() + rest.length > properties.getMaxUtteranceBytes()) {
                if (detector.hasSpeech()) {
                    LOG.info("Session {} utterance reached {} bytes, cutting it", id, audioBuffer.size());
                    completeUtterance();
                } else {
                    audioBuffer.reset();
                    detector.reset();
                }
            }
            if (!detector.accept(rest)) {
                audioBuffer.write(rest, 0, rest.length);
                return;
            }
            int cut = detector.boundaryOffset();
            audioBuffer.write(rest, 0, cut);
            completeUtterance();
            rest = Arrays.copyOfRange(rest, cut, rest.length);
        }
    }

    private void completeUtterance() {
        byte[] audio = audioBuffer.toByteArray();
        audioBuffer.reset();
        detector.reset();
        if (state == SessionState.LISTENING) {
            startAudioTurn(audio);
        } else if (pendingUtterances.size() < MAX_PENDING_UTTERANCES) {
            pendingUtterances.add(audio);
            LOG.debug("Session {} queued utterance of {} bytes behind turn {} ({} waiting)",
                    id, audio.length, turnCounter, pendingUtterances.size());
        } else {
            audioBytesDropped += audio.length;
            LOG.warn("Session {} already has {} utterances waiting, dropping {} bytes",
                    id, pendingUtterances.size(), audio.length);
        }
    }

    private void onTextInput(ClientFrame frame) {
        if (state != SessionState.LISTENING) {
            reply(frame, ServerFrame.error(SessionErrorKind.INVALID_STATE.name(),
                    "text_input not accepted while " + state, true));
            return;
        }
        String text = frame.text().trim();
        turn = new TurnState(++turnCounter, Instant.now());
        LOG.debug("Session {} turn {} text input: {}", id, turn.number(), LogSanitizer.preview(text));
        sink.send(ServerFrame.sttFinal(text));
        continueWithTranscript(text);
    }

    private void onPause(ClientFrame frame) {
        if (state.isTurnInFlight()) {
            interruptTurn();
            return;
        }
        if (state == SessionState.LISTENING) {
            audioBuffer.reset();
            detector.reset();
            pendingUtterances.clear();
            state = SessionState.PAUSED;
            LOG.debug("Session {} paused", id);
            return;
        }
        reply(frame, ServerFrame.error(SessionErrorKind.INVALID_STATE.name(), "Session already paused", true));
    }

    private void onResume(ClientFrame frame) {
        if (state != SessionState.PAUSED) {
            reply(frame, ServerFrame.error(SessionErrorKind.INVALID_STATE.name(),
                    "resume requires a paused session, state is " + state, true));
            return;
        }
        state = SessionState.LISTENING;
        LOG.debug("Session {} resumed", id);
    }

    private void onQualityFeedback(Double score) {
        pipelineMetrics.recordQualityFeedback(score);
        LOG.info("Session {} quality feedback: {} (turn {})", id, score, turnCounter);
    }

    // ---- pipeline ----

    private void startAudioTurn(byte[] audio) {
        turn = new TurnState(++turnCounter, Instant.now());
        LOG.debug("Session {} turn {} utterance of {} bytes", id, turn.number(), audio.length);
        JSONObject payload = new JSONObject()
                .put("audio", Base64.getEncoder().encodeToString(audio))
                .put("sampleRate", config.sampleRate());
        if (config.language() != null) {
            payload.put("language", config.language());
        }
        submitStage(PipelineStage.TRANSCRIBE, payload);
    }

    private void continueWithTranscript(String transcript) {
        context.addUser(transcript);
        sink.send(ServerFrame.agentThinking());
        JSONObject payload = new JSONObject()
                .put("text", transcript)
                .put("context", context.toJson());
        if (config.systemPrompt() != null) {
            payload.put("systemPrompt", config.systemPrompt());
        }
        submitStage(PipelineStage.GENERATE, payload);
    }

    private void submitStage(PipelineStage stage, JSONObject payload) {
        Task task = Task.of(stage.taskType(), payload, TaskPriority.INTERACTIVE)
                .withDeadline(Duration.ofMillis(properties.getStageDeadlineMs()));
        int turnNumber = turn.number();
        turn.begin(stage, task.id());
        state = SessionState.forStage(stage);

        CompletableFuture<TaskResult> future;
        try {
            future = router.route(task, (taskId, chunk) ->
                    mailbox.execute(() -> onChunk(turnNumber, taskId, chunk)));
        } catch (UnknownTaskTypeException e) {
            failStage(TaskErrorKind.UNKNOWN_TASK_TYPE, e.getMessage());
            return;
        }
        future.whenComplete((result, error) ->
                mailbox.execute(() -> onStageComplete(turnNumber, task.id(), result, error)));
    }

    private void onChunk(int turnNumber, String taskId, JSONObject chunk) {
        if (turn == null || !turn.isCurrent(turnNumber, taskId)) {
            return;
        }
        switch (turn.stage()) {
            case TRANSCRIBE -> {
                String partial = chunk.optString("text", "");
                if (!partial.isEmpty()) {
                    sink.send(ServerFrame.sttPartial(partial));
                }
            }
            case SYNTHESIZE -> {
                String b64 = chunk.optString("audio", "");
                if (!b64.isEmpty()) {
                    byte[] audio = decodeSynthesisAudio(b64);
                    if (audio != null) {
                        sendAudio(audio);
                    }
                }
            }
            case GENERATE -> LOG.trace("Session {} ignoring generate chunk", id);
        }
    }

    private void onStageComplete(int turnNumber, String taskId, TaskResult result, Throwable error) {
        if (turn == null || !turn.isCurrent(turnNumber, taskId)) {
            LOG.debug("Session {} discarding stale result of task {} (turn {})", id, taskId, turnNumber);
            return;
        }
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof TaskFailedException tfe) {
                failStage(tfe.getKind(), tfe.getMessage());
            } else {
                LOG.error("Session {} stage {} failed unexpectedly", id, turn.stage(), cause);
                failStage(TaskErrorKind.TASK_FAILED, String.valueOf(cause.getMessage()));
            }
            return;
        }
        if (!result.ok()) {
            failStage(result.error().kind(), result.error().message());
            return;
        }
        JSONObject output = result.resultJson();
        switch (turn.stage()) {
            case TRANSCRIBE -> onTranscript(output.optString("text", "").trim());
            case GENERATE -> onReply(output.optString("text", ""));
            case SYNTHESIZE -> onSynthesized(output);
        }
    }

    private void onTranscript(String transcript) {
        recordStage(turn.complete(transcript));
        sink.send(ServerFrame.sttFinal(transcript));
        if (transcript.isEmpty()) {
            LOG.debug("Session {} turn {} produced an empty transcript", id, turn.number());
            finishTurn(TurnOutcome.COMPLETED, false);
            return;
        }
        continueWithTranscript(transcript);
    }

    private void onReply(String reply) {
        recordStage(turn.complete(reply));
        context.addAssistant(reply);
        sink.send(ServerFrame.agentReply(reply));
        LOG.debug("Session {} turn {} reply: {}", id, turn.number(), LogSanitizer.preview(reply));
        if (!config.ttsEnabled()) {
            turn.markFirstOutput();
            finishTurn(TurnOutcome.COMPLETED, true);
            return;
        }
        JSONObject payload = new JSONObject()
                .put("text", reply)
                .put("sampleRate", config.sampleRate());
        if (config.voice() != null) {
            payload.put("voice", config.voice());
        }
        submitStage(PipelineStage.SYNTHESIZE, payload);
    }

    private void onSynthesized(JSONObject output) {
        if (!turn.audioStreamed()) {
            String b64 = output.optString("audio", "");
            byte[] audio = b64.isEmpty() ? new byte[0] : decodeSynthesisAudio(b64);
            if (audio == null) {
                return;
            }
            int size = properties.getTtsChunkBytes();
            for (int off = 0; off < audio.length; off += size) {
                sendAudio(Arrays.copyOfRange(audio, off, Math.min(audio.length, off + size)));
            }
        }
        int chunks = turn.audioChunks();
        recordStage(turn.complete(chunks + " chunks"));
        sink.send(ServerFrame.ttsComplete(chunks));
        finishTurn(TurnOutcome.COMPLETED, true);
    }

    /** Decodes synthesized audio, failing the turn and returning null when it is not base64. */
    private byte[] decodeSynthesisAudio(String b64) {
        try {
            return Base64.getDecoder().decode(b64);
        } catch (IllegalArgumentException e) {
            LOG.warn("Session {} turn {} received undecodable synthesis audio: {}", id, turn.number(), e.getMessage());
            failStage(TaskErrorKind.TASK_FAILED, INVALID_AUDIO_MESSAGE);
            return null;
        }
    }

    private void sendAudio(byte[] audio) {
        turn.markFirstOutput();
        sink.send(ServerFrame.ttsChunk(audio, turn.nextAudioSeq()));
    }

    private void failStage(TaskErrorKind kind, String message) {
        PipelineStage stage = turn.stage();
        turn.fail(kind);
        pipelineMetrics.incrementStageFailure(stage, kind);
        LOG.warn("Session {} turn {} stage {} failed: {} {}", id, turn.number(), stage.metricName(), kind, message);
        sink.send(ServerFrame.error(kind.name(), message, true));
        finishTurn(TurnOutcome.FAILED, false);
    }

    private void interruptTurn() {
        PipelineStage stage = turn.stage();
        String taskId = turn.taskId();
        router.cancel(stage.taskType(), taskId).whenComplete((removed, error) -> {
            if (error != null) {
                LOG.debug("Cancel of task {} failed: {}", taskId, error.getMessage());
            } else {
                LOG.debug("Cancel of task {}: {}", taskId, removed ? "removed from queue" : "result discarded");
            }
        });
        turn.fail(TaskErrorKind.CANCELLED);
        LOG.info("Session {} turn {} interrupted during {}", id, turn.number(), stage.metricName());
        audioBuffer.reset();
        detector.reset();
        pendingUtterances.clear();
        finishTurn(TurnOutcome.CANCELLED, false);
    }

    private void recordStage(StageResult result) {
        pipelineMetrics.recordStageLatency(result.stage(), result.duration());
    }

    private void finishTurn(TurnOutcome outcome, boolean sendMetrics) {
        TurnState done = turn;
        turn = null;
        long endToEnd = done.endToEndMs();
        TurnRecord record = new TurnRecord(id, done.number(), Instant.now(), done.stages(), endToEnd, outcome);
        aggregator.record(record);
        pipelineMetrics.incrementTurn(outcome);
        if (endToEnd >= 0) {
            pipelineMetrics.recordEndToEnd(Duration.ofMillis(endToEnd));
        }
        switch (outcome) {
            case COMPLETED -> turnsCompleted++;
            case FAILED -> turnsFailed++;
            case CANCELLED -> turnsCancelled++;
        }
        if (sendMetrics) {
            sink.send(ServerFrame.metrics(turnMetrics(record)));
        }
        if (state == SessionState.ENDED) {
            return;
        }
        state = SessionState.LISTENING;
        byte[] next = pendingUtterances.poll();
        if (next != null) {
            startAudioTurn(next);
        }
    }

    private JSONObject turnMetrics(TurnRecord record) {
        Map<PipelineStage, Long> stageMs = record.stageMillis();
        int queueDepth = router.describe().values().stream().mapToInt(PoolStatus::queueDepth).sum();
        return new JSONObject()
                .put("turn", record.turn())
                .put("sttLatency", stageMs.getOrDefault(PipelineStage.TRANSCRIBE, -1L))
                .put("agentLatency", stageMs.getOrDefault(PipelineStage.GENERATE, -1L))
                .put("ttsLatency", stageMs.getOrDefault(PipelineStage.SYNTHESIZE, -1L))
                .put("endToEndLatency", record.endToEndMs())
                .put("activeConnections", pipelineMetrics.activeSessions())
                .put("queueDepth", queueDepth);
    }

    // ---- teardown ----

    private void terminate(String reason) {
        if (state == SessionState.ENDED) {
            return;
        }
        boolean inFlight = turn != null && turn.taskId() != null;
        state = SessionState.ENDED;
        if (inFlight) {
            router.cancel(turn.stage().taskType(), turn.taskId());
            turn.fail(TaskErrorKind.CANCELLED);
            finishTurn(TurnOutcome.CANCELLED, false);
        }
        if (config != null && config.conversationId() != null) {
            contextStore.save(config.conversationId(), context.turns());
        }
        JSONObject stats = stats();
        LOG.info("Session {} ended ({}): {}", id, reason, stats);
        if (!"disconnect".equals(reason)) {
            sink.send(ServerFrame.ended(reason, stats));
            sink.close(reason);
        }
        onEnded.accept(this);
    }

    private JSONObject stats() {
        return new JSONObject()
                .put("turns", turnCounter)
                .put("completed", turnsCompleted)
                .put("failed", turnsFailed)
                .put("cancelled", turnsCancelled)
                .put("audioBytes", audioBytesReceived)
                .put("audioBytesDropped", audioBytesDropped)
                .put("durationMs", Duration.between(openedAt, Instant.now()).toMillis());
    }

    private void reply(ClientFrame request, ServerFrame frame) {
        sink.send(request.eventId() == null ? frame : frame.withEventId(request.eventId()));
    }
}
