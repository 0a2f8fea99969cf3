package com.phillippitts.voiceforge.service.gateway.protocol;

import org.json.JSONObject;

import java.util.Base64;
import java.util.Objects;

/**
 * Immutable frame sent to a client. Fields other than {@code type} and {@code eventId} live in
 * a JSON body held as text.
 */
public final class ServerFrame {

    private final ServerFrameType type;
    private final String eventId;
    private final String body;

    private ServerFrame(ServerFrameType type, String eventId, JSONObject body) {
        this.type = Objects.requireNonNull(type, "type");
        this.eventId = eventId;
        this.body = body == null ? "{}" : body.toString();
    }

    public static ServerFrame ready(String sessionId, int contextTurns) {
        return new ServerFrame(ServerFrameType.READY, null,
                new JSONObject().put("sessionId", sessionId).put("contextTurns", contextTurns));
    }

    public static ServerFrame sttPartial(String text) {
        return new ServerFrame(ServerFrameType.STT_PARTIAL, null, new JSONObject().put("text", text));
    }

    public static ServerFrame sttFinal(String text) {
        return new ServerFrame(ServerFrameType.STT_FINAL, null, new JSONObject().put("text", text));
    }

    public static ServerFrame agentThinking() {
        return new ServerFrame(ServerFrameType.AGENT_THINKING, null, null);
    }

    public static ServerFrame agentReply(String text) {
        return new ServerFrame(ServerFrameType.AGENT_REPLY, null, new JSONObject().put("text", text));
    }

    public static ServerFrame ttsChunk(byte[] audio, int seq) {
        return new ServerFrame(ServerFrameType.TTS_CHUNK, null, new JSONObject()
                .put("bytes", Base64.getEncoder().encodeToString(audio))
                .put("seq", seq));
    }

    public static ServerFrame ttsComplete(int chunks) {
        return new ServerFrame(ServerFrameType.TTS_COMPLETE, null, new JSONObject().put("chunks", chunks));
    }

    public static ServerFrame metrics(JSONObject metrics) {
        return new ServerFrame(ServerFrameType.METRICS, null, metrics);
    }

    /**
     * @param kind        error kind name (session or task error kind)
     * @param message     human-readable message
     * @param recoverable false when the session is being closed
     */
    public static ServerFrame error(String kind, String message, boolean recoverable) {
        return new ServerFrame(ServerFrameType.ERROR, null, new JSONObject()
                .put("kind", kind)
                .put("message", message == null ? "" : message)
                .put("recoverable", recoverable));
    }

    public static ServerFrame ended(String reason, JSONObject stats) {
        return new ServerFrame(ServerFrameType.ENDED, null, new JSONObject()
                .put("reason", reason)
                .put("stats", stats == null ? new JSONObject() : stats));
    }

    public ServerFrame withEventId(String id) {
        return new ServerFrame(type, id, body());
    }

    public ServerFrameType type() {
        return type;
    }

    public String eventId() {
        return eventId;
    }

    /** Copy of the frame's fields. */
    public JSONObject body() {
        return new JSONObject(body);
    }

    /** Decoded {@code bytes} of a {@code tts_chunk}, or an empty array. */
    public byte[] audio() {
        String b64 = body().optString("bytes", "");
        return b64.isEmpty() ? new byte[0] : Base64.getDecoder().decode(b64);
    }

    public JSONObject toJson() {
        JSONObject json = body().put("type", type.wireName());
        if (eventId != null) {
            json.put("eventId", eventId);
        }
        return json;
    }

    @Override
    public String toString() {
        return type.wireName() + (eventId == null ? "" : "#" + eventId);
    }
}
