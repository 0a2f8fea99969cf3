package com.phillippitts.voiceforge.service.gateway.protocol;

import com.phillippitts.voiceforge.exception.SessionErrorKind;
import com.phillippitts.voiceforge.exception.SessionProtocolException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Base64;

/**
 * JSON text codec for session frames. Audio travels base64-encoded under {@code bytes}.
 */
public final class FrameCodec {

    private FrameCodec() {}

    /**
     * Decodes one client text frame.
     *
     * @throws SessionProtocolException with {@link SessionErrorKind#INVALID_FRAME} if the frame is
     *                                  not a JSON object, has an unknown type or malformed fields
     */
    public static ClientFrame decode(String text) {
        if (text == null || text.isBlank()) {
            throw invalid("Empty frame", null);
        }
        JSONObject json;
        try {
            json = new JSONObject(text);
        } catch (JSONException e) {
            throw invalid("Frame is not a JSON object", e);
        }
        String typeName = json.optString("type", "");
        ClientFrameType type = ClientFrameType.fromWire(typeName)
                .orElseThrow(() -> invalid("Unknown frame type: '" + typeName + "'", null));
        String eventId = json.has("eventId") && !json.isNull("eventId") ? String.valueOf(json.get("eventId")) : null;

        ClientFrame frame = switch (type) {
            case INIT -> {
                JSONObject config = json.optJSONObject("config");
                yield ClientFrame.init(config == null ? new JSONObject() : config);
            }
            case AUDIO_CHUNK -> ClientFrame.audio(decodeBytes(json), json.optLong("seq", -1));
            case TEXT_INPUT -> {
                String t = json.optString("text", null);
                if (t == null || t.isBlank()) {
                    throw invalid("text_input requires non-blank text", null);
                }
                yield ClientFrame.text(t);
            }
            case QUALITY_FEEDBACK -> {
                double score = json.optDouble("score", Double.NaN);
                if (Double.isNaN(score)) {
                    throw invalid("quality_feedback requires a numeric score", null);
                }
                yield ClientFrame.feedback(score);
            }
            default -> ClientFrame.of(type);
        };
        return frame.withEventId(eventId);
    }

    /**
     * Wraps a binary transport message as an {@code audio_chunk} without sequence number.
     */
    public static ClientFrame binaryAudio(byte[] bytes) {
        return ClientFrame.audio(bytes, -1);
    }

    public static String encode(ServerFrame frame) {
        return frame.toJson().toString();
    }

    private static byte[] decodeBytes(JSONObject json) {
        String b64 = json.optString("bytes", null);
        if (b64 == null) {
            // Some clients send the field as "chunk"
            b64 = json.optString("chunk", null);
        }
        if (b64 == null) {
            throw invalid("audio_chunk requires base64 bytes", null);
        }
        try {
            return Base64.getDecoder().decode(b64);
        } catch (IllegalArgumentException e) {
            throw invalid("audio_chunk bytes are not valid base64", e);
        }
    }

    private static SessionProtocolException invalid(String message, Throwable cause) {
        return cause == null
                ? new SessionProtocolException(SessionErrorKind.INVALID_FRAME, message)
                : new SessionProtocolException(SessionErrorKind.INVALID_FRAME, message, cause);
    }
}
