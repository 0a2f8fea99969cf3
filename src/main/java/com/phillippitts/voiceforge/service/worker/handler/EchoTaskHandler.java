package com.phillippitts.voiceforge.service.worker.handler;

import com.phillippitts.voiceforge.domain.Task;
import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.service.worker.ChunkEmitter;
import com.phillippitts.voiceforge.service.worker.TaskHandler;
import com.phillippitts.voiceforge.util.PcmAudio;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Deterministic stand-in backend for local runs and integration tests.
 *
 * <ul>
 *   <li>{@code transcribe}: returns the {@code text} hint when present (streaming word-by-word
 *       partials), otherwise a placeholder describing the audio length</li>
 *   <li>{@code generate-reply}: echoes the user text</li>
 *   <li>{@code synthesize}: streams a sine tone whose length grows with the text</li>
 *   <li>{@code clone-voice}: returns a stable voice id derived from the sample</li>
 *   <li>{@code detect-voice-activity}: RMS energy against a threshold</li>
 * </ul>
 *
 * <p>A payload field {@code delayMs} makes any task sleep first, which tests use to simulate
 * slow inference; {@code fail:true} makes it throw.
 */
public class EchoTaskHandler implements TaskHandler {

    static final int SAMPLE_RATE = 16_000;
    static final int CHUNK_BYTES = PcmAudio.bytesFor(100, SAMPLE_RATE);
    static final int MS_PER_CHAR = 40;
    static final int MAX_SPEECH_MS = 5_000;
    static final double DEFAULT_VAD_THRESHOLD = 800;

    @Override
    public JSONObject handle(TaskType type, JSONObject payload, ChunkEmitter chunks) throws Exception {
        long delayMs = payload.optLong("delayMs", 0);
        if (delayMs > 0) {
            Thread.sleep(delayMs);
        }
        if (payload.optBoolean("fail", false)) {
            throw new IllegalStateException(payload.optString("failMessage", "simulated failure"));
        }
        return switch (type) {
            case TRANSCRIBE -> transcribe(payload, chunks);
            case GENERATE_REPLY -> generateReply(payload);
            case SYNTHESIZE -> synthesize(payload, chunks);
            case CLONE_VOICE -> cloneVoice(payload);
            case DETECT_VOICE_ACTIVITY -> detectVoiceActivity(payload);
        };
    }

    private JSONObject transcribe(JSONObject payload, ChunkEmitter chunks) {
        String hint = payload.optString("text", "").trim();
        if (hint.isEmpty()) {
            byte[] audio = decodeAudio(payload);
            long ms = PcmAudio.millisFor(audio.length, payload.optInt("sampleRate", SAMPLE_RATE));
            return new JSONObject().put("text", "[" + audio.length + " bytes, " + ms + " ms of audio]");
        }
        String[] words = hint.split("\\s+");
        StringBuilder partial = new StringBuilder();
        for (int i = 0; i < words.length - 1; i++) {
            if (partial.length() > 0) {
                partial.append(' ');
            }
            partial.append(words[i]);
            chunks.emit(new JSONObject().put("text", partial.toString()));
        }
        return new JSONObject().put("text", hint);
    }

    private JSONObject generateReply(JSONObject payload) {
        String text = payload.optString("text", "");
        JSONArray context = payload.optJSONArray("context");
        int turns = context == null ? 0 : context.length();
        return new JSONObject()
                .put("text", "I received: " + text)
                .put("contextTurns", turns);
    }

    private JSONObject synthesize(JSONObject payload, ChunkEmitter chunks) {
        String text = payload.optString("text", "");
        int durationMs = Math.min(MAX_SPEECH_MS, Math.max(MS_PER_CHAR, text.length() * MS_PER_CHAR));
        byte[] pcm = tone(durationMs, 440.0);
        int sequence = 0;
        for (int off = 0; off < pcm.length; off += CHUNK_BYTES) {
            byte[] frame = Arrays.copyOfRange(pcm, off, Math.min(pcm.length, off + CHUNK_BYTES));
            chunks.emit(new JSONObject()
                    .put("audio", Base64.getEncoder().encodeToString(frame))
                    .put("sequence", sequence++));
        }
        return new JSONObject()
                .put("sampleRate", SAMPLE_RATE)
                .put("bytes", pcm.length)
                .put("chunks", sequence)
                .put("durationMs", durationMs);
    }

    private JSONObject cloneVoice(JSONObject payload) throws NoSuchAlgorithmException {
        byte[] sample = decodeAudio(payload);
        if (sample.length == 0) {
            throw new IllegalArgumentException("clone-voice requires a non-empty audio sample");
        }
        String name = payload.optString("name", "voice");
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        digest.update(name.getBytes(StandardCharsets.UTF_8));
        digest.update(sample);
        String id = HexFormat.of().formatHex(digest.digest(), 0, 8);
        return new JSONObject()
                .put("voiceId", "voice-" + id)
                .put("name", name)
                .put("sampleBytes", sample.length);
    }

    private JSONObject detectVoiceActivity(JSONObject payload) {
        byte[] audio = decodeAudio(payload);
        double threshold = payload.optDouble("threshold", DEFAULT_VAD_THRESHOLD);
        double rms = PcmAudio.rms(audio);
        return new JSONObject()
                .put("speech", rms >= threshold)
                .put("rms", Math.round(rms * 10) / 10.0);
    }

    private static byte[] decodeAudio(JSONObject payload) {
        String b64 = payload.optString("audio", payload.optString(Task.BYTES_FIELD, ""));
        return b64.isEmpty() ? new byte[0] : Base64.getDecoder().decode(b64);
    }

    static byte[] tone(int durationMs, double frequency) {
        int samples = SAMPLE_RATE * durationMs / 1000;
        byte[] pcm = new byte[samples * PcmAudio.BYTES_PER_SAMPLE];
        for (int i = 0; i < samples; i++) {
            short value = (short) (Math.sin(2 * Math.PI * frequency * i / SAMPLE_RATE) * 8000);
            pcm[2 * i] = (byte) (value & 0xFF);
            pcm[2 * i + 1] = (byte) ((value >> 8) & 0xFF);
        }
        return pcm;
    }
}
