package com.phillippitts.voiceforge.service.worker.handler;

import com.phillippitts.voiceforge.domain.TaskType;
import com.phillippitts.voiceforge.util.PcmAudio;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EchoTaskHandlerTest {

    private final EchoTaskHandler handler = new EchoTaskHandler();
    private final List<JSONObject> chunks = new ArrayList<>();

    private JSONObject handle(TaskType type, JSONObject payload) throws Exception {
        return handler.handle(type, payload, chunks::add);
    }

    @Test
    void shouldDescribeAudioLengthWhenNoTranscriptHintIsGiven() throws Exception {
        byte[] oneSecond = new byte[PcmAudio.bytesFor(1000, 16_000)];
        JSONObject payload = new JSONObject()
                .put("audio", Base64.getEncoder().encodeToString(oneSecond))
                .put("sampleRate", 16_000);

        JSONObject result = handle(TaskType.TRANSCRIBE, payload);

        assertThat(result.getString("text")).isEqualTo("[32000 bytes, 1000 ms of audio]");
        assertThat(chunks).isEmpty();
    }

    @Test
    void shouldCountContextTurnsInReply() throws Exception {
        JSONArray context = new JSONArray()
                .put(new JSONObject().put("role", "user").put("text", "hi"))
                .put(new JSONObject().put("role", "assistant").put("text", "hello"));

        JSONObject result = handle(TaskType.GENERATE_REPLY, new JSONObject().put("text", "again").put("context", context));

        assertThat(result.getString("text")).isEqualTo("I received: again");
        assertThat(result.getInt("contextTurns")).isEqualTo(2);
    }

    @Test
    void shouldStreamSynthesizedAudioInSequencedChunks() throws Exception {
        JSONObject result = handle(TaskType.SYNTHESIZE, new JSONObject().put("text", "hello there"));

        assertThat(result.getInt("chunks")).isEqualTo(chunks.size()).isPositive();
        int total = 0;
        for (int i = 0; i < chunks.size(); i++) {
            assertThat(chunks.get(i).getInt("sequence")).isEqualTo(i);
            total += Base64.getDecoder().decode(chunks.get(i).getString("audio")).length;
        }
        assertThat(total).isEqualTo(result.getInt("bytes"));
        assertThat(result.getInt("durationMs")).isEqualTo(11 * EchoTaskHandler.MS_PER_CHAR);
    }

    @Test
    void shouldDeriveStableVoiceIdFromSample() throws Exception {
        JSONObject payload = new JSONObject()
                .put("audio", Base64.getEncoder().encodeToString(new byte[] {1, 2, 3, 4}))
                .put("name", "narrator");

        String first = handle(TaskType.CLONE_VOICE, payload).getString("voiceId");
        String second = handle(TaskType.CLONE_VOICE, payload).getString("voiceId");

        assertThat(first).startsWith("voice-").isEqualTo(second);
    }

    @Test
    void shouldRejectEmptyCloneSample() {
        assertThatThrownBy(() -> handle(TaskType.CLONE_VOICE, new JSONObject()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDetectSpeechByEnergy() throws Exception {
        byte[] tone = EchoTaskHandler.tone(100, 440.0);
        byte[] silence = new byte[tone.length];

        JSONObject loud = handle(TaskType.DETECT_VOICE_ACTIVITY,
                new JSONObject().put("audio", Base64.getEncoder().encodeToString(tone)));
        JSONObject quiet = handle(TaskType.DETECT_VOICE_ACTIVITY,
                new JSONObject().put("audio", Base64.getEncoder().encodeToString(silence)));

        assertThat(loud.getBoolean("speech")).isTrue();
        assertThat(quiet.getBoolean("speech")).isFalse();
        assertThat(quiet.getDouble("rms")).isZero();
    }

    @Test
    void shouldFailOnRequest() {
        JSONObject payload = new JSONObject().put("fail", true).put("failMessage", "simulated outage");

        assertThatThrownBy(() -> handle(TaskType.GENERATE_REPLY, payload))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("simulated outage");
    }
}
