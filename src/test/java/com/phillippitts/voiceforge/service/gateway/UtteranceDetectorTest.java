package com.phillippitts.voiceforge.service.gateway;

import com.phillippitts.voiceforge.util.PcmAudio;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UtteranceDetectorTest {

    private static final int RATE = 16_000;

    /** Constant-amplitude PCM16LE audio. */
    static byte[] pcm(int durationMs, int amplitude) {
        byte[] out = new byte[PcmAudio.bytesFor(durationMs, RATE)];
        for (int i = 0; i < out.length; i += 2) {
            out[i] = (byte) (amplitude & 0xFF);
            out[i + 1] = (byte) ((amplitude >> 8) & 0xFF);
        }
        return out;
    }

    private final UtteranceDetector detector = new UtteranceDetector(100, 800, 60, RATE);

    @Test
    void shouldReportBoundaryAfterSpeechAndSilenceGap() {
        assertThat(detector.accept(pcm(200, 3000))).isFalse();
        assertThat(detector.hasSpeech()).isTrue();
        assertThat(detector.speechMs()).isEqualTo(200);

        assertThat(detector.accept(pcm(80, 0))).isFalse();
        assertThat(detector.accept(pcm(20, 0))).isTrue();
        assertThat(detector.boundaryReached()).isTrue();
    }

    @Test
    void shouldIgnoreSilenceWithoutSpeech() {
        assertThat(detector.accept(pcm(2000, 100))).isFalse();
        assertThat(detector.hasSpeech()).isFalse();
    }

    @Test
    void shouldForgetSpeechShorterThanMinimum() {
        detector.accept(pcm(40, 3000));
        assertThat(detector.accept(pcm(100, 0))).isFalse();

        assertThat(detector.hasSpeech()).isFalse();
        assertThat(detector.boundaryReached()).isFalse();
    }

    @Test
    void shouldResetSilenceRunWhenSpeechResumes() {
        detector.accept(pcm(100, 3000));
        detector.accept(pcm(80, 0));
        detector.accept(pcm(40, 3000));

        assertThat(detector.accept(pcm(80, 0))).isFalse();
        assertThat(detector.accept(pcm(20, 0))).isTrue();
    }

    @Test
    void shouldCarryPartialWindowsAcrossChunks() {
        byte[] speech = pcm(100, 3000);
        // Split at an odd offset so no chunk holds a whole number of windows
        detector.accept(Arrays.copyOfRange(speech, 0, 333));
        detector.accept(Arrays.copyOfRange(speech, 333, 1001));
        detector.accept(Arrays.copyOfRange(speech, 1001, speech.length));

        assertThat(detector.speechMs()).isEqualTo(100);
    }

    @Test
    void shouldReportWhereInTheChunkTheBoundaryFell() {
        byte[] speech = pcm(100, 3000);
        byte[] silence = pcm(300, 0);
        byte[] chunk = Arrays.copyOf(speech, speech.length + silence.length);

        assertThat(detector.accept(chunk)).isTrue();

        assertThat(detector.boundaryOffset()).isEqualTo(PcmAudio.bytesFor(200, RATE));
    }

    @Test
    void shouldCountCarriedBytesInBoundaryOffset() {
        detector.accept(pcm(100, 3000));
        detector.accept(pcm(90, 0));

        assertThat(detector.accept(pcm(40, 0))).isTrue();

        assertThat(detector.boundaryOffset()).isEqualTo(PcmAudio.bytesFor(10, RATE));
    }

    @Test
    void shouldStayLatchedUntilReset() {
        detector.accept(pcm(100, 3000));
        detector.accept(pcm(100, 0));

        assertThat(detector.accept(pcm(100, 3000))).isTrue();

        detector.reset();
        assertThat(detector.boundaryReached()).isFalse();
        assertThat(detector.hasSpeech()).isFalse();
        assertThat(detector.accept(pcm(100, 3000))).isFalse();
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new UtteranceDetector(0, 800, 60, RATE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UtteranceDetector(100, 800, 60, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
