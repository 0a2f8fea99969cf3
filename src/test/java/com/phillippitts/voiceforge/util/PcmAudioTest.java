package com.phillippitts.voiceforge.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PcmAudioTest {

    @Test
    void shouldConvertBetweenDurationAndBytes() {
        assertThat(PcmAudio.bytesFor(1000, 16_000)).isEqualTo(32_000);
        assertThat(PcmAudio.bytesFor(20, 16_000)).isEqualTo(640);
        assertThat(PcmAudio.millisFor(32_000, 16_000)).isEqualTo(1000);
        assertThat(PcmAudio.millisFor(32_000, 0)).isZero();
    }

    @Test
    void shouldComputeRmsOfConstantSignal() {
        byte[] pcm = new byte[8];
        for (int i = 0; i < pcm.length; i += 2) {
            pcm[i] = (byte) 0xE8; // 1000 little-endian
            pcm[i + 1] = (byte) 0x03;
        }

        assertThat(PcmAudio.rms(pcm)).isCloseTo(1000.0, within(0.001));
    }

    @Test
    void shouldTreatNegativeSamplesBySign() {
        byte[] pcm = {(byte) 0x18, (byte) 0xFC, (byte) 0xE8, (byte) 0x03}; // -1000, 1000

        assertThat(PcmAudio.rms(pcm)).isCloseTo(1000.0, within(0.001));
    }

    @Test
    void shouldReturnZeroForEmptyOrNullBuffers() {
        assertThat(PcmAudio.rms(null)).isZero();
        assertThat(PcmAudio.rms(new byte[0])).isZero();
        assertThat(PcmAudio.rms(new byte[] {5})).isZero();
    }
}
