package com.phillippitts.voiceforge.util;

/**
 * Helpers for PCM16LE mono audio buffers.
 */
public final class PcmAudio {

    /** 16-bit samples. */
    public static final int BYTES_PER_SAMPLE = 2;

    private PcmAudio() {
        // Utility class
    }

    /**
     * Number of bytes covering {@code durationMs} of audio, aligned to whole samples.
     */
    public static int bytesFor(int durationMs, int sampleRate) {
        int samples = (int) ((long) sampleRate * durationMs / 1000);
        return samples * BYTES_PER_SAMPLE;
    }

    /**
     * Duration in milliseconds of {@code byteCount} bytes of audio.
     */
    public static long millisFor(long byteCount, int sampleRate) {
        if (sampleRate <= 0) {
            return 0;
        }
        return byteCount / BYTES_PER_SAMPLE * 1000 / sampleRate;
    }

    /**
     * RMS amplitude (0-32767) of a window of a PCM16LE buffer.
     *
     * @param pcm    audio buffer
     * @param offset first byte of the window
     * @param length window length in bytes
     */
    public static double rms(byte[] pcm, int offset, int length) {
        long sumSquares = 0;
        int sampleCount = 0;
        int end = Math.min(pcm.length, offset + length);
        for (int i = offset; i + 1 < end; i += BYTES_PER_SAMPLE) {
            int sample = (pcm[i] & 0xFF) | (pcm[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }
        if (sampleCount == 0) {
            return 0;
        }
        return Math.sqrt((double) sumSquares / sampleCount);
    }

    public static double rms(byte[] pcm) {
        return pcm == null ? 0 : rms(pcm, 0, pcm.length);
    }
}
