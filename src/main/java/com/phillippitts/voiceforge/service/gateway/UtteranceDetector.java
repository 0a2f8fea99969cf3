package com.phillippitts.voiceforge.service.gateway;

import com.phillippitts.voiceforge.util.PcmAudio;

/**
 * Detects the end of an utterance in streamed PCM16LE mono audio.
 *
 * <p>Audio is analysed in 20 ms windows by RMS amplitude. A window at or above the energy
 * threshold counts as speech. Once at least {@code minSpeechMs} of speech has been seen, a run of
 * {@code silenceGapMs} of silence marks a boundary. Speech shorter than {@code minSpeechMs}
 * followed by a full gap is treated as noise and forgotten.
 *
 * <p>Bytes that do not fill a whole window are carried over to the next chunk. Not
 * thread-safe; confined to its session's mailbox.
 */
public final class UtteranceDetector {

    static final int WINDOW_MS = 20;

    private final int silenceGapMs;
    private final int energyThreshold;
    private final int minSpeechMs;
    private final int windowBytes;

    private final byte[] carry;
    private int carryLength;
    private int speechMs;
    private int trailingSilenceMs;
    private boolean boundary;
    private int boundaryOffset;

    public UtteranceDetector(int silenceGapMs, int energyThreshold, int minSpeechMs, int sampleRate) {
        if (silenceGapMs <= 0 || energyThreshold <= 0 || minSpeechMs < 0 || sampleRate <= 0) {
            throw new IllegalArgumentException("Invalid utterance detector settings");
        }
        this.silenceGapMs = silenceGapMs;
        this.energyThreshold = energyThreshold;
        this.minSpeechMs = minSpeechMs;
        this.windowBytes = PcmAudio.bytesFor(WINDOW_MS, sampleRate);
        this.carry = new byte[windowBytes];
    }

    /**
     * Feeds a chunk of audio.
     *
     * @return true once a boundary has been reached (stays true until {@link #reset()})
     */
    public boolean accept(byte[] chunk) {
        if (chunk == null || boundary) {
            return boundary;
        }
        int pos = 0;
        if (carryLength > 0) {
            int take = Math.min(windowBytes - carryLength, chunk.length);
            System.arraycopy(chunk, 0, carry, carryLength, take);
            carryLength += take;
            pos = take;
            if (carryLength < windowBytes) {
                return false;
            }
            analyse(carry, 0);
            carryLength = 0;
        }
        while (!boundary && pos + windowBytes <= chunk.length) {
            analyse(chunk, pos);
            pos += windowBytes;
        }
        if (boundary) {
            boundaryOffset = pos;
        } else if (pos < chunk.length) {
            carryLength = chunk.length - pos;
            System.arraycopy(chunk, pos, carry, 0, carryLength);
        }
        return boundary;
    }

    private void analyse(byte[] buffer, int offset) {
        double rms = PcmAudio.rms(buffer, offset, windowBytes);
        if (rms >= energyThreshold) {
            speechMs += WINDOW_MS;
            trailingSilenceMs = 0;
            return;
        }
        if (speechMs == 0) {
            return;
        }
        trailingSilenceMs += WINDOW_MS;
        if (trailingSilenceMs >= silenceGapMs) {
            if (speechMs >= minSpeechMs) {
                boundary = true;
            } else {
                speechMs = 0;
                trailingSilenceMs = 0;
            }
        }
    }

    public boolean boundaryReached() {
        return boundary;
    }

    /**
     * Number of bytes of the last accepted chunk that belong to the finished utterance. Only
     * meaningful while {@link #boundaryReached()}; the rest of that chunk was not analysed.
     */
    public int boundaryOffset() {
        return boundaryOffset;
    }

    /** True while speech has been heard since the last reset. */
    public boolean hasSpeech() {
        return speechMs > 0;
    }

    public int speechMs() {
        return speechMs;
    }

    /**
     * Starts a new utterance.
     */
    public void reset() {
        carryLength = 0;
        speechMs = 0;
        trailingSilenceMs = 0;
        boundary = false;
        boundaryOffset = 0;
    }
}
