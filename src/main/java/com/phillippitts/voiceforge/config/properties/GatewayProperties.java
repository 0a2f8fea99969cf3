package com.phillippitts.voiceforge.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the real-time session gateway ({@code gateway.*}).
 */
@ConfigurationProperties(prefix = "gateway")
@Validated
public class GatewayProperties {

    /** Sessions with no client activity for this long are ended. */
    @Positive(message = "Idle timeout must be positive")
    private long idleTimeoutMs = 300_000;

    /** Conversation turns kept per session and sent as reply context. */
    @Min(value = 1, message = "Context must keep at least one turn")
    private int contextMaxTurns = 20;

    /** Size of tts_chunk frames when a synthesis result arrives unstreamed. */
    @Positive(message = "TTS chunk size must be positive")
    private int ttsChunkBytes = 6400;

    /** Deadline of each pipeline stage task. */
    @Positive(message = "Stage deadline must be positive")
    private long stageDeadlineMs = 30_000;

    /** Largest audio buffer a turn may accumulate before it is cut. */
    @Positive(message = "Max utterance bytes must be positive")
    private int maxUtteranceBytes = 16_000 * 2 * 30;

    @Valid
    private Utterance utterance = new Utterance();

    @Valid
    private Transport transport = new Transport();

    public long getIdleTimeoutMs() {
        return idleTimeoutMs;
    }

    public void setIdleTimeoutMs(long idleTimeoutMs) {
        this.idleTimeoutMs = idleTimeoutMs;
    }

    public int getContextMaxTurns() {
        return contextMaxTurns;
    }

    public void setContextMaxTurns(int contextMaxTurns) {
        this.contextMaxTurns = contextMaxTurns;
    }

    public int getTtsChunkBytes() {
        return ttsChunkBytes;
    }

    public void setTtsChunkBytes(int ttsChunkBytes) {
        this.ttsChunkBytes = ttsChunkBytes;
    }

    public long getStageDeadlineMs() {
        return stageDeadlineMs;
    }

    public void setStageDeadlineMs(long stageDeadlineMs) {
        this.stageDeadlineMs = stageDeadlineMs;
    }

    public int getMaxUtteranceBytes() {
        return maxUtteranceBytes;
    }

    public void setMaxUtteranceBytes(int maxUtteranceBytes) {
        this.maxUtteranceBytes = maxUtteranceBytes;
    }

    public Utterance getUtterance() {
        return utterance;
    }

    public void setUtterance(Utterance utterance) {
        this.utterance = utterance;
    }

    public Transport getTransport() {
        return transport;
    }

    public void setTransport(Transport transport) {
        this.transport = transport;
    }

    /**
     * Utterance boundary detection over incoming PCM16LE mono audio.
     */
    public static class Utterance {

        /** Trailing silence that ends an utterance. */
        @Positive(message = "Silence gap must be positive")
        private int silenceGapMs = 700;

        /** RMS amplitude (0-32767) separating speech from silence. */
        @Min(value = 1, message = "Energy threshold must be at least 1")
        @Max(value = 32767, message = "Energy threshold must not exceed 32767")
        private int energyThreshold = 800;

        /** Speech shorter than this is treated as noise. */
        @Min(value = 0, message = "Min speech must not be negative")
        private int minSpeechMs = 200;

        @Positive(message = "Sample rate must be positive")
        private int sampleRate = 16_000;

        public int getSilenceGapMs() {
            return silenceGapMs;
        }

        public void setSilenceGapMs(int silenceGapMs) {
            this.silenceGapMs = silenceGapMs;
        }

        public int getEnergyThreshold() {
            return energyThreshold;
        }

        public void setEnergyThreshold(int energyThreshold) {
            this.energyThreshold = energyThreshold;
        }

        public int getMinSpeechMs() {
            return minSpeechMs;
        }

        public void setMinSpeechMs(int minSpeechMs) {
            this.minSpeechMs = minSpeechMs;
        }

        public int getSampleRate() {
            return sampleRate;
        }

        public void setSampleRate(int sampleRate) {
            this.sampleRate = sampleRate;
        }
    }

    /**
     * WebSocket transport.
     */
    public static class Transport {

        private boolean enabled = true;

        @NotBlank(message = "Transport host must not be blank")
        private String host = "0.0.0.0";

        @Min(value = 0, message = "Port must not be negative")
        @Max(value = 65535, message = "Port must not exceed 65535")
        private int port = 8765;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }
}
