package com.phillippitts.livescribe.config.properties;

import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.domain.TranscriptionConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Session defaults applied when a caller starts a session without a configuration
 * ({@code livescribe.transcription.*}).
 */
@ConfigurationProperties(prefix = "livescribe.transcription")
@Validated
public class TranscriptionProperties {

    @NotBlank
    private String modelName = TranscriptionConfig.DEFAULT_MODEL;

    @NotBlank
    private String language = TranscriptionConfig.DEFAULT_LANGUAGE;

    private boolean enableDiarization = true;

    @Positive
    private int chunkSize = TranscriptionConfig.DEFAULT_CHUNK_SIZE;

    @PositiveOrZero
    private int overlapSize = TranscriptionConfig.DEFAULT_OVERLAP_SIZE;

    @PositiveOrZero
    @DecimalMax("1.0")
    private double confidenceThreshold = TranscriptionConfig.DEFAULT_CONFIDENCE_THRESHOLD;

    @Positive
    private int sampleRate = 16_000;

    @Positive
    private int channels = 1;

    @Positive
    private int bitDepth = 16;

    /**
     * Fallback switches are only attempted while a session's error count is below this value.
     * The error count is never reset by later successes.
     */
    @Positive
    private int errorBudget = 3;

    /** Size of the buffer used when reading the inbound audio stream. */
    @Positive
    private int streamReadBufferBytes = 4096;

    /** Upper bound on concurrently open sessions. */
    @Positive
    private int maxActiveSessions = 64;

    /** How long finalize waits for an ended input stream's last windows before cutting it off. */
    @PositiveOrZero
    private long finalizeDrainTimeoutMs = 30_000;

    public TranscriptionConfig toConfig() {
        return TranscriptionConfig.builder()
                .modelName(modelName)
                .language(language)
                .enableDiarization(enableDiarization)
                .chunkSize(chunkSize)
                .overlapSize(overlapSize)
                .confidenceThreshold(confidenceThreshold)
                .audioSpec(new AudioSpec(sampleRate, channels, bitDepth))
                .build();
    }

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public boolean isEnableDiarization() {
        return enableDiarization;
    }

    public void setEnableDiarization(boolean enableDiarization) {
        this.enableDiarization = enableDiarization;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getOverlapSize() {
        return overlapSize;
    }

    public void setOverlapSize(int overlapSize) {
        this.overlapSize = overlapSize;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    public int getChannels() {
        return channels;
    }

    public void setChannels(int channels) {
        this.channels = channels;
    }

    public int getBitDepth() {
        return bitDepth;
    }

    public void setBitDepth(int bitDepth) {
        this.bitDepth = bitDepth;
    }

    public int getErrorBudget() {
        return errorBudget;
    }

    public void setErrorBudget(int errorBudget) {
        this.errorBudget = errorBudget;
    }

    public int getStreamReadBufferBytes() {
        return streamReadBufferBytes;
    }

    public void setStreamReadBufferBytes(int streamReadBufferBytes) {
        this.streamReadBufferBytes = streamReadBufferBytes;
    }

    public int getMaxActiveSessions() {
        return maxActiveSessions;
    }

    public void setMaxActiveSessions(int maxActiveSessions) {
        this.maxActiveSessions = maxActiveSessions;
    }

    public long getFinalizeDrainTimeoutMs() {
        return finalizeDrainTimeoutMs;
    }

    public void setFinalizeDrainTimeoutMs(long finalizeDrainTimeoutMs) {
        this.finalizeDrainTimeoutMs = finalizeDrainTimeoutMs;
    }
}
