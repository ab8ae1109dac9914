package com.phillippitts.livescribe.domain;

import java.util.Objects;

/**
 * Immutable per-session configuration.
 *
 * @param meetingId optional id of the meeting the session belongs to
 * @param modelName initial active model
 * @param language BCP-47 language hint passed to the model
 * @param enableDiarization whether chunks are attributed to speakers
 * @param chunkSize window size in bytes
 * @param overlapSize bytes retained between consecutive windows
 * @param confidenceThreshold segments below this confidence are flagged in logs
 * @param audioSpec sample format of the inbound stream
 */
public record TranscriptionConfig(String meetingId,
                                  String modelName,
                                  String language,
                                  boolean enableDiarization,
                                  int chunkSize,
                                  int overlapSize,
                                  double confidenceThreshold,
                                  AudioSpec audioSpec) {

    public static final String DEFAULT_MODEL = "facebook/wav2vec2-large-960h-lv60-self";
    public static final String DEFAULT_LANGUAGE = "en";
    public static final int DEFAULT_CHUNK_SIZE = 16_384;
    public static final int DEFAULT_OVERLAP_SIZE = 2_048;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    public TranscriptionConfig {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank");
        }
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language must not be blank");
        }
        Objects.requireNonNull(audioSpec, "audioSpec must not be null");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlapSize < 0 || overlapSize >= chunkSize) {
            throw new IllegalArgumentException("overlapSize must be in [0, chunkSize)");
        }
        if (chunkSize % audioSpec.blockAlign() != 0 || overlapSize % audioSpec.blockAlign() != 0) {
            throw new IllegalArgumentException("chunkSize and overlapSize must be multiples of the frame size "
                    + audioSpec.blockAlign());
        }
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be in [0, 1]");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .meetingId(meetingId)
                .modelName(modelName)
                .language(language)
                .enableDiarization(enableDiarization)
                .chunkSize(chunkSize)
                .overlapSize(overlapSize)
                .confidenceThreshold(confidenceThreshold)
                .audioSpec(audioSpec);
    }

    /**
     * Builder starting from the built-in defaults.
     */
    public static final class Builder {
        private String meetingId;
        private String modelName = DEFAULT_MODEL;
        private String language = DEFAULT_LANGUAGE;
        private boolean enableDiarization = true;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int overlapSize = DEFAULT_OVERLAP_SIZE;
        private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private AudioSpec audioSpec = AudioSpec.PCM16_MONO_16K;

        private Builder() {
        }

        public Builder meetingId(String meetingId) {
            this.meetingId = meetingId;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder enableDiarization(boolean enableDiarization) {
            this.enableDiarization = enableDiarization;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder overlapSize(int overlapSize) {
            this.overlapSize = overlapSize;
            return this;
        }

        public Builder confidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder audioSpec(AudioSpec audioSpec) {
            this.audioSpec = audioSpec;
            return this;
        }

        public TranscriptionConfig build() {
            return new TranscriptionConfig(meetingId, modelName, language, enableDiarization,
                    chunkSize, overlapSize, confidenceThreshold, audioSpec);
        }
    }
}
