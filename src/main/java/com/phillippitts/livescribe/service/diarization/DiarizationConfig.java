package com.phillippitts.livescribe.service.diarization;

/**
 * Diarization tuning.
 *
 * @param maxSpeakers clustering stops creating speakers once this many exist
 * @param minSpeakers lower bound reported for planning; clustering never invents speakers
 * @param similarityThreshold cosine similarity above which a segment joins a speaker
 * @param minSegmentLengthSeconds speakers with less total speech are dropped
 * @param energyThreshold mean-square frame energy above which a frame is voiced
 * @param minVoiceSegmentSeconds voiced runs shorter than this are discarded
 * @param embeddingDimensions length of voice embeddings
 */
public record DiarizationConfig(int maxSpeakers,
                                int minSpeakers,
                                double similarityThreshold,
                                double minSegmentLengthSeconds,
                                double energyThreshold,
                                double minVoiceSegmentSeconds,
                                int embeddingDimensions) {

    public static final DiarizationConfig DEFAULT = new DiarizationConfig(10, 1, 0.8, 1.0, 0.01, 0.5, 128);

    public DiarizationConfig {
        if (maxSpeakers < 1 || minSpeakers < 1 || minSpeakers > maxSpeakers) {
            throw new IllegalArgumentException("require 1 <= minSpeakers <= maxSpeakers");
        }
        if (similarityThreshold < -1.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be in [-1, 1]");
        }
        if (minSegmentLengthSeconds < 0.0 || minVoiceSegmentSeconds < 0.0 || energyThreshold < 0.0) {
            throw new IllegalArgumentException("lengths and thresholds must not be negative");
        }
        if (embeddingDimensions < 1) {
            throw new IllegalArgumentException("embeddingDimensions must be positive");
        }
    }
}
