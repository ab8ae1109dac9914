package com.phillippitts.livescribe.config.properties;

import com.phillippitts.livescribe.service.diarization.DiarizationConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Speaker diarization tuning ({@code livescribe.diarization.*}).
 */
@ConfigurationProperties(prefix = "livescribe.diarization")
@Validated
public class DiarizationProperties {

    @Positive
    private int maxSpeakers = 10;

    @Positive
    private int minSpeakers = 1;

    /** Cosine similarity above which a voice segment joins an existing cluster. */
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.8;

    /** Speakers with less total speech (seconds) are dropped. */
    @PositiveOrZero
    private double minSegmentLength = 1.0;

    /** Mean-square frame energy above which a frame counts as voiced. */
    @PositiveOrZero
    private double energyThreshold = 0.01;

    @PositiveOrZero
    private double minVoiceSegmentSeconds = 0.5;

    @Positive
    private int embeddingDimensions = 128;

    public DiarizationConfig toConfig() {
        return new DiarizationConfig(maxSpeakers, minSpeakers, similarityThreshold, minSegmentLength,
                energyThreshold, minVoiceSegmentSeconds, embeddingDimensions);
    }

    public int getMaxSpeakers() {
        return maxSpeakers;
    }

    public void setMaxSpeakers(int maxSpeakers) {
        this.maxSpeakers = maxSpeakers;
    }

    public int getMinSpeakers() {
        return minSpeakers;
    }

    public void setMinSpeakers(int minSpeakers) {
        this.minSpeakers = minSpeakers;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public double getMinSegmentLength() {
        return minSegmentLength;
    }

    public void setMinSegmentLength(double minSegmentLength) {
        this.minSegmentLength = minSegmentLength;
    }

    public double getEnergyThreshold() {
        return energyThreshold;
    }

    public void setEnergyThreshold(double energyThreshold) {
        this.energyThreshold = energyThreshold;
    }

    public double getMinVoiceSegmentSeconds() {
        return minVoiceSegmentSeconds;
    }

    public void setMinVoiceSegmentSeconds(double minVoiceSegmentSeconds) {
        this.minVoiceSegmentSeconds = minVoiceSegmentSeconds;
    }

    public int getEmbeddingDimensions() {
        return embeddingDimensions;
    }

    public void setEmbeddingDimensions(int embeddingDimensions) {
        this.embeddingDimensions = embeddingDimensions;
    }
}
