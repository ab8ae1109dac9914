package com.phillippitts.livescribe.config.properties;

import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.service.audio.preprocess.EnhancementType;
import com.phillippitts.livescribe.service.audio.preprocess.PreprocessingConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumSet;
import java.util.Set;

/**
 * Audio preprocessing toggles and targets ({@code livescribe.preprocessing.*}).
 */
@ConfigurationProperties(prefix = "livescribe.preprocessing")
@Validated
public class PreprocessingProperties {

    private boolean formatConversion = true;
    private boolean volumeNormalization = true;
    private boolean noiseReduction = true;
    private boolean echoCancellation = false;

    /** Sample rate every chunk is converted to before diarization and transcription. */
    @Positive
    private int targetSampleRate = 16_000;

    @Positive
    @DecimalMax("1.0")
    private double targetRms = PreprocessingConfig.DEFAULT_TARGET_RMS;

    @Positive
    private double highPassCutoffHz = PreprocessingConfig.DEFAULT_HIGH_PASS_CUTOFF_HZ;

    /** Chunks smaller than this are passed through untouched. */
    @PositiveOrZero
    private int minimumBytes = PreprocessingConfig.DEFAULT_MINIMUM_BYTES;

    /** Quality score below which a chunk is logged as insufficient. */
    @PositiveOrZero
    @DecimalMax("1.0")
    private double minimumQuality = 0.2;

    public PreprocessingConfig toConfig(AudioSpec inputSpec) {
        Set<EnhancementType> steps = EnumSet.noneOf(EnhancementType.class);
        if (formatConversion) {
            steps.add(EnhancementType.FORMAT_CONVERSION);
        }
        if (volumeNormalization) {
            steps.add(EnhancementType.VOLUME_NORMALIZATION);
        }
        if (noiseReduction) {
            steps.add(EnhancementType.NOISE_REDUCTION);
        }
        if (echoCancellation) {
            steps.add(EnhancementType.ECHO_CANCELLATION);
        }
        return new PreprocessingConfig(inputSpec, targetSampleRate, steps, targetRms, highPassCutoffHz, minimumBytes);
    }

    public boolean isFormatConversion() {
        return formatConversion;
    }

    public void setFormatConversion(boolean formatConversion) {
        this.formatConversion = formatConversion;
    }

    public boolean isVolumeNormalization() {
        return volumeNormalization;
    }

    public void setVolumeNormalization(boolean volumeNormalization) {
        this.volumeNormalization = volumeNormalization;
    }

    public boolean isNoiseReduction() {
        return noiseReduction;
    }

    public void setNoiseReduction(boolean noiseReduction) {
        this.noiseReduction = noiseReduction;
    }

    public boolean isEchoCancellation() {
        return echoCancellation;
    }

    public void setEchoCancellation(boolean echoCancellation) {
        this.echoCancellation = echoCancellation;
    }

    public int getTargetSampleRate() {
        return targetSampleRate;
    }

    public void setTargetSampleRate(int targetSampleRate) {
        this.targetSampleRate = targetSampleRate;
    }

    public double getTargetRms() {
        return targetRms;
    }

    public void setTargetRms(double targetRms) {
        this.targetRms = targetRms;
    }

    public double getHighPassCutoffHz() {
        return highPassCutoffHz;
    }

    public void setHighPassCutoffHz(double highPassCutoffHz) {
        this.highPassCutoffHz = highPassCutoffHz;
    }

    public int getMinimumBytes() {
        return minimumBytes;
    }

    public void setMinimumBytes(int minimumBytes) {
        this.minimumBytes = minimumBytes;
    }

    public double getMinimumQuality() {
        return minimumQuality;
    }

    public void setMinimumQuality(double minimumQuality) {
        this.minimumQuality = minimumQuality;
    }
}
