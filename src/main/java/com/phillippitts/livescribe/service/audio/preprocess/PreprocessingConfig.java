package com.phillippitts.livescribe.service.audio.preprocess;

import com.phillippitts.livescribe.domain.AudioSpec;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Per-call preprocessing settings.
 *
 * @param inputSpec format of raw PCM input (ignored for WAV input)
 * @param targetSampleRate sample rate produced by format conversion
 * @param enabledSteps steps to run
 * @param targetRms RMS targeted by volume normalization
 * @param highPassCutoffHz noise reduction cutoff
 * @param minimumBytes inputs shorter than this are passed through untouched
 */
public record PreprocessingConfig(AudioSpec inputSpec,
                                  int targetSampleRate,
                                  Set<EnhancementType> enabledSteps,
                                  double targetRms,
                                  double highPassCutoffHz,
                                  int minimumBytes) {

    public static final double DEFAULT_TARGET_RMS = 0.1;
    public static final double DEFAULT_HIGH_PASS_CUTOFF_HZ = 80.0;
    public static final int DEFAULT_MINIMUM_BYTES = 64;

    public PreprocessingConfig {
        Objects.requireNonNull(inputSpec, "inputSpec must not be null");
        if (targetSampleRate <= 0) {
            throw new IllegalArgumentException("targetSampleRate must be positive");
        }
        if (targetRms <= 0.0 || targetRms > 1.0) {
            throw new IllegalArgumentException("targetRms must be in (0, 1]");
        }
        if (highPassCutoffHz <= 0.0) {
            throw new IllegalArgumentException("highPassCutoffHz must be positive");
        }
        enabledSteps = enabledSteps.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(enabledSteps));
    }

    /** Format conversion, volume normalization and noise reduction at the input's sample rate. */
    public static PreprocessingConfig defaults(AudioSpec inputSpec) {
        return new PreprocessingConfig(inputSpec, inputSpec.sampleRate(),
                EnumSet.of(EnhancementType.FORMAT_CONVERSION, EnhancementType.VOLUME_NORMALIZATION,
                        EnhancementType.NOISE_REDUCTION),
                DEFAULT_TARGET_RMS, DEFAULT_HIGH_PASS_CUTOFF_HZ, DEFAULT_MINIMUM_BYTES);
    }

    public boolean isEnabled(EnhancementType type) {
        return enabledSteps.contains(type);
    }
}
