package com.phillippitts.livescribe.service.audio.preprocess;

/**
 * Preprocessing steps, declared in pipeline order.
 */
public enum EnhancementType {
    FORMAT_CONVERSION,
    VOLUME_NORMALIZATION,
    NOISE_REDUCTION,
    ECHO_CANCELLATION
}
