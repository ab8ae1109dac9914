package com.phillippitts.livescribe.service.audio.preprocess;

import com.phillippitts.livescribe.service.audio.PcmAudio;

/**
 * One preprocessing step. Implementations are stateless and thread-safe.
 */
public interface EnhancementStep {

    EnhancementType type();

    /**
     * Applies the step.
     *
     * @param input decoded audio, not modified
     * @param config preprocessing settings
     * @return processed audio and measured improvement, or null when the step had nothing to do
     */
    Outcome apply(PcmAudio input, PreprocessingConfig config);

    /**
     * Result of one step.
     */
    record Outcome(PcmAudio audio, double improvement) {
    }
}
