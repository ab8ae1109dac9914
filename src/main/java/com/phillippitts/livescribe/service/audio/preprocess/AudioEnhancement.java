package com.phillippitts.livescribe.service.audio.preprocess;

/**
 * One applied preprocessing step.
 *
 * @param type step kind
 * @param improvement measured improvement, 0 when not measurable; observability only
 */
public record AudioEnhancement(EnhancementType type, double improvement) {
}
