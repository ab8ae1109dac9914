package com.phillippitts.livescribe.service.audio.preprocess;

import com.phillippitts.livescribe.domain.AudioSpec;

import java.util.List;

/**
 * Output of preprocessing.
 *
 * @param processedAudio PCM16LE bytes in {@code outputSpec}, or the untouched input on passthrough
 * @param outputSpec format of {@code processedAudio}
 * @param qualityScore overall quality of the processed audio in [0, 1]; 0 on passthrough
 * @param enhancements steps that were applied, in order
 * @param quality full quality breakdown
 */
public record PreprocessingResult(byte[] processedAudio,
                                  AudioSpec outputSpec,
                                  double qualityScore,
                                  List<AudioEnhancement> enhancements,
                                  AudioQualityMetrics quality) {

    public PreprocessingResult {
        enhancements = List.copyOf(enhancements);
    }

    static PreprocessingResult passthrough(byte[] original, AudioSpec spec) {
        return new PreprocessingResult(original, spec, 0.0, List.of(), AudioQualityMetrics.UNMEASURABLE);
    }

    public boolean isPassthrough() {
        return enhancements.isEmpty() && qualityScore == 0.0;
    }
}
