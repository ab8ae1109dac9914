package com.phillippitts.livescribe.service.audio.preprocess;

import com.phillippitts.livescribe.domain.AudioSpec;

/**
 * Normalizes raw chunk audio before diarization and transcription.
 */
public interface AudioPreprocessor {

    /**
     * Runs the enabled enhancement steps in pipeline order.
     *
     * <p>Never throws for bad input: payloads below the minimum size, or that fail to decode or
     * process, are returned untouched with quality 0 and no enhancements.
     *
     * @param audio WAV or raw PCM bytes
     * @param config preprocessing settings
     * @return processed audio with quality score and applied enhancements
     */
    PreprocessingResult preprocess(byte[] audio, PreprocessingConfig config);

    /**
     * Estimates signal quality without modifying the audio.
     *
     * @param audio WAV or raw PCM bytes
     * @param spec format of raw PCM input
     * @return quality metrics, {@link AudioQualityMetrics#UNMEASURABLE} if the audio cannot be decoded
     */
    AudioQualityMetrics analyzeQuality(byte[] audio, AudioSpec spec);
}
