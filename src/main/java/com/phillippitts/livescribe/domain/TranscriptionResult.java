package com.phillippitts.livescribe.domain;

import java.util.Objects;

/**
 * Output of one model transcription call.
 *
 * @param text transcribed text, never null
 * @param confidence confidence in [0, 1]
 * @param modelName model that actually produced the text
 * @param processingTimeMs wall time of the call
 */
public record TranscriptionResult(String text, double confidence, String modelName, long processingTimeMs) {

    public TranscriptionResult {
        Objects.requireNonNull(modelName, "modelName must not be null");
        text = text == null ? "" : text.trim();
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("processingTimeMs must not be negative");
        }
    }
}
