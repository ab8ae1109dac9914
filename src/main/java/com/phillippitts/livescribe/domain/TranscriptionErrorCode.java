package com.phillippitts.livescribe.domain;

/**
 * Classified failure kinds surfaced by the transcription pipeline.
 */
public enum TranscriptionErrorCode {
    /** Model failed to load or become ready within its retry budget. */
    MODEL_UNAVAILABLE(false),
    /** Preprocessing failed; the pipeline degrades to passthrough. */
    AUDIO_PROCESSING_FAILED(false),
    NETWORK_ERROR(true),
    MODEL_TIMEOUT(true),
    /** Bytes cannot be decoded in the declared format. Surfaced to the caller. */
    INVALID_AUDIO_FORMAT(false),
    /** Non-fatal; the segment is attributed to the unknown speaker. */
    SPEAKER_DIARIZATION_FAILED(false),
    RATE_LIMIT_EXCEEDED(true),
    /** Affects real-time delivery only, never the pipeline. */
    WEBSOCKET_CONNECTION_LOST(false),
    INSUFFICIENT_AUDIO_QUALITY(false),
    UNKNOWN_ERROR(true);

    private final boolean retryable;

    TranscriptionErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
