package com.phillippitts.livescribe.exception;

import com.phillippitts.livescribe.domain.TranscriptionErrorCode;

import java.util.Objects;

/**
 * Thrown when a model transcription attempt fails.
 *
 * <p>Carries the {@link TranscriptionErrorCode} that drives the session's fallback policy
 * and the name of the model that failed (or {@code "unknown"}).
 */
public class TranscriptionException extends LiveScribeException {

    private final TranscriptionErrorCode errorCode;
    private final String modelName;

    public TranscriptionException(String message) {
        this(message, TranscriptionErrorCode.UNKNOWN_ERROR, "unknown");
    }

    public TranscriptionException(String message, TranscriptionErrorCode errorCode, String modelName) {
        super(message + " (model: " + modelName + ", code: " + errorCode + ")");
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.modelName = modelName;
    }

    public TranscriptionException(String message, TranscriptionErrorCode errorCode, String modelName,
                                  Throwable cause) {
        super(message + " (model: " + modelName + ", code: " + errorCode + ")", cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.modelName = modelName;
    }

    public TranscriptionErrorCode getErrorCode() {
        return errorCode;
    }

    public String getModelName() {
        return modelName;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
