package com.phillippitts.livescribe.exception;

import com.phillippitts.livescribe.domain.TranscriptionErrorCode;

/**
 * Thrown when a model cannot be brought to the ready state within its load retry budget.
 * Fatal to session start.
 */
public class ModelUnavailableException extends TranscriptionException {

    public ModelUnavailableException(String modelName, String reason) {
        super("Model unavailable: " + reason, TranscriptionErrorCode.MODEL_UNAVAILABLE, modelName);
    }

    public ModelUnavailableException(String modelName, String reason, Throwable cause) {
        super("Model unavailable: " + reason, TranscriptionErrorCode.MODEL_UNAVAILABLE, modelName, cause);
    }
}
