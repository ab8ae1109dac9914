package com.phillippitts.livescribe.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Most recent failure recorded on a session, also pushed to subscribers as an {@code error} message.
 *
 * @param code classified failure kind
 * @param message human readable description
 * @param modelName model involved, or null when the failure is not model related
 * @param timestamp when the failure was recorded
 */
public record TranscriptionError(TranscriptionErrorCode code, String message, String modelName, Instant timestamp) {

    public TranscriptionError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        message = message == null ? code.name() : message;
    }

    public boolean retryable() {
        return code.isRetryable();
    }
}
