package com.phillippitts.livescribe.exception;

import com.phillippitts.livescribe.domain.TranscriptionErrorCode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link TranscriptionException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Inference request failed")
 *         .model("openai/whisper-base")
 *         .code(TranscriptionErrorCode.NETWORK_ERROR)
 *         .cause(ioException)
 *         .durationMs(1200)
 *         .metadata("status", 502)
 *         .build();
 * </pre>
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private String modelName;
    private TranscriptionErrorCode code = TranscriptionErrorCode.UNKNOWN_ERROR;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder model(String modelName) {
        this.modelName = modelName;
        return this;
    }

    public TranscriptionExceptionBuilder code(TranscriptionErrorCode code) {
        if (code != null) {
            this.code = code;
        }
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are skipped.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (durationMs={ms}, {key1}={val1}, ...) (model: {model}, code: {code})
     * </pre>
     *
     * @return constructed exception; {@link ModelUnavailableException} for
     *         {@link TranscriptionErrorCode#MODEL_UNAVAILABLE}
     */
    public TranscriptionException build() {
        String detailedMessage = buildDetailedMessage();
        String model = modelName != null ? modelName : "unknown";
        if (code == TranscriptionErrorCode.MODEL_UNAVAILABLE) {
            return cause != null
                    ? new ModelUnavailableException(model, detailedMessage, cause)
                    : new ModelUnavailableException(model, detailedMessage);
        }
        if (cause != null) {
            return new TranscriptionException(detailedMessage, code, model, cause);
        }
        return new TranscriptionException(detailedMessage, code, model);
    }

    private String buildDetailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
