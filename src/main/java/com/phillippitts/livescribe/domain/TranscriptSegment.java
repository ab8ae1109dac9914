package com.phillippitts.livescribe.domain;

import java.util.Objects;

/**
 * One immutable unit of transcribed text.
 *
 * @param id segment id
 * @param sessionId owning session
 * @param startTimestamp milliseconds since session start
 * @param endTimestamp milliseconds since session start, never before {@code startTimestamp}
 * @param speakerId attributed speaker, {@value #UNKNOWN_SPEAKER} when not attributed
 * @param text transcribed text
 * @param confidence model confidence in [0, 1]
 * @param modelUsed model that produced the text
 * @param processingTimeMs wall time of the full chunk pipeline
 * @param audioChunkId id of the source chunk
 */
public record TranscriptSegment(String id,
                                String sessionId,
                                long startTimestamp,
                                long endTimestamp,
                                String speakerId,
                                String text,
                                double confidence,
                                String modelUsed,
                                long processingTimeMs,
                                String audioChunkId) {

    public static final String UNKNOWN_SPEAKER = "unknown";

    public TranscriptSegment {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(modelUsed, "modelUsed must not be null");
        Objects.requireNonNull(audioChunkId, "audioChunkId must not be null");
        if (endTimestamp < startTimestamp) {
            throw new IllegalArgumentException("endTimestamp must not precede startTimestamp");
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
        speakerId = speakerId == null ? UNKNOWN_SPEAKER : speakerId;
        text = text == null ? "" : text;
    }

    public long durationMs() {
        return endTimestamp - startTimestamp;
    }

    public TranscriptSegment withSpeakerId(String newSpeakerId) {
        return new TranscriptSegment(id, sessionId, startTimestamp, endTimestamp, newSpeakerId, text,
                confidence, modelUsed, processingTimeMs, audioChunkId);
    }

    /** Number of whitespace separated words in the text. */
    public int wordCount() {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
