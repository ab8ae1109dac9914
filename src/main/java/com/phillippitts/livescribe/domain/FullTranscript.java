package com.phillippitts.livescribe.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated result of a completed session, handed to post-processing.
 */
public record FullTranscript(String id,
                             String sessionId,
                             String meetingId,
                             List<TranscriptSegment> segments,
                             List<Speaker> speakers,
                             long durationMs,
                             String language,
                             ModelMetadata modelMetadata,
                             Instant createdAt) {

    public FullTranscript {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(modelMetadata, "modelMetadata must not be null");
        segments = List.copyOf(segments);
        speakers = List.copyOf(speakers);
    }
}
