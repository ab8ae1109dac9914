package com.phillippitts.livescribe.domain;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, value-comparable view of a session at one point in time.
 *
 * @param id session id
 * @param config session configuration
 * @param status lifecycle status
 * @param startTime session start
 * @param endTime set once the session reached a terminal state, otherwise null
 * @param segments segments in append order
 * @param speakers speakers in detection order
 * @param errorCount chunk attempt failures so far; never reset
 * @param lastError most recent failure, or null
 * @param currentModel the session's single active model
 * @param fallbackModels remaining fallback models in rank order
 */
public record SessionSnapshot(String id,
                              TranscriptionConfig config,
                              SessionStatus status,
                              Instant startTime,
                              Instant endTime,
                              List<TranscriptSegment> segments,
                              List<Speaker> speakers,
                              int errorCount,
                              TranscriptionError lastError,
                              String currentModel,
                              List<String> fallbackModels) {

    public SessionSnapshot {
        segments = List.copyOf(segments);
        speakers = List.copyOf(speakers);
        fallbackModels = List.copyOf(fallbackModels);
    }
}
