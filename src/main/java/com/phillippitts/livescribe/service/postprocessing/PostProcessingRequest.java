package com.phillippitts.livescribe.service.postprocessing;

import java.util.Objects;

/**
 * Job submitted when a transcript is finalized.
 *
 * @param sessionId finalized session
 * @param transcriptId id of the full transcript
 * @param segmentCount number of segments in the transcript
 * @param durationMs transcript duration
 */
public record PostProcessingRequest(String sessionId, String transcriptId, int segmentCount, long durationMs) {

    public PostProcessingRequest {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(transcriptId, "transcriptId must not be null");
    }
}
