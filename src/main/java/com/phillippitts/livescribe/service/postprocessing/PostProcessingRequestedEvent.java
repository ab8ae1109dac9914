package com.phillippitts.livescribe.service.postprocessing;

import java.time.Instant;

/**
 * Spring application event carrying a post-processing job to whatever listens downstream
 * (summarization, persistence, billing).
 */
public record PostProcessingRequestedEvent(PostProcessingRequest request, Instant requestedAt) {
}
