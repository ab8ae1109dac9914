package com.phillippitts.livescribe.service.session.event;

import com.phillippitts.livescribe.domain.TranscriptSegment;

/**
 * A chunk produced a segment.
 */
public record SegmentProcessedEvent(String sessionId, TranscriptSegment segment) {
}
