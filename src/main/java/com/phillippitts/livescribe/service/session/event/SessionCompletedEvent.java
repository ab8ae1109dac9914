package com.phillippitts.livescribe.service.session.event;

import com.phillippitts.livescribe.domain.FullTranscript;

/**
 * A session was finalized into a full transcript.
 */
public record SessionCompletedEvent(FullTranscript transcript) {
}
