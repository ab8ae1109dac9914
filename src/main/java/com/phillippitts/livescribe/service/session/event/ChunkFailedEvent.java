package com.phillippitts.livescribe.service.session.event;

import com.phillippitts.livescribe.domain.TranscriptionError;

/**
 * A chunk attempt failed; {@code error} is what the session recorded as its last error.
 */
public record ChunkFailedEvent(String sessionId, TranscriptionError error) {
}
