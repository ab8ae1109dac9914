package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.FullTranscript;
import com.phillippitts.livescribe.domain.SessionSnapshot;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.domain.TranscriptionError;

/**
 * Observer of one session's lifecycle, invoked synchronously by the session manager right after
 * each state change. Passed per session at start.
 *
 * <p>Implementations must be fast and must not call back into the session manager. Exceptions
 * are logged and otherwise ignored.
 */
public interface SessionEventSink {

    /** Sink that ignores every callback. */
    SessionEventSink NOOP = new SessionEventSink() { };

    default void onSessionStarted(SessionSnapshot session) {
    }

    default void onSegmentProcessed(String sessionId, TranscriptSegment segment) {
    }

    default void onStatusChanged(String sessionId, SessionStatus from, SessionStatus to) {
    }

    default void onChunkFailed(String sessionId, TranscriptionError error) {
    }

    default void onSessionCompleted(FullTranscript transcript) {
    }
}
