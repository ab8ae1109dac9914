package com.phillippitts.livescribe.testutil;

import com.phillippitts.livescribe.domain.FullTranscript;
import com.phillippitts.livescribe.domain.SessionSnapshot;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.domain.TranscriptionError;
import com.phillippitts.livescribe.service.session.SessionEventSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Session event sink that records every callback for assertions.
 */
public class RecordingSessionEventSink implements SessionEventSink {

    public final List<SessionSnapshot> started = new CopyOnWriteArrayList<>();
    public final List<TranscriptSegment> segments = new CopyOnWriteArrayList<>();
    public final List<SessionStatus> statuses = new CopyOnWriteArrayList<>();
    public final List<TranscriptionError> failures = new CopyOnWriteArrayList<>();
    public final List<FullTranscript> completed = new CopyOnWriteArrayList<>();

    @Override
    public void onSessionStarted(SessionSnapshot session) {
        started.add(session);
    }

    @Override
    public void onSegmentProcessed(String sessionId, TranscriptSegment segment) {
        segments.add(segment);
    }

    @Override
    public void onStatusChanged(String sessionId, SessionStatus from, SessionStatus to) {
        statuses.add(to);
    }

    @Override
    public void onChunkFailed(String sessionId, TranscriptionError error) {
        failures.add(error);
    }

    @Override
    public void onSessionCompleted(FullTranscript transcript) {
        completed.add(transcript);
    }
}
