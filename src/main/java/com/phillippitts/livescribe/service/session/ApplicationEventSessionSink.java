package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.FullTranscript;
import com.phillippitts.livescribe.domain.SessionSnapshot;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.domain.TranscriptionError;
import com.phillippitts.livescribe.service.session.event.ChunkFailedEvent;
import com.phillippitts.livescribe.service.session.event.SegmentProcessedEvent;
import com.phillippitts.livescribe.service.session.event.SessionCompletedEvent;
import com.phillippitts.livescribe.service.session.event.SessionStartedEvent;
import com.phillippitts.livescribe.service.session.event.SessionStatusChangedEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Default sink: republishes every callback as a Spring application event.
 */
@Component
public class ApplicationEventSessionSink implements SessionEventSink {

    private final ApplicationEventPublisher publisher;

    public ApplicationEventSessionSink(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    @Override
    public void onSessionStarted(SessionSnapshot session) {
        publisher.publishEvent(new SessionStartedEvent(session));
    }

    @Override
    public void onSegmentProcessed(String sessionId, TranscriptSegment segment) {
        publisher.publishEvent(new SegmentProcessedEvent(sessionId, segment));
    }

    @Override
    public void onStatusChanged(String sessionId, SessionStatus from, SessionStatus to) {
        publisher.publishEvent(new SessionStatusChangedEvent(sessionId, from, to));
    }

    @Override
    public void onChunkFailed(String sessionId, TranscriptionError error) {
        publisher.publishEvent(new ChunkFailedEvent(sessionId, error));
    }

    @Override
    public void onSessionCompleted(FullTranscript transcript) {
        publisher.publishEvent(new SessionCompletedEvent(transcript));
    }
}
