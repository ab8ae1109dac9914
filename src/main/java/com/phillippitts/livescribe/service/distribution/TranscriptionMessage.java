package com.phillippitts.livescribe.service.distribution;

import com.phillippitts.livescribe.domain.FullTranscript;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.Speaker;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.domain.TranscriptionError;

import java.time.Instant;
import java.util.Objects;

/**
 * One message broadcast to the subscribers of a session.
 *
 * <p>The payload type is fixed by {@link MessageType}: a {@link TranscriptSegment} for
 * {@code SEGMENT}, a {@link Speaker} for {@code SPEAKER_UPDATE}, a {@link SessionStatus} for
 * {@code STATUS}, a {@link TranscriptionError} for {@code ERROR} and a {@link FullTranscript} for
 * {@code COMPLETE}. Use the factory methods.
 */
public record TranscriptionMessage(MessageType type, String sessionId, Instant timestamp, Object payload) {

    public TranscriptionMessage {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
    }

    public static TranscriptionMessage segment(String sessionId, TranscriptSegment segment, Instant at) {
        return new TranscriptionMessage(MessageType.SEGMENT, sessionId, at, segment);
    }

    public static TranscriptionMessage speakerUpdate(String sessionId, Speaker speaker, Instant at) {
        return new TranscriptionMessage(MessageType.SPEAKER_UPDATE, sessionId, at, speaker);
    }

    public static TranscriptionMessage status(String sessionId, SessionStatus status, Instant at) {
        return new TranscriptionMessage(MessageType.STATUS, sessionId, at, status);
    }

    public static TranscriptionMessage error(String sessionId, TranscriptionError error, Instant at) {
        return new TranscriptionMessage(MessageType.ERROR, sessionId, at, error);
    }

    public static TranscriptionMessage complete(String sessionId, FullTranscript transcript, Instant at) {
        return new TranscriptionMessage(MessageType.COMPLETE, sessionId, at, transcript);
    }
}
