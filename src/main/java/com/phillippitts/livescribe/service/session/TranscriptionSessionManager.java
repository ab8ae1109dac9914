package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.FullTranscript;
import com.phillippitts.livescribe.domain.SessionSnapshot;
import com.phillippitts.livescribe.domain.Speaker;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.domain.TranscriptionConfig;
import com.phillippitts.livescribe.service.metrics.QualityMetricsSnapshot;

import java.io.InputStream;
import java.util.List;
import java.util.Set;

/**
 * Lifecycle and chunk pipeline of transcription sessions.
 *
 * <p><b>Lifecycle:</b> {@code INITIALIZING -> ACTIVE <-> PAUSED -> {COMPLETED | CANCELLED | ERROR}}.
 * Only active sessions accept chunks. Operations on a session that already ended fail with
 * {@link com.phillippitts.livescribe.exception.SessionClosedException}; unknown ids fail with
 * {@link com.phillippitts.livescribe.exception.SessionNotFoundException}.
 *
 * <p><b>Ordering:</b> chunks of one session run one at a time in arrival order; a slow model
 * call throttles intake. Sessions never block each other.
 */
public interface TranscriptionSessionManager {

    /**
     * Starts a session that reports to the application's default event sink.
     *
     * @see #startSession(InputStream, TranscriptionConfig, SessionEventSink)
     */
    SessionSnapshot startSession(InputStream stream, TranscriptionConfig config);

    /**
     * Starts a session.
     *
     * <p>The requested model is loaded synchronously before the session becomes active. The
     * stream, when given, is consumed asynchronously in fixed-size overlapping windows until it
     * ends; the session stays active afterwards until it is finalized or cancelled.
     *
     * @param stream inbound audio, or null to feed chunks only through {@link #processAudioChunk}
     * @param config session configuration, or null for the configured defaults
     * @param sink observer of this session's lifecycle, or null for the default sink
     * @return the active session
     * @throws com.phillippitts.livescribe.exception.ModelUnavailableException if the model cannot be loaded
     */
    SessionSnapshot startSession(InputStream stream, TranscriptionConfig config, SessionEventSink sink);

    /**
     * Runs one chunk through preprocessing, speaker attribution and transcription and appends
     * the resulting segment.
     *
     * @throws com.phillippitts.livescribe.exception.SessionNotActiveException if the session is not active
     * @throws com.phillippitts.livescribe.exception.TranscriptionException if transcription failed after fallback
     * @throws com.phillippitts.livescribe.exception.InvalidAudioException if the chunk is malformed
     */
    TranscriptSegment processAudioChunk(String sessionId, byte[] audio);

    /** Stops chunk intake; state is kept. Pausing a paused session is a no-op. */
    SessionSnapshot pauseSession(String sessionId);

    /** Resumes chunk intake. Resuming an active session is a no-op. */
    SessionSnapshot resumeSession(String sessionId);

    /**
     * Ends the session without a transcript. Safe while a chunk is in flight; that chunk's
     * result is discarded.
     */
    void cancelSession(String sessionId);

    /**
     * Completes the session and hands its transcript to post-processing. On failure the session
     * moves to {@code ERROR} and stays queryable through {@link #getTranscriptionSession}.
     */
    FullTranscript finalizeTranscript(String sessionId);

    /** Immutable view; equal across calls while no chunk is processed. */
    SessionSnapshot getTranscriptionSession(String sessionId);

    QualityMetricsSnapshot getQualityMetrics(String sessionId);

    /**
     * Merges two speakers into one with a new id and re-points their segments.
     *
     * @return the merged speaker
     */
    Speaker mergeSpeakers(String sessionId, String firstSpeakerId, String secondSpeakerId);

    /**
     * Enrolls a speaker from voice samples encoded in the session's audio format.
     *
     * @return the new speaker
     */
    Speaker createSpeakerProfile(String sessionId, String displayName, List<byte[]> samples);

    Speaker renameSpeaker(String sessionId, String speakerId, String displayName);

    /**
     * Makes {@code modelName} the session's active model after loading it.
     *
     * @throws com.phillippitts.livescribe.exception.ModelUnavailableException if the model cannot be loaded
     */
    SessionSnapshot switchModel(String sessionId, String modelName);

    Set<String> getActiveSessionIds();
}
