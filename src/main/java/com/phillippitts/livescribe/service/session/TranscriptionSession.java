package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.SessionSnapshot;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.Speaker;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.domain.TranscriptionConfig;
import com.phillippitts.livescribe.domain.TranscriptionError;
import com.phillippitts.livescribe.service.metrics.SessionQualityMetrics;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one session, owned by the {@link SessionRegistry}.
 *
 * <p><b>Locking:</b> the fair {@link #pipelineLock()} serializes whole chunk passes and speaker
 * edits in arrival order. Individual field reads and writes synchronize on this object and are
 * short, so snapshots and metrics stay readable while a chunk is in flight.
 */
final class TranscriptionSession {

    private final String id;
    private final TranscriptionConfig config;
    private final Instant startTime;
    private final SessionStateMachine state;
    private final SessionQualityMetrics metrics;
    private final SessionEventSink sink;
    private final ReentrantLock pipelineLock = new ReentrantLock(true);

    private final List<TranscriptSegment> segments = new ArrayList<>();
    private final Map<String, Speaker> speakers = new LinkedHashMap<>();
    private final Deque<String> fallbackModels;
    private final Set<String> modelsUsed = new LinkedHashSet<>();
    private String currentModel;
    private Instant endTime;
    private int errorCount;
    private TranscriptionError lastError;
    private int modelSwitches;
    private int retryCount;
    private long lastSegmentStart;
    private String connectionId;
    private AudioStreamConsumer consumer;

    TranscriptionSession(String id,
                         TranscriptionConfig config,
                         Instant startTime,
                         List<String> fallbackModels,
                         SessionQualityMetrics metrics,
                         SessionEventSink sink) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.startTime = Objects.requireNonNull(startTime, "startTime must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.fallbackModels = new ArrayDeque<>(fallbackModels);
        this.currentModel = config.modelName();
        this.state = new SessionStateMachine(id);
    }

    String id() {
        return id;
    }

    TranscriptionConfig config() {
        return config;
    }

    Instant startTime() {
        return startTime;
    }

    SessionStateMachine state() {
        return state;
    }

    SessionQualityMetrics metrics() {
        return metrics;
    }

    SessionEventSink sink() {
        return sink;
    }

    ReentrantLock pipelineLock() {
        return pipelineLock;
    }

    synchronized String currentModel() {
        return currentModel;
    }

    synchronized boolean hasFallback() {
        return !fallbackModels.isEmpty();
    }

    synchronized int errorCount() {
        return errorCount;
    }

    /**
     * Makes the head of the fallback list the active model.
     *
     * @return the new active model
     */
    synchronized String switchToNextFallback() {
        String next = fallbackModels.pollFirst();
        if (next == null) {
            throw new IllegalStateException("No fallback model left for session " + id);
        }
        currentModel = next;
        modelSwitches++;
        retryCount++;
        return next;
    }

    /** Manual switch; the replaced model becomes the last fallback. */
    synchronized String switchTo(String model) {
        String previous = currentModel;
        fallbackModels.remove(model);
        fallbackModels.addLast(previous);
        currentModel = model;
        modelSwitches++;
        return previous;
    }

    /**
     * Counts a failure and makes it the last error. The count is never reset.
     *
     * @return the error count after this failure
     */
    synchronized int recordFailure(TranscriptionError error) {
        errorCount++;
        lastError = error;
        return errorCount;
    }

    synchronized void recordLastError(TranscriptionError error) {
        lastError = error;
    }

    /**
     * Segment start for a chunk that arrived {@code arrivalOffsetMs} after session start,
     * clamped so starts never decrease.
     */
    synchronized long nextSegmentStart(long arrivalOffsetMs) {
        long start = Math.max(arrivalOffsetMs, lastSegmentStart);
        lastSegmentStart = start;
        return start;
    }

    /**
     * Appends a segment and credits it to its speaker when the speaker is known.
     *
     * @return the updated speaker, or empty when the segment is not attributed
     */
    synchronized Optional<Speaker> append(TranscriptSegment segment) {
        segments.add(segment);
        modelsUsed.add(segment.modelUsed());
        Speaker speaker = speakers.get(segment.speakerId());
        if (speaker == null) {
            return Optional.empty();
        }
        Speaker updated = speaker.withSegment(segment);
        speakers.put(updated.id(), updated);
        return Optional.of(updated);
    }

    synchronized boolean hasSpeakers() {
        return !speakers.isEmpty();
    }

    synchronized Collection<Speaker> speakers() {
        return List.copyOf(speakers.values());
    }

    synchronized Optional<Speaker> speaker(String speakerId) {
        return Optional.ofNullable(speakers.get(speakerId));
    }

    synchronized void putSpeaker(Speaker speaker) {
        speakers.put(speaker.id(), speaker);
    }

    /**
     * Replaces two speakers by their merge and re-points their segments.
     */
    synchronized void replaceSpeakers(String firstId, String secondId, Speaker merged) {
        speakers.remove(firstId);
        speakers.remove(secondId);
        speakers.put(merged.id(), merged);
        for (int i = 0; i < segments.size(); i++) {
            TranscriptSegment s = segments.get(i);
            if (s.speakerId().equals(firstId) || s.speakerId().equals(secondId)) {
                segments.set(i, s.withSpeakerId(merged.id()));
            }
        }
    }

    synchronized List<TranscriptSegment> segments() {
        return List.copyOf(segments);
    }

    synchronized List<String> modelsUsedInOrder() {
        return List.copyOf(modelsUsed);
    }

    synchronized int modelSwitches() {
        return modelSwitches;
    }

    synchronized int retryCount() {
        return retryCount;
    }

    synchronized void markEnded(Instant when) {
        if (endTime == null) {
            endTime = when;
        }
    }

    synchronized Instant endTime() {
        return endTime;
    }

    synchronized String connectionId() {
        return connectionId;
    }

    synchronized void attachConnection(String connectionId) {
        this.connectionId = connectionId;
    }

    synchronized AudioStreamConsumer consumer() {
        return consumer;
    }

    synchronized void attachConsumer(AudioStreamConsumer consumer) {
        this.consumer = consumer;
    }

    /** Stops stream consumption and drops buffered audio. */
    void stopConsumer() {
        AudioStreamConsumer c = consumer();
        if (c != null) {
            c.stop();
        }
    }

    synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(id, config, state.current(), startTime, endTime,
                segments, List.copyOf(speakers.values()), errorCount, lastError,
                currentModel, List.copyOf(fallbackModels));
    }

    SessionStatus status() {
        return state.current();
    }
}
