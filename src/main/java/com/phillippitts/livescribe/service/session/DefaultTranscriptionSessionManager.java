package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.config.logging.SessionLogContext;
import com.phillippitts.livescribe.config.properties.ModelClientProperties;
import com.phillippitts.livescribe.config.properties.TranscriptionProperties;
import com.phillippitts.livescribe.domain.AudioChunk;
import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.domain.FullTranscript;
import com.phillippitts.livescribe.domain.ModelMetadata;
import com.phillippitts.livescribe.domain.ProcessingStats;
import com.phillippitts.livescribe.domain.SessionSnapshot;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.Speaker;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.domain.TranscriptionConfig;
import com.phillippitts.livescribe.domain.TranscriptionError;
import com.phillippitts.livescribe.domain.TranscriptionErrorCode;
import com.phillippitts.livescribe.domain.TranscriptionResult;
import com.phillippitts.livescribe.exception.InvalidAudioException;
import com.phillippitts.livescribe.exception.LiveScribeException;
import com.phillippitts.livescribe.exception.SessionClosedException;
import com.phillippitts.livescribe.exception.TranscriptionException;
import com.phillippitts.livescribe.service.diarization.SpeakerDiarizationEngine;
import com.phillippitts.livescribe.service.distribution.DistributionHub;
import com.phillippitts.livescribe.service.distribution.TranscriptionMessage;
import com.phillippitts.livescribe.service.metrics.QualityMetricsAggregator;
import com.phillippitts.livescribe.service.metrics.QualityMetricsSnapshot;
import com.phillippitts.livescribe.service.model.ErrorClassifier;
import com.phillippitts.livescribe.service.model.ModelTranscriptionClient;
import com.phillippitts.livescribe.service.postprocessing.PostProcessingRequest;
import com.phillippitts.livescribe.service.postprocessing.PostProcessingScheduler;
import com.phillippitts.livescribe.service.validation.AudioValidator;
import com.phillippitts.livescribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Default {@link TranscriptionSessionManager}.
 *
 * <p><b>Side effects:</b> after every state change the manager calls the session's
 * {@link SessionEventSink} and broadcasts to the session's distribution channel, in that order,
 * on the calling thread. Sink failures are logged and never affect the session.
 *
 * <p><b>Concurrency:</b> chunk passes, finalize and speaker edits hold the session's pipeline
 * lock. Pause, resume and cancel only touch the state machine, so they never wait for an
 * in-flight model call. Appending a segment and the post-processing handoff run under the state
 * machine's lock, so a cancel waits for them and never interleaves.
 */
@Service
public class DefaultTranscriptionSessionManager implements TranscriptionSessionManager {

    private static final Logger LOG = LogManager.getLogger(DefaultTranscriptionSessionManager.class);

    private final SessionRegistry registry;
    private final ChunkPipeline pipeline;
    private final ModelTranscriptionClient client;
    private final SpeakerDiarizationEngine diarizationEngine;
    private final AudioValidator validator;
    private final QualityMetricsAggregator aggregator;
    private final DistributionHub hub;
    private final PostProcessingScheduler postProcessing;
    private final SessionEventSink defaultSink;
    private final TranscriptionProperties properties;
    private final ModelClientProperties modelProperties;
    private final Executor sessionExecutor;
    private final Clock clock;

    public DefaultTranscriptionSessionManager(SessionRegistry registry,
                                              ChunkPipeline pipeline,
                                              ModelTranscriptionClient client,
                                              SpeakerDiarizationEngine diarizationEngine,
                                              AudioValidator validator,
                                              QualityMetricsAggregator aggregator,
                                              DistributionHub hub,
                                              PostProcessingScheduler postProcessing,
                                              SessionEventSink defaultSink,
                                              TranscriptionProperties properties,
                                              ModelClientProperties modelProperties,
                                              @Qualifier("sessionExecutor") Executor sessionExecutor,
                                              Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.diarizationEngine = Objects.requireNonNull(diarizationEngine, "diarizationEngine must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.hub = Objects.requireNonNull(hub, "hub must not be null");
        this.postProcessing = Objects.requireNonNull(postProcessing, "postProcessing must not be null");
        this.defaultSink = Objects.requireNonNull(defaultSink, "defaultSink must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.modelProperties = Objects.requireNonNull(modelProperties, "modelProperties must not be null");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public SessionSnapshot startSession(InputStream stream, TranscriptionConfig config) {
        return startSession(stream, config, null);
    }

    @Override
    public SessionSnapshot startSession(InputStream stream, TranscriptionConfig config, SessionEventSink sink) {
        TranscriptionConfig effective = config != null ? config : properties.toConfig();
        SessionEventSink effectiveSink = sink != null ? sink : defaultSink;
        String id = UUID.randomUUID().toString();

        try (SessionLogContext ignored = SessionLogContext.open(id)) {
            String model = effective.modelName();
            TranscriptionSession session = new TranscriptionSession(id, effective, clock.instant(),
                    client.fallbackModelsFor(model), aggregator.initialize(id, model), effectiveSink);
            try {
                registry.register(session);
            } catch (LiveScribeException e) {
                aggregator.remove(id);
                throw e;
            }

            try {
                client.ensureReady(model);
            } catch (TranscriptionException e) {
                LOG.error("Session start failed: model {} unavailable", model);
                fail(session, e.getErrorCode(), e);
                throw e;
            }

            session.attachConnection(hub.createConnection(id));
            SessionStatus previous = session.state().transitionTo(SessionStatus.ACTIVE);
            notifyStatus(session, previous, SessionStatus.ACTIVE);
            SessionSnapshot started = session.snapshot();
            notifySink(session, s -> s.onSessionStarted(started));

            if (stream != null) {
                startConsumer(session, stream);
            }
            LOG.info("Session started: model={}, chunkSize={}, overlap={}, diarization={}",
                    model, effective.chunkSize(), effective.overlapSize(), effective.enableDiarization());
            return session.snapshot();
        }
    }

    private void startConsumer(TranscriptionSession session, InputStream stream) {
        TranscriptionConfig config = session.config();
        AudioStreamConsumer consumer = new AudioStreamConsumer(session.id(), stream,
                new AudioChunker(config.chunkSize(), config.overlapSize()), session.state(),
                window -> processChunk(session, window),
                properties.getStreamReadBufferBytes(), config.audioSpec().blockAlign());
        session.attachConsumer(consumer);
        try {
            sessionExecutor.execute(consumer);
        } catch (RejectedExecutionException e) {
            LOG.error("No capacity to consume the input stream");
            fail(session, TranscriptionErrorCode.UNKNOWN_ERROR, e);
            throw new LiveScribeException("No capacity to consume the input stream of session " + session.id(), e);
        }
    }

    @Override
    public TranscriptSegment processAudioChunk(String sessionId, byte[] audio) {
        return processChunk(registry.require(sessionId), audio);
    }

    private TranscriptSegment processChunk(TranscriptionSession session, byte[] audio) {
        try (SessionLogContext ignored = SessionLogContext.open(session.id())) {
            ReentrantLock lock = session.pipelineLock();
            lock.lock();
            try {
                session.state().requireActive();
                return runPipeline(session, audio);
            } finally {
                lock.unlock();
            }
        }
    }

    private TranscriptSegment runPipeline(TranscriptionSession session, byte[] audio) {
        long startNanos = System.nanoTime();
        AudioSpec spec;
        try {
            spec = validator.validate(audio, session.config().audioSpec());
        } catch (InvalidAudioException e) {
            TranscriptionError error = new TranscriptionError(TranscriptionErrorCode.INVALID_AUDIO_FORMAT,
                    e.getMessage(), null, clock.instant());
            session.recordFailure(error);
            notifyFailures(session, List.of(error));
            throw e;
        }

        long arrival = Math.max(0L, Duration.between(session.startTime(), clock.instant()).toMillis());
        AudioChunk chunk = new AudioChunk(audio, arrival, spec);
        ChunkContext context = new ChunkContext(session, chunk);
        try {
            pipeline.run(context);
        } catch (TranscriptionException e) {
            notifyFailures(session, context.failures());
            LOG.warn("Chunk {} failed: {}", chunk.getId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            TranscriptionError error = new TranscriptionError(TranscriptionErrorCode.UNKNOWN_ERROR,
                    e.getMessage(), session.currentModel(), clock.instant());
            session.recordFailure(error);
            context.failures().add(error);
            notifyFailures(session, context.failures());
            LOG.error("Chunk {} failed unexpectedly", chunk.getId(), e);
            throw e;
        }

        try {
            return session.state().whileOpen(() -> appendSegment(session, context, chunk, startNanos));
        } catch (SessionClosedException e) {
            LOG.info("Discarding result of chunk {}: session is {}", chunk.getId(), e.getStatus());
            throw e;
        }
    }

    /**
     * Appends the chunk's segment and reports it. Runs under the session's status lock, so a
     * cancel or finalize never lands between the append and its notifications.
     */
    private TranscriptSegment appendSegment(TranscriptionSession session, ChunkContext context, AudioChunk chunk,
                                            long startNanos) {
        notifyFailures(session, context.failures());

        TranscriptionResult result = context.result();
        long start = session.nextSegmentStart(chunk.getArrivalOffsetMs());
        TranscriptSegment segment = new TranscriptSegment(UUID.randomUUID().toString(), session.id(),
                start, start + chunk.getDurationMs(), context.speakerId(), result.text(), result.confidence(),
                result.modelName(), TimeUtils.elapsedMillis(startNanos), chunk.getId());
        session.append(segment);
        chunk.markProcessed(segment.id());

        if (segment.confidence() < session.config().confidenceThreshold()) {
            LOG.debug("Segment {} below confidence threshold: {}", segment.id(), segment.confidence());
        }
        notifySink(session, s -> s.onSegmentProcessed(session.id(), segment));
        hub.broadcast(session.id(), TranscriptionMessage.segment(session.id(), segment, clock.instant()));
        broadcastSpeakers(session, context, segment);
        return segment;
    }

    private void broadcastSpeakers(TranscriptionSession session, ChunkContext context, TranscriptSegment segment) {
        Set<String> touched = new LinkedHashSet<>();
        context.speakerUpdates().forEach(s -> touched.add(s.id()));
        if (!TranscriptSegment.UNKNOWN_SPEAKER.equals(segment.speakerId())) {
            touched.add(segment.speakerId());
        }
        for (String speakerId : touched) {
            session.speaker(speakerId).ifPresent(speaker -> hub.broadcast(session.id(),
                    TranscriptionMessage.speakerUpdate(session.id(), speaker, clock.instant())));
        }
    }

    @Override
    public SessionSnapshot pauseSession(String sessionId) {
        TranscriptionSession session = registry.require(sessionId);
        try (SessionLogContext ignored = SessionLogContext.open(sessionId)) {
            if (session.state().pause()) {
                LOG.info("Session paused");
                notifyStatus(session, SessionStatus.ACTIVE, SessionStatus.PAUSED);
            }
            return session.snapshot();
        }
    }

    @Override
    public SessionSnapshot resumeSession(String sessionId) {
        TranscriptionSession session = registry.require(sessionId);
        try (SessionLogContext ignored = SessionLogContext.open(sessionId)) {
            if (session.state().resume()) {
                LOG.info("Session resumed");
                notifyStatus(session, SessionStatus.PAUSED, SessionStatus.ACTIVE);
            }
            return session.snapshot();
        }
    }

    @Override
    public void cancelSession(String sessionId) {
        TranscriptionSession session = registry.require(sessionId);
        try (SessionLogContext ignored = SessionLogContext.open(sessionId)) {
            SessionStatus previous = session.state().transitionTo(SessionStatus.CANCELLED);
            session.markEnded(clock.instant());
            session.stopConsumer();
            notifyStatus(session, previous, SessionStatus.CANCELLED);
            release(session, SessionStatus.CANCELLED);
            LOG.info("Session cancelled after {} segments", session.segments().size());
        }
    }

    @Override
    public FullTranscript finalizeTranscript(String sessionId) {
        TranscriptionSession session = registry.require(sessionId);
        try (SessionLogContext ignored = SessionLogContext.open(sessionId)) {
            awaitStreamDrained(session);
            ReentrantLock lock = session.pipelineLock();
            lock.lock();
            try {
                SessionStatus status = session.status();
                if (status.isTerminal()) {
                    throw new SessionClosedException(sessionId, status);
                }
                session.stopConsumer();
                Instant end = clock.instant();

                FullTranscript transcript;
                SessionStatus previous;
                try {
                    transcript = assemble(session, end);
                    previous = session.state().whileOpen(() -> {
                        postProcessing.schedule(new PostProcessingRequest(sessionId, transcript.id(),
                                transcript.segments().size(), transcript.durationMs()));
                        return session.state().transitionTo(SessionStatus.COMPLETED);
                    });
                } catch (SessionClosedException e) {
                    LOG.info("Finalize abandoned: session became {}", e.getStatus());
                    throw e;
                } catch (RuntimeException e) {
                    LOG.error("Finalize failed", e);
                    fail(session, ErrorClassifier.classify(e), e);
                    throw e;
                }

                session.markEnded(end);
                notifyStatus(session, previous, SessionStatus.COMPLETED);
                hub.broadcast(sessionId, TranscriptionMessage.complete(sessionId, transcript, clock.instant()));
                notifySink(session, s -> s.onSessionCompleted(transcript));
                release(session, SessionStatus.COMPLETED);
                LOG.info("Session finalized: {} segments, {} speakers, {} ms",
                        transcript.segments().size(), transcript.speakers().size(), transcript.durationMs());
                return transcript;
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Lets the stream consumer deliver what it has read, up to the configured drain timeout. A
     * paused session's consumer cannot make progress, so it is not waited for.
     */
    private void awaitStreamDrained(TranscriptionSession session) {
        AudioStreamConsumer consumer = session.consumer();
        if (consumer == null) {
            return;
        }
        if (session.status() == SessionStatus.PAUSED) {
            LOG.info("Finalizing a paused session; unread input is dropped");
            return;
        }
        try {
            if (!consumer.awaitDrained(properties.getFinalizeDrainTimeoutMs())) {
                LOG.warn("Input stream still open after {} ms; finalizing without the rest",
                        properties.getFinalizeDrainTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the input stream to drain");
        }
    }

    private FullTranscript assemble(TranscriptionSession session, Instant end) {
        TranscriptionConfig config = session.config();
        List<TranscriptSegment> segments = session.segments();
        String primary = config.modelName();

        List<String> fallbacksUsed = session.modelsUsedInOrder().stream()
                .filter(m -> !m.equals(primary))
                .distinct()
                .toList();
        double averageConfidence = segments.stream().mapToDouble(TranscriptSegment::confidence).average().orElse(0.0);
        double averageProcessing = segments.stream().mapToLong(TranscriptSegment::processingTimeMs).average().orElse(0.0);
        long tokens = segments.stream().mapToLong(TranscriptSegment::wordCount).sum();

        ProcessingStats stats = new ProcessingStats(segments.size(), averageProcessing,
                session.modelSwitches(), session.errorCount(), session.retryCount());
        ModelMetadata metadata = new ModelMetadata(primary, fallbacksUsed, averageConfidence, stats,
                tokens, segments.size(), segments.size() * modelProperties.getCostPerCall());
        long durationMs = Duration.between(session.startTime(), end).toMillis();

        return new FullTranscript(UUID.randomUUID().toString(), session.id(), config.meetingId(), segments,
                List.copyOf(session.speakers()), durationMs, config.language(), metadata, end);
    }

    @Override
    public SessionSnapshot getTranscriptionSession(String sessionId) {
        return registry.find(sessionId)
                .map(TranscriptionSession::snapshot)
                .or(() -> registry.retainedSnapshot(sessionId))
                .orElseGet(() -> registry.require(sessionId).snapshot());
    }

    @Override
    public QualityMetricsSnapshot getQualityMetrics(String sessionId) {
        return registry.require(sessionId).metrics().snapshot();
    }

    @Override
    public Speaker mergeSpeakers(String sessionId, String firstSpeakerId, String secondSpeakerId) {
        TranscriptionSession session = registry.require(sessionId);
        return withPipelineLock(session, () -> {
            Speaker first = requireSpeaker(session, firstSpeakerId);
            Speaker second = requireSpeaker(session, secondSpeakerId);
            Speaker merged = diarizationEngine.mergeSpeakers(first, second);
            session.replaceSpeakers(firstSpeakerId, secondSpeakerId, merged);
            LOG.info("Merged speakers {} and {} into {}", firstSpeakerId, secondSpeakerId, merged.id());
            hub.broadcast(sessionId, TranscriptionMessage.speakerUpdate(sessionId, merged, clock.instant()));
            return merged;
        });
    }

    @Override
    public Speaker createSpeakerProfile(String sessionId, String displayName, List<byte[]> samples) {
        TranscriptionSession session = registry.require(sessionId);
        return withPipelineLock(session, () -> {
            Speaker speaker = new Speaker("speaker_" + UUID.randomUUID(), displayName,
                    diarizationEngine.createVoiceProfile(samples, session.config().audioSpec()),
                    0L, List.of(), 0.0);
            session.putSpeaker(speaker);
            LOG.info("Enrolled speaker {} from {} samples", speaker.id(), samples.size());
            hub.broadcast(sessionId, TranscriptionMessage.speakerUpdate(sessionId, speaker, clock.instant()));
            return speaker;
        });
    }

    @Override
    public Speaker renameSpeaker(String sessionId, String speakerId, String displayName) {
        TranscriptionSession session = registry.require(sessionId);
        return withPipelineLock(session, () -> {
            Speaker renamed = requireSpeaker(session, speakerId).withDisplayName(displayName);
            session.putSpeaker(renamed);
            hub.broadcast(sessionId, TranscriptionMessage.speakerUpdate(sessionId, renamed, clock.instant()));
            return renamed;
        });
    }

    @Override
    public SessionSnapshot switchModel(String sessionId, String modelName) {
        Objects.requireNonNull(modelName, "modelName must not be null");
        TranscriptionSession session = registry.require(sessionId);
        return withPipelineLock(session, () -> {
            if (modelName.equals(session.currentModel())) {
                return session.snapshot();
            }
            client.ensureReady(modelName);
            String previous = session.switchTo(modelName);
            aggregator.recordModelSwitch(previous, modelName);
            LOG.info("Model switched from {} to {}", previous, modelName);
            return session.snapshot();
        });
    }

    @Override
    public Set<String> getActiveSessionIds() {
        return registry.activeSessionIds();
    }

    private <T> T withPipelineLock(TranscriptionSession session, Supplier<T> action) {
        try (SessionLogContext ignored = SessionLogContext.open(session.id())) {
            ReentrantLock lock = session.pipelineLock();
            lock.lock();
            try {
                SessionStatus status = session.status();
                if (status.isTerminal()) {
                    throw new SessionClosedException(session.id(), status);
                }
                return action.get();
            } finally {
                lock.unlock();
            }
        }
    }

    private static Speaker requireSpeaker(TranscriptionSession session, String speakerId) {
        return session.speaker(speakerId).orElseThrow(() ->
                new IllegalArgumentException("Unknown speaker " + speakerId + " in session " + session.id()));
    }

    /**
     * Moves a session to ERROR, keeping its final snapshot queryable.
     */
    private void fail(TranscriptionSession session, TranscriptionErrorCode code, Throwable cause) {
        TranscriptionError error = new TranscriptionError(code, cause.getMessage(), session.currentModel(),
                clock.instant());
        session.recordLastError(error);
        SessionStatus previous;
        try {
            previous = session.state().transitionTo(SessionStatus.ERROR);
        } catch (SessionClosedException e) {
            LOG.debug("Session already closed as {}", e.getStatus());
            return;
        }
        session.markEnded(clock.instant());
        session.stopConsumer();
        notifyFailures(session, List.of(error));
        notifyStatus(session, previous, SessionStatus.ERROR);
        release(session, SessionStatus.ERROR);
    }

    private void release(TranscriptionSession session, SessionStatus terminal) {
        String connectionId = session.connectionId();
        if (connectionId != null) {
            hub.close(connectionId);
        }
        aggregator.remove(session.id());
        registry.evict(session.id(), terminal, session.snapshot());
    }

    private void notifyStatus(TranscriptionSession session, SessionStatus from, SessionStatus to) {
        notifySink(session, s -> s.onStatusChanged(session.id(), from, to));
        hub.broadcast(session.id(), TranscriptionMessage.status(session.id(), to, clock.instant()));
    }

    private void notifyFailures(TranscriptionSession session, List<TranscriptionError> errors) {
        for (TranscriptionError error : errors) {
            notifySink(session, s -> s.onChunkFailed(session.id(), error));
            hub.broadcast(session.id(), TranscriptionMessage.error(session.id(), error, clock.instant()));
        }
    }

    private static void notifySink(TranscriptionSession session, Consumer<SessionEventSink> call) {
        try {
            call.accept(session.sink());
        } catch (RuntimeException e) {
            LOG.warn("Session event sink failed: {}", e.toString());
        }
    }
}
