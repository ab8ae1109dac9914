package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.config.properties.AudioValidationProperties;
import com.phillippitts.livescribe.config.properties.DiarizationProperties;
import com.phillippitts.livescribe.config.properties.DistributionProperties;
import com.phillippitts.livescribe.config.properties.ModelClientProperties;
import com.phillippitts.livescribe.config.properties.PreprocessingProperties;
import com.phillippitts.livescribe.config.properties.TranscriptionProperties;
import com.phillippitts.livescribe.domain.FullTranscript;
import com.phillippitts.livescribe.domain.SessionSnapshot;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.Speaker;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.domain.TranscriptionConfig;
import com.phillippitts.livescribe.domain.TranscriptionErrorCode;
import com.phillippitts.livescribe.exception.InvalidAudioException;
import com.phillippitts.livescribe.exception.ModelUnavailableException;
import com.phillippitts.livescribe.exception.SessionClosedException;
import com.phillippitts.livescribe.exception.SessionNotActiveException;
import com.phillippitts.livescribe.exception.SessionNotFoundException;
import com.phillippitts.livescribe.exception.SpeakerDiarizationException;
import com.phillippitts.livescribe.exception.TranscriptionException;
import com.phillippitts.livescribe.service.audio.preprocess.DefaultAudioPreprocessor;
import com.phillippitts.livescribe.service.diarization.DefaultSpeakerDiarizationEngine;
import com.phillippitts.livescribe.service.distribution.DefaultDistributionHub;
import com.phillippitts.livescribe.service.distribution.MessageType;
import com.phillippitts.livescribe.service.metrics.QualityMetricsAggregator;
import com.phillippitts.livescribe.service.metrics.QualityMetricsSnapshot;
import com.phillippitts.livescribe.service.metrics.TranscriptionMetrics;
import com.phillippitts.livescribe.service.model.DefaultModelTranscriptionClient;
import com.phillippitts.livescribe.service.postprocessing.PostProcessingRequest;
import com.phillippitts.livescribe.service.postprocessing.PostProcessingScheduler;
import com.phillippitts.livescribe.service.validation.AudioValidator;
import com.phillippitts.livescribe.testutil.EventCapturingPublisher;
import com.phillippitts.livescribe.testutil.FakeSpeechModelGateway;
import com.phillippitts.livescribe.testutil.MutableClock;
import com.phillippitts.livescribe.testutil.PcmFixtures;
import com.phillippitts.livescribe.testutil.RecordingSessionEventSink;
import com.phillippitts.livescribe.testutil.RecordingSubscriberChannel;
import com.phillippitts.livescribe.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Drives the session manager end to end with real pipeline components and a scripted model gateway.
 */
class DefaultTranscriptionSessionManagerTest {

    private static final String PRIMARY = "model-a";
    private static final String SECONDARY = "model-b";
    private static final String TERTIARY = "model-c";
    private static final int CHUNK = 16_384;

    private FakeSpeechModelGateway gateway;
    private MutableClock clock;
    private DefaultDistributionHub hub;
    private RecordingSessionEventSink sink;
    private List<PostProcessingRequest> scheduled;
    private PostProcessingScheduler scheduler;
    private ExecutorService sessionExecutor;
    private TranscriptionProperties transcriptionProps;
    private PreprocessingProperties preprocessingProps;
    private DefaultTranscriptionSessionManager manager;

    @BeforeEach
    void setUp() {
        gateway = new FakeSpeechModelGateway();
        clock = new MutableClock();
        sink = new RecordingSessionEventSink();
        scheduled = new CopyOnWriteArrayList<>();
        scheduler = scheduled::add;
        sessionExecutor = Executors.newSingleThreadExecutor();
        preprocessingProps = new PreprocessingProperties();
        manager = buildManager();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        sessionExecutor.shutdownNow();
        sessionExecutor.awaitTermination(2, TimeUnit.SECONDS);
    }

    private DefaultTranscriptionSessionManager buildManager() {
        ModelClientProperties modelProps = new ModelClientProperties();
        modelProps.setModels(List.of(PRIMARY, SECONDARY, TERTIARY));
        modelProps.setLoadRetryBackoffMs(0);
        modelProps.setRateLimitBackoffMs(0);
        DefaultModelTranscriptionClient client = new DefaultModelTranscriptionClient(gateway, modelProps,
                new SyncExecutor(), new EventCapturingPublisher(), clock);

        transcriptionProps = new TranscriptionProperties();
        transcriptionProps.setModelName(PRIMARY);
        DiarizationProperties diarizationProps = new DiarizationProperties();
        DefaultSpeakerDiarizationEngine engine = new DefaultSpeakerDiarizationEngine(diarizationProps);
        QualityMetricsAggregator aggregator = new QualityMetricsAggregator(
                new TranscriptionMetrics(new SimpleMeterRegistry()));
        ChunkPipeline pipeline = new ChunkPipeline(new DefaultAudioPreprocessor(), preprocessingProps,
                engine, diarizationProps, client, aggregator, transcriptionProps, clock);
        hub = new DefaultDistributionHub(new DistributionProperties(), new SyncExecutor(), clock);

        return new DefaultTranscriptionSessionManager(new SessionRegistry(transcriptionProps), pipeline, client,
                engine, new AudioValidator(new AudioValidationProperties()), aggregator, hub,
                request -> scheduler.schedule(request), SessionEventSink.NOOP, transcriptionProps, modelProps,
                sessionExecutor, clock);
    }

    private TranscriptionConfig config(boolean diarization) {
        return TranscriptionConfig.builder()
                .modelName(PRIMARY)
                .meetingId("meeting-1")
                .chunkSize(CHUNK)
                .overlapSize(2_048)
                .enableDiarization(diarization)
                .build();
    }

    private SessionSnapshot start() {
        return manager.startSession(null, config(false), sink);
    }

    private static boolean settlesWithin(CompletableFuture<?> future, long millis) {
        try {
            future.get(millis, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private static Speaker speaker(SessionSnapshot session, String id) {
        return session.speakers().stream()
                .filter(s -> s.id().equals(id))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void emptyStreamStartsActiveSessionWithoutSegments() {
        SessionSnapshot session = manager.startSession(new ByteArrayInputStream(new byte[0]), config(true), sink);

        assertThat(session.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(session.segments()).isEmpty();
        assertThat(session.currentModel()).isEqualTo(PRIMARY);
        assertThat(session.fallbackModels()).containsExactly(SECONDARY, TERTIARY);
        assertThat(sink.started).hasSize(1);
        assertThat(sink.statuses).containsExactly(SessionStatus.ACTIVE);
        assertThat(manager.getActiveSessionIds()).containsExactly(session.id());
    }

    @Test
    void silentChunkIsAttributedToUnknownSpeaker() {
        gateway.respond(PRIMARY, "", 0.42);
        SessionSnapshot session = manager.startSession(null, config(true), sink);

        TranscriptSegment segment = manager.processAudioChunk(session.id(), new byte[CHUNK]);

        assertThat(segment.speakerId()).isEqualTo(TranscriptSegment.UNKNOWN_SPEAKER);
        assertThat(segment.confidence()).isEqualTo(0.42);
        assertThat(segment.audioChunkId()).isNotBlank();
        assertThat(segment.modelUsed()).isEqualTo(PRIMARY);
        assertThat(segment.durationMs()).isEqualTo(512);
        assertThat(sink.segments).containsExactly(segment);
        assertThat(manager.getTranscriptionSession(session.id()).segments()).containsExactly(segment);
    }

    @Test
    void mergingEnrolledSpeakersSumsSampleCounts() {
        SessionSnapshot session = start();
        Speaker alice = manager.createSpeakerProfile(session.id(), "Alice",
                List.of(PcmFixtures.voice(1_000), PcmFixtures.voice(1_000)));
        Speaker bob = manager.createSpeakerProfile(session.id(), "Bob",
                List.of(PcmFixtures.tone(1_000, 440, 0.3)));

        Speaker merged = manager.mergeSpeakers(session.id(), alice.id(), bob.id());

        assertThat(merged.voiceProfile().sampleCount()).isEqualTo(3);
        assertThat(merged.displayName()).isEqualTo("Alice");
        assertThat(manager.getTranscriptionSession(session.id()).speakers())
                .extracting(Speaker::id)
                .containsExactly(merged.id());
    }

    @Test
    void firstVoicedChunkSeedsSpeakerAndRepeatIsIdentified() {
        // raw level keeps the chunk above the voice activity threshold
        preprocessingProps.setVolumeNormalization(false);
        SessionSnapshot session = manager.startSession(null, config(true), sink);

        TranscriptSegment first = manager.processAudioChunk(session.id(), PcmFixtures.voice(1_500));
        TranscriptSegment second = manager.processAudioChunk(session.id(), PcmFixtures.voice(1_500));

        assertThat(first.speakerId()).isEqualTo("speaker_1");
        assertThat(second.speakerId()).isEqualTo("speaker_1");
        SessionSnapshot after = manager.getTranscriptionSession(session.id());
        Speaker seeded = speaker(after, "speaker_1");
        assertThat(after.speakers()).hasSize(1);
        assertThat(seeded.totalSpeakingTimeMs()).isEqualTo(first.durationMs() + second.durationMs());
        assertThat(seeded.totalSpeakingTimeMs()).isEqualTo(3_000);
        assertThat(seeded.segmentIds()).containsExactly(first.id(), second.id());
        assertThat(seeded.voiceProfile().sampleCount()).isEqualTo(2);
    }

    @Test
    void enrolledSpeakerIsIdentified() {
        SessionSnapshot session = manager.startSession(null, config(true), sink);
        Speaker alice = manager.createSpeakerProfile(session.id(), "Alice", List.of(PcmFixtures.voice(512)));

        TranscriptSegment segment = manager.processAudioChunk(session.id(), PcmFixtures.voice(512));

        assertThat(segment.speakerId()).isEqualTo(alice.id());
        Speaker credited = speaker(manager.getTranscriptionSession(session.id()), alice.id());
        assertThat(credited.totalSpeakingTimeMs()).isEqualTo(512);
        assertThat(credited.segmentIds()).containsExactly(segment.id());
        assertThat(credited.displayName()).isEqualTo("Alice");
    }

    @Test
    void mergeRepointsAttributedSegments() {
        preprocessingProps.setVolumeNormalization(false);
        SessionSnapshot session = manager.startSession(null, config(true), sink);
        TranscriptSegment first = manager.processAudioChunk(session.id(), PcmFixtures.voice(1_500));
        TranscriptSegment second = manager.processAudioChunk(session.id(), PcmFixtures.voice(1_500));
        Speaker bob = manager.createSpeakerProfile(session.id(), "Bob", List.of(PcmFixtures.tone(1_500, 440, 0.3)));

        Speaker merged = manager.mergeSpeakers(session.id(), "speaker_1", bob.id());

        SessionSnapshot after = manager.getTranscriptionSession(session.id());
        assertThat(after.segments()).extracting(TranscriptSegment::speakerId).containsOnly(merged.id());
        assertThat(after.speakers()).extracting(Speaker::id).containsExactly(merged.id());
        assertThat(merged.segmentIds()).containsExactly(first.id(), second.id());
        assertThat(merged.totalSpeakingTimeMs()).isEqualTo(first.durationMs() + second.durationMs());
        assertThat(merged.displayName()).isEqualTo("Bob");
    }

    @Test
    void silentEnrollmentIsRejected() {
        SessionSnapshot session = start();

        assertThatThrownBy(() -> manager.createSpeakerProfile(session.id(), "Quiet",
                List.of(PcmFixtures.silence(1_000))))
                .isInstanceOf(SpeakerDiarizationException.class);

        assertThat(manager.getTranscriptionSession(session.id()).speakers()).isEmpty();
    }

    @Test
    void renameAndUnknownSpeaker() {
        SessionSnapshot session = start();
        Speaker alice = manager.createSpeakerProfile(session.id(), null, List.of(PcmFixtures.voice(1_000)));

        Speaker renamed = manager.renameSpeaker(session.id(), alice.id(), "Alice");

        assertThat(renamed.displayName()).isEqualTo("Alice");
        assertThatThrownBy(() -> manager.renameSpeaker(session.id(), "speaker_missing", "X"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pausedSessionRejectsChunks() {
        SessionSnapshot session = start();

        manager.pauseSession(session.id());

        assertThatThrownBy(() -> manager.processAudioChunk(session.id(), new byte[CHUNK]))
                .isInstanceOf(SessionNotActiveException.class);
        assertThat(gateway.transcribeCalls(PRIMARY)).isZero();
    }

    @Test
    void pauseAndResumeAreIdempotent() {
        SessionSnapshot session = start();

        manager.pauseSession(session.id());
        SessionSnapshot paused = manager.pauseSession(session.id());
        manager.resumeSession(session.id());
        SessionSnapshot resumed = manager.resumeSession(session.id());

        assertThat(paused.status()).isEqualTo(SessionStatus.PAUSED);
        assertThat(resumed.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(sink.statuses).containsExactly(SessionStatus.ACTIVE, SessionStatus.PAUSED, SessionStatus.ACTIVE);
        assertThat(manager.processAudioChunk(session.id(), new byte[CHUNK])).isNotNull();
    }

    @Test
    void failedModelFallsBackAndRetriesChunkOnce() {
        gateway.failAlways(PRIMARY, TranscriptionErrorCode.MODEL_TIMEOUT);
        gateway.respond(SECONDARY, "from fallback", 0.8);
        SessionSnapshot session = start();

        TranscriptSegment segment = manager.processAudioChunk(session.id(), new byte[CHUNK]);

        assertThat(segment.modelUsed()).isEqualTo(SECONDARY);
        assertThat(segment.text()).isEqualTo("from fallback");
        SessionSnapshot after = manager.getTranscriptionSession(session.id());
        assertThat(after.currentModel()).isEqualTo(SECONDARY);
        assertThat(after.errorCount()).isEqualTo(1);
        assertThat(after.lastError().code()).isEqualTo(TranscriptionErrorCode.MODEL_TIMEOUT);
        assertThat(sink.failures).extracting(e -> e.code()).containsExactly(TranscriptionErrorCode.MODEL_TIMEOUT);

        FullTranscript transcript = manager.finalizeTranscript(session.id());
        assertThat(transcript.modelMetadata().primaryModel()).isEqualTo(PRIMARY);
        assertThat(transcript.modelMetadata().fallbackModelsUsed()).containsExactly(SECONDARY);
        assertThat(transcript.modelMetadata().processingStats().modelSwitches()).isEqualTo(1);
        assertThat(transcript.modelMetadata().processingStats().retryCount()).isEqualTo(1);
        assertThat(transcript.modelMetadata().processingStats().errorCount()).isEqualTo(1);
    }

    @Test
    void errorBudgetStopsFurtherFallback() {
        gateway.failAlways(PRIMARY, TranscriptionErrorCode.NETWORK_ERROR);
        gateway.failAlways(SECONDARY, TranscriptionErrorCode.NETWORK_ERROR);
        gateway.failAlways(TERTIARY, TranscriptionErrorCode.NETWORK_ERROR);
        SessionSnapshot session = start();

        assertThatThrownBy(() -> manager.processAudioChunk(session.id(), new byte[CHUNK]))
                .isInstanceOf(TranscriptionException.class);
        assertThatThrownBy(() -> manager.processAudioChunk(session.id(), new byte[CHUNK]))
                .isInstanceOf(TranscriptionException.class);

        SessionSnapshot after = manager.getTranscriptionSession(session.id());
        assertThat(after.errorCount()).isEqualTo(3);
        assertThat(after.currentModel()).isEqualTo(SECONDARY);
        assertThat(after.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(gateway.transcribeCalls(TERTIARY)).isZero();
    }

    @Test
    void invalidAudioIsCountedAndSurfaced() {
        SessionSnapshot session = start();

        assertThatThrownBy(() -> manager.processAudioChunk(session.id(), new byte[3]))
                .isInstanceOf(InvalidAudioException.class);

        SessionSnapshot after = manager.getTranscriptionSession(session.id());
        assertThat(after.errorCount()).isEqualTo(1);
        assertThat(after.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(sink.failures).extracting(e -> e.code())
                .containsExactly(TranscriptionErrorCode.INVALID_AUDIO_FORMAT);
        assertThat(gateway.transcribeCalls(PRIMARY)).isZero();
    }

    @Test
    void finalizeCompletesAndHandsOffTranscript() {
        gateway.respond(PRIMARY, "one two three", 0.9);
        SessionSnapshot session = start();
        RecordingSubscriberChannel subscriber = new RecordingSubscriberChannel();
        hub.subscribe(session.id(), subscriber);
        manager.processAudioChunk(session.id(), new byte[CHUNK]);
        clock.advance(Duration.ofSeconds(2));
        manager.processAudioChunk(session.id(), new byte[CHUNK]);

        FullTranscript transcript = manager.finalizeTranscript(session.id());

        assertThat(transcript.sessionId()).isEqualTo(session.id());
        assertThat(transcript.meetingId()).isEqualTo("meeting-1");
        assertThat(transcript.segments()).hasSize(2);
        assertThat(transcript.segments().get(1).startTimestamp()).isEqualTo(2_000);
        assertThat(transcript.durationMs()).isEqualTo(2_000);
        assertThat(transcript.modelMetadata().totalTokens()).isEqualTo(6);
        assertThat(transcript.modelMetadata().apiCalls()).isEqualTo(2);
        assertThat(transcript.modelMetadata().fallbackModelsUsed()).isEmpty();
        assertThat(scheduled).singleElement().satisfies(r -> {
            assertThat(r.transcriptId()).isEqualTo(transcript.id());
            assertThat(r.segmentCount()).isEqualTo(2);
        });
        assertThat(sink.completed).containsExactly(transcript);
        assertThat(subscriber.types()).containsExactly(MessageType.SEGMENT, MessageType.SEGMENT,
                MessageType.STATUS, MessageType.COMPLETE);
        assertThat(subscriber.isOpen()).isFalse();
        assertThat(manager.getActiveSessionIds()).isEmpty();
    }

    @Test
    void operationsAfterFinalizeReportClosedSession() {
        SessionSnapshot session = start();
        manager.finalizeTranscript(session.id());

        assertThatThrownBy(() -> manager.processAudioChunk(session.id(), new byte[CHUNK]))
                .isInstanceOf(SessionClosedException.class);
        assertThatThrownBy(() -> manager.finalizeTranscript(session.id()))
                .isInstanceOf(SessionClosedException.class);
        assertThatThrownBy(() -> manager.getTranscriptionSession(session.id()))
                .isInstanceOf(SessionClosedException.class);
        assertThatThrownBy(() -> manager.pauseSession("never-started"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void failedHandoffMovesSessionToErrorAndKeepsItQueryable() {
        SessionSnapshot session = start();
        manager.processAudioChunk(session.id(), new byte[CHUNK]);
        scheduler = request -> {
            throw new IllegalStateException("post-processing queue down");
        };

        assertThatThrownBy(() -> manager.finalizeTranscript(session.id()))
                .isInstanceOf(IllegalStateException.class);

        SessionSnapshot failed = manager.getTranscriptionSession(session.id());
        assertThat(failed.status()).isEqualTo(SessionStatus.ERROR);
        assertThat(failed.segments()).hasSize(1);
        assertThat(failed.lastError()).isNotNull();
        assertThat(failed.endTime()).isNotNull();
        assertThat(sink.statuses).endsWith(SessionStatus.ERROR);
        assertThat(sink.completed).isEmpty();
    }

    @Test
    void cancelDiscardsInFlightChunk() throws Exception {
        SessionSnapshot session = start();
        gateway.delayMs = 300;

        CompletableFuture<TranscriptSegment> inFlight = CompletableFuture.supplyAsync(
                () -> manager.processAudioChunk(session.id(), new byte[CHUNK]));
        await().atMost(Duration.ofSeconds(2)).until(() -> gateway.transcribeCalls(PRIMARY) == 1);

        manager.cancelSession(session.id());

        assertThatThrownBy(inFlight::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(SessionClosedException.class);
        assertThat(sink.segments).isEmpty();
        assertThat(sink.statuses).containsExactly(SessionStatus.ACTIVE, SessionStatus.CANCELLED);
        assertThatThrownBy(() -> manager.getTranscriptionSession(session.id()))
                .isInstanceOf(SessionClosedException.class);
    }

    @Test
    void cancelWaitsForSegmentBeingReported() {
        List<CompletableFuture<Void>> cancels = new CopyOnWriteArrayList<>();
        AtomicBoolean cancelSettledEarly = new AtomicBoolean();
        RecordingSessionEventSink reporting = new RecordingSessionEventSink() {
            @Override
            public void onSegmentProcessed(String sessionId, TranscriptSegment segment) {
                super.onSegmentProcessed(sessionId, segment);
                CompletableFuture<Void> cancel = CompletableFuture.runAsync(() -> manager.cancelSession(sessionId));
                cancels.add(cancel);
                cancelSettledEarly.set(settlesWithin(cancel, 200));
            }
        };
        SessionSnapshot session = manager.startSession(null, config(false), reporting);

        TranscriptSegment segment = manager.processAudioChunk(session.id(), new byte[CHUNK]);

        assertThat(cancelSettledEarly).isFalse();
        cancels.get(0).join();
        assertThat(reporting.segments).containsExactly(segment);
        assertThat(reporting.statuses).containsExactly(SessionStatus.ACTIVE, SessionStatus.CANCELLED);
        assertThatThrownBy(() -> manager.getTranscriptionSession(session.id()))
                .isInstanceOf(SessionClosedException.class);
    }

    @Test
    void cancelDuringHandoffLeavesSessionCompleted() {
        SessionSnapshot session = start();
        manager.processAudioChunk(session.id(), new byte[CHUNK]);
        List<CompletableFuture<Void>> cancels = new CopyOnWriteArrayList<>();
        AtomicBoolean cancelSettledEarly = new AtomicBoolean();
        scheduler = request -> {
            CompletableFuture<Void> cancel = CompletableFuture.runAsync(() -> manager.cancelSession(session.id()));
            cancels.add(cancel);
            cancelSettledEarly.set(settlesWithin(cancel, 200));
            scheduled.add(request);
        };

        FullTranscript transcript = manager.finalizeTranscript(session.id());

        assertThat(cancelSettledEarly).isFalse();
        assertThatThrownBy(cancels.get(0)::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(SessionClosedException.class);
        assertThat(transcript.segments()).hasSize(1);
        assertThat(scheduled).singleElement().satisfies(r -> assertThat(r.transcriptId()).isEqualTo(transcript.id()));
        assertThat(sink.statuses).containsExactly(SessionStatus.ACTIVE, SessionStatus.COMPLETED);
        assertThat(sink.completed).containsExactly(transcript);
    }

    @Test
    void modelLoadFailureFailsStart() {
        gateway.failLoads(PRIMARY);

        assertThatThrownBy(() -> manager.startSession(null, config(false), sink))
                .isInstanceOf(ModelUnavailableException.class);

        assertThat(sink.statuses).containsExactly(SessionStatus.ERROR);
        assertThat(sink.started).isEmpty();
        assertThat(manager.getActiveSessionIds()).isEmpty();
    }

    @Test
    void switchModelLoadsAndRequeuesPreviousModel() {
        SessionSnapshot session = start();

        SessionSnapshot switched = manager.switchModel(session.id(), TERTIARY);

        assertThat(switched.currentModel()).isEqualTo(TERTIARY);
        assertThat(switched.fallbackModels()).containsExactly(SECONDARY, PRIMARY);
        assertThat(gateway.loadCalls(TERTIARY)).isEqualTo(1);
        assertThat(manager.processAudioChunk(session.id(), new byte[CHUNK]).modelUsed()).isEqualTo(TERTIARY);
    }

    @Test
    void switchToUnloadableModelKeepsCurrentModel() {
        SessionSnapshot session = start();
        gateway.failLoads(SECONDARY);

        assertThatThrownBy(() -> manager.switchModel(session.id(), SECONDARY))
                .isInstanceOf(ModelUnavailableException.class);

        assertThat(manager.getTranscriptionSession(session.id()).currentModel()).isEqualTo(PRIMARY);
    }

    @Test
    void qualityMetricsTrackAttempts() {
        gateway.respond(PRIMARY, "hi", 0.8);
        SessionSnapshot session = start();
        manager.processAudioChunk(session.id(), new byte[CHUNK]);

        QualityMetricsSnapshot metrics = manager.getQualityMetrics(session.id());

        assertThat(metrics.totalAttempts()).isEqualTo(1);
        assertThat(metrics.successRate()).isEqualTo(1.0);
        assertThat(metrics.averageConfidence()).isEqualTo(0.4);
    }

    @Test
    void failingSinkDoesNotAffectSession() {
        SessionEventSink throwing = new SessionEventSink() {
            @Override
            public void onSegmentProcessed(String sessionId, TranscriptSegment segment) {
                throw new IllegalStateException("sink broken");
            }
        };
        SessionSnapshot session = manager.startSession(null, config(false), throwing);

        assertThat(manager.processAudioChunk(session.id(), new byte[CHUNK])).isNotNull();
        assertThat(manager.getTranscriptionSession(session.id()).segments()).hasSize(1);
    }

    @Test
    void snapshotIsStableWithoutNewChunks() {
        SessionSnapshot session = start();
        manager.processAudioChunk(session.id(), new byte[CHUNK]);

        assertThat(manager.getTranscriptionSession(session.id()))
                .isEqualTo(manager.getTranscriptionSession(session.id()));
    }

    @Test
    void streamIsWindowedAndTranscribedInOrder() {
        byte[] stream = new byte[3 * CHUNK];
        SessionSnapshot session = manager.startSession(new ByteArrayInputStream(stream), config(false), sink);

        // windows at 16384, 30720 and 45056 bytes, then a 6144 byte remainder
        await().atMost(Duration.ofSeconds(5)).until(() -> sink.segments.size() == 4);

        FullTranscript transcript = manager.finalizeTranscript(session.id());
        assertThat(transcript.segments()).hasSize(4);
        assertThat(transcript.segments().get(3).durationMs()).isEqualTo(192);
        assertThat(transcript.segments()).isSortedAccordingTo(
                (a, b) -> Long.compare(a.startTimestamp(), b.startTimestamp()));
    }

    @Test
    void finalizeWaitsForWindowsAlreadyRead() {
        gateway.delayMs = 100;
        SessionSnapshot session = manager.startSession(new ByteArrayInputStream(new byte[3 * CHUNK]), config(false),
                sink);
        await().atMost(Duration.ofSeconds(2)).until(() -> gateway.transcribeCalls(PRIMARY) >= 1);

        FullTranscript transcript = manager.finalizeTranscript(session.id());

        assertThat(transcript.segments()).hasSize(4);
        assertThat(sink.segments).hasSize(4);
        assertThat(sink.statuses).containsExactly(SessionStatus.ACTIVE, SessionStatus.COMPLETED);
    }

    @Test
    void finalizeGivesUpOnStreamThatStaysOpen() throws Exception {
        transcriptionProps.setFinalizeDrainTimeoutMs(200);
        PipedOutputStream writer = new PipedOutputStream();
        PipedInputStream reader = new PipedInputStream(writer, 4 * CHUNK);
        SessionSnapshot session = manager.startSession(reader, config(false), sink);
        writer.write(new byte[CHUNK]);
        await().atMost(Duration.ofSeconds(2)).until(() -> sink.segments.size() == 1);

        long startNanos = System.nanoTime();
        FullTranscript transcript = manager.finalizeTranscript(session.id());

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)).isLessThan(2_000);
        assertThat(transcript.segments()).hasSize(1);
        writer.close();
    }
}
