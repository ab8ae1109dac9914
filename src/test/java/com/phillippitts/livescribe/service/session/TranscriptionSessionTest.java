package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.SessionSnapshot;
import com.phillippitts.livescribe.domain.Speaker;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.domain.TranscriptionConfig;
import com.phillippitts.livescribe.domain.TranscriptionError;
import com.phillippitts.livescribe.domain.TranscriptionErrorCode;
import com.phillippitts.livescribe.domain.VoiceProfile;
import com.phillippitts.livescribe.service.metrics.SessionQualityMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptionSessionTest {

    private TranscriptionSession session;

    @BeforeEach
    void setUp() {
        TranscriptionConfig config = TranscriptionConfig.builder().modelName("model-a").build();
        session = new TranscriptionSession("s-1", config, Instant.EPOCH, List.of("model-b", "model-c"),
                new SessionQualityMetrics("model-a"), SessionEventSink.NOOP);
    }

    @Test
    void fallbackConsumesModelsInRankOrder() {
        assertThat(session.switchToNextFallback()).isEqualTo("model-b");
        assertThat(session.switchToNextFallback()).isEqualTo("model-c");

        assertThat(session.hasFallback()).isFalse();
        assertThatThrownBy(session::switchToNextFallback).isInstanceOf(IllegalStateException.class);
        assertThat(session.modelSwitches()).isEqualTo(2);
        assertThat(session.retryCount()).isEqualTo(2);
    }

    @Test
    void manualSwitchRequeuesPreviousModelLast() {
        session.switchTo("model-c");

        SessionSnapshot snapshot = session.snapshot();
        assertThat(snapshot.currentModel()).isEqualTo("model-c");
        assertThat(snapshot.fallbackModels()).containsExactly("model-b", "model-a");
        assertThat(session.retryCount()).isZero();
    }

    @Test
    void errorCountOnlyGrows() {
        session.recordFailure(error(TranscriptionErrorCode.MODEL_TIMEOUT));
        session.recordFailure(error(TranscriptionErrorCode.NETWORK_ERROR));
        session.recordLastError(error(TranscriptionErrorCode.UNKNOWN_ERROR));

        SessionSnapshot snapshot = session.snapshot();
        assertThat(snapshot.errorCount()).isEqualTo(2);
        assertThat(snapshot.lastError().code()).isEqualTo(TranscriptionErrorCode.UNKNOWN_ERROR);
    }

    @Test
    void segmentStartsNeverDecrease() {
        assertThat(session.nextSegmentStart(500)).isEqualTo(500);
        assertThat(session.nextSegmentStart(300)).isEqualTo(500);
        assertThat(session.nextSegmentStart(900)).isEqualTo(900);
    }

    @Test
    void appendCreditsKnownSpeakerOnly() {
        session.putSpeaker(speaker("speaker_1"));

        assertThat(session.append(segment("seg-1", "speaker_1"))).hasValueSatisfying(s ->
                assertThat(s.segmentIds()).containsExactly("seg-1"));
        assertThat(session.append(segment("seg-2", TranscriptSegment.UNKNOWN_SPEAKER))).isEmpty();
        assertThat(session.segments()).extracting(TranscriptSegment::id).containsExactly("seg-1", "seg-2");
    }

    @Test
    void replaceSpeakersRepointsSegments() {
        session.putSpeaker(speaker("speaker_1"));
        session.putSpeaker(speaker("speaker_2"));
        session.append(segment("seg-1", "speaker_1"));
        session.append(segment("seg-2", "speaker_2"));
        session.append(segment("seg-3", TranscriptSegment.UNKNOWN_SPEAKER));
        Speaker merged = speaker("speaker_merged");

        session.replaceSpeakers("speaker_1", "speaker_2", merged);

        assertThat(session.speakers()).extracting(Speaker::id).containsExactly("speaker_merged");
        assertThat(session.segments()).extracting(TranscriptSegment::speakerId)
                .containsExactly("speaker_merged", "speaker_merged", TranscriptSegment.UNKNOWN_SPEAKER);
    }

    @Test
    void snapshotsAreValueEqualWithoutChanges() {
        session.append(segment("seg-1", TranscriptSegment.UNKNOWN_SPEAKER));

        assertThat(session.snapshot()).isEqualTo(session.snapshot());
    }

    private static TranscriptionError error(TranscriptionErrorCode code) {
        return new TranscriptionError(code, code.name(), "model-a", Instant.EPOCH);
    }

    private static Speaker speaker(String id) {
        return Speaker.detected(id, VoiceProfile.of(new double[] {1, 0, 0}, 0.9, 1));
    }

    private static TranscriptSegment segment(String id, String speakerId) {
        return new TranscriptSegment(id, "s-1", 0, 1000, speakerId, "hi", 0.9, "model-a", 10, "chunk-" + id);
    }
}
