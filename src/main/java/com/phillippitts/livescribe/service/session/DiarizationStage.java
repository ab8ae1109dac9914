package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.Speaker;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.service.diarization.DiarizationConfig;
import com.phillippitts.livescribe.service.diarization.DiarizationResult;
import com.phillippitts.livescribe.service.diarization.DiarizedSpeaker;
import com.phillippitts.livescribe.service.diarization.SpeakerDiarizationEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.Optional;

/**
 * Attributes a chunk to a speaker.
 *
 * <p>Until the session knows any speaker, chunks go through full diarization and the detected
 * speakers seed the session; the chunk goes to the one with the most speaking time. Once
 * speakers exist, the chunk embedding is matched against their profiles and a match blends the
 * embedding into that profile. No voice, no match or any failure yields
 * {@value TranscriptSegment#UNKNOWN_SPEAKER}.
 */
final class DiarizationStage implements PipelineStage {

    private static final Logger LOG = LogManager.getLogger(DiarizationStage.class);

    private final SpeakerDiarizationEngine engine;
    private final DiarizationConfig config;

    DiarizationStage(SpeakerDiarizationEngine engine, DiarizationConfig config) {
        this.engine = engine;
        this.config = config;
    }

    @Override
    public StageKind kind() {
        return StageKind.DIARIZE;
    }

    @Override
    public boolean appliesTo(ChunkContext context) {
        return context.session().config().enableDiarization();
    }

    @Override
    public void apply(ChunkContext context) {
        try {
            String speakerId = context.session().hasSpeakers() ? identify(context) : seed(context);
            context.speakerId(speakerId);
        } catch (RuntimeException e) {
            LOG.warn("Speaker attribution failed for chunk {}; using {}: {}",
                    context.chunk().getId(), TranscriptSegment.UNKNOWN_SPEAKER, e.getMessage());
            context.speakerId(TranscriptSegment.UNKNOWN_SPEAKER);
        }
    }

    private String seed(ChunkContext context) {
        DiarizationResult result = engine.diarize(context.audio(), context.spec(), config);
        if (!result.hasSpeakers()) {
            return TranscriptSegment.UNKNOWN_SPEAKER;
        }
        TranscriptionSession session = context.session();
        for (DiarizedSpeaker detected : result.speakers()) {
            Speaker speaker = Speaker.detected(detected.id(), detected.voiceProfile());
            session.putSpeaker(speaker);
            context.speakerUpdates().add(speaker);
        }
        LOG.info("Seeded {} speakers (confidence {})", result.speakers().size(), result.confidence());
        return result.speakers().stream()
                .max(Comparator.comparingDouble(DiarizedSpeaker::speakingTimeSeconds))
                .map(DiarizedSpeaker::id)
                .orElse(TranscriptSegment.UNKNOWN_SPEAKER);
    }

    private String identify(ChunkContext context) {
        TranscriptionSession session = context.session();
        double[] embedding = engine.extractEmbedding(context.audio(), context.spec());
        Optional<String> match = engine.identifySpeaker(embedding, session.speakers());
        if (match.isEmpty()) {
            return TranscriptSegment.UNKNOWN_SPEAKER;
        }
        session.speaker(match.get()).ifPresent(known -> {
            Speaker updated = known.withVoiceProfile(known.voiceProfile().blend(embedding));
            session.putSpeaker(updated);
            context.speakerUpdates().add(updated);
        });
        return match.get();
    }
}
