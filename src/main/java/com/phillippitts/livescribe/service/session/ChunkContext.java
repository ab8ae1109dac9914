package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.AudioChunk;
import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.domain.Speaker;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.domain.TranscriptionError;
import com.phillippitts.livescribe.domain.TranscriptionResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Working state of one chunk while it moves through the pipeline stages.
 */
final class ChunkContext {

    private final TranscriptionSession session;
    private final AudioChunk chunk;
    private final List<TranscriptionError> failures = new ArrayList<>();
    private final List<Speaker> speakerUpdates = new ArrayList<>();
    private byte[] audio;
    private AudioSpec spec;
    private double qualityScore;
    private String speakerId = TranscriptSegment.UNKNOWN_SPEAKER;
    private TranscriptionResult result;

    ChunkContext(TranscriptionSession session, AudioChunk chunk) {
        this.session = session;
        this.chunk = chunk;
        this.audio = chunk.getData();
        this.spec = chunk.getAudioSpec();
    }

    TranscriptionSession session() {
        return session;
    }

    AudioChunk chunk() {
        return chunk;
    }

    /** Audio as it stands after the stages run so far. */
    byte[] audio() {
        return audio;
    }

    AudioSpec spec() {
        return spec;
    }

    void replaceAudio(byte[] audio, AudioSpec spec, double qualityScore) {
        this.audio = audio;
        this.spec = spec;
        this.qualityScore = qualityScore;
    }

    double qualityScore() {
        return qualityScore;
    }

    String speakerId() {
        return speakerId;
    }

    void speakerId(String speakerId) {
        this.speakerId = speakerId == null ? TranscriptSegment.UNKNOWN_SPEAKER : speakerId;
    }

    TranscriptionResult result() {
        return result;
    }

    void result(TranscriptionResult result) {
        this.result = result;
    }

    /** Failures recorded on the session during this chunk, in order. */
    List<TranscriptionError> failures() {
        return failures;
    }

    /** Speakers created or re-profiled during this chunk. */
    List<Speaker> speakerUpdates() {
        return speakerUpdates;
    }
}
