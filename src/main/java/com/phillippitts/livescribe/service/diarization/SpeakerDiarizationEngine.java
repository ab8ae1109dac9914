package com.phillippitts.livescribe.service.diarization;

import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.domain.Speaker;
import com.phillippitts.livescribe.domain.VoiceProfile;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Partitions audio by speaker and matches voices against known profiles.
 *
 * <p>Implementations are stateless; speakers and their profiles are owned by the session.
 */
public interface SpeakerDiarizationEngine {

    /** Cosine similarity a known profile must exceed to be identified. */
    double IDENTIFICATION_THRESHOLD = 0.8;

    /**
     * Full diarization: voice activity detection, embedding extraction, greedy clustering.
     *
     * @throws com.phillippitts.livescribe.exception.SpeakerDiarizationException if the audio cannot be analyzed
     */
    DiarizationResult diarize(byte[] audio, AudioSpec spec, DiarizationConfig config);

    /**
     * Nearest known speaker by cosine similarity.
     *
     * @return id of the best match above {@link #IDENTIFICATION_THRESHOLD}, empty otherwise
     */
    Optional<String> identifySpeaker(double[] embedding, Collection<Speaker> knownSpeakers);

    /**
     * Merges two speakers into a new one with a fresh id. Callers must re-point segments
     * attributed to either source id.
     */
    Speaker mergeSpeakers(Speaker first, Speaker second);

    /** Embedding of a whole chunk, L2-normalized. */
    double[] extractEmbedding(byte[] audio, AudioSpec spec);

    /**
     * Builds a profile from enrollment samples: averaged embeddings, confidence is the mean
     * similarity of the samples to the average.
     */
    VoiceProfile createVoiceProfile(List<byte[]> samples, AudioSpec spec);

    /** Blends a new sample into an existing profile. */
    VoiceProfile updateVoiceProfile(VoiceProfile profile, byte[] sample, AudioSpec spec);
}
