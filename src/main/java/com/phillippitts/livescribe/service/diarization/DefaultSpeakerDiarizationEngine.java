package com.phillippitts.livescribe.service.diarization;

import com.phillippitts.livescribe.config.properties.DiarizationProperties;
import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.domain.Speaker;
import com.phillippitts.livescribe.domain.VectorMath;
import com.phillippitts.livescribe.domain.VoiceProfile;
import com.phillippitts.livescribe.exception.SpeakerDiarizationException;
import com.phillippitts.livescribe.service.audio.PcmAudio;
import com.phillippitts.livescribe.service.audio.PcmCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Energy VAD plus greedy cosine clustering.
 *
 * <p><b>Clustering:</b> voice segments are visited in order. An unassigned segment opens a new
 * speaker; every later unassigned segment whose similarity to that speaker's running mean
 * embedding exceeds the threshold joins it. No new speakers are opened once
 * {@code maxSpeakers} exist. Speakers with less than {@code minSegmentLengthSeconds} of speech
 * are dropped.
 */
@Component
public class DefaultSpeakerDiarizationEngine implements SpeakerDiarizationEngine {

    private static final Logger LOG = LogManager.getLogger(DefaultSpeakerDiarizationEngine.class);

    private final int embeddingDimensions;

    public DefaultSpeakerDiarizationEngine(DiarizationProperties properties) {
        this.embeddingDimensions = Objects.requireNonNull(properties, "properties must not be null")
                .getEmbeddingDimensions();
    }

    @Override
    public DiarizationResult diarize(byte[] audio, AudioSpec spec, DiarizationConfig config) {
        PcmAudio mono = decodeMono(audio, spec);
        double[] samples = mono.samples();
        int sampleRate = mono.sampleRate();
        List<VoiceSegment> voiced = VoiceActivityDetector.detect(samples, sampleRate,
                config.energyThreshold(), config.minVoiceSegmentSeconds());
        if (voiced.isEmpty()) {
            LOG.debug("No voice activity in {} samples", samples.length);
            return DiarizationResult.EMPTY;
        }

        List<double[]> embeddings = new ArrayList<>(voiced.size());
        for (VoiceSegment segment : voiced) {
            double[] slice = Arrays.copyOfRange(samples, segment.startSample(), segment.endSample());
            embeddings.add(VoiceEmbeddingExtractor.extract(slice, sampleRate, config.embeddingDimensions()));
        }

        List<Cluster> clusters = cluster(voiced, embeddings, config);
        List<Cluster> kept = new ArrayList<>();
        for (Cluster c : clusters) {
            if (c.speakingTime >= config.minSegmentLengthSeconds()) {
                kept.add(c);
            }
        }

        List<DiarizedSpeaker> speakers = new ArrayList<>(kept.size());
        for (Cluster c : kept) {
            speakers.add(new DiarizedSpeaker(c.id, VoiceProfile.of(c.mean, 1.0, c.members),
                    c.speakingTime, c.members));
        }

        List<SpeakerSegment> segments = new ArrayList<>();
        double confidenceSum = 0.0;
        for (int i = 0; i < voiced.size() && !kept.isEmpty(); i++) {
            Cluster best = null;
            double bestSimilarity = Double.NEGATIVE_INFINITY;
            for (Cluster c : kept) {
                double similarity = VectorMath.cosineSimilarity(c.mean, embeddings.get(i));
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    best = c;
                }
            }
            double confidence = Math.max(0.0, Math.min(1.0, bestSimilarity));
            VoiceSegment v = voiced.get(i);
            segments.add(new SpeakerSegment(best.id, v.startSeconds(), v.endSeconds(), confidence));
            confidenceSum += confidence;
        }
        double confidence = segments.isEmpty() ? 0.0 : confidenceSum / segments.size();
        LOG.debug("Diarized {} voice segments into {} speakers (confidence={})",
                voiced.size(), speakers.size(), confidence);
        return new DiarizationResult(speakers, segments, confidence);
    }

    private List<Cluster> cluster(List<VoiceSegment> voiced, List<double[]> embeddings, DiarizationConfig config) {
        List<Cluster> clusters = new ArrayList<>();
        boolean[] assigned = new boolean[voiced.size()];
        for (int i = 0; i < voiced.size(); i++) {
            if (assigned[i]) {
                continue;
            }
            if (clusters.size() >= config.maxSpeakers()) {
                break;
            }
            Cluster c = new Cluster("speaker_" + (clusters.size() + 1), embeddings.get(i),
                    voiced.get(i).durationSeconds());
            assigned[i] = true;
            for (int j = i + 1; j < voiced.size(); j++) {
                if (!assigned[j]
                        && VectorMath.cosineSimilarity(c.mean, embeddings.get(j)) > config.similarityThreshold()) {
                    c.absorb(embeddings.get(j), voiced.get(j).durationSeconds());
                    assigned[j] = true;
                }
            }
            clusters.add(c);
        }
        return clusters;
    }

    @Override
    public Optional<String> identifySpeaker(double[] embedding, Collection<Speaker> knownSpeakers) {
        String bestId = null;
        double bestSimilarity = IDENTIFICATION_THRESHOLD;
        for (Speaker speaker : knownSpeakers) {
            if (speaker.voiceProfile().dimensions() != embedding.length) {
                continue;
            }
            double similarity = speaker.voiceProfile().similarityTo(embedding);
            if (similarity > bestSimilarity) {
                bestSimilarity = similarity;
                bestId = speaker.id();
            }
        }
        return Optional.ofNullable(bestId);
    }

    @Override
    public Speaker mergeSpeakers(Speaker first, Speaker second) {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
        if (first.id().equals(second.id())) {
            throw new SpeakerDiarizationException("Cannot merge speaker " + first.id() + " with itself");
        }
        VoiceProfile merged;
        try {
            merged = first.voiceProfile().merge(second.voiceProfile());
        } catch (IllegalArgumentException e) {
            throw new SpeakerDiarizationException("Cannot merge voice profiles of " + first.id() + " and "
                    + second.id() + ": " + e.getMessage(), e);
        }
        List<String> segmentIds = new ArrayList<>(first.segmentIds());
        segmentIds.addAll(second.segmentIds());
        int total = segmentIds.size();
        double avgConfidence = total == 0 ? 0.0
                : (first.averageConfidence() * first.segmentIds().size()
                + second.averageConfidence() * second.segmentIds().size()) / total;
        String name = first.displayName() != null ? first.displayName() : second.displayName();
        return new Speaker("speaker_" + UUID.randomUUID(), name, merged,
                first.totalSpeakingTimeMs() + second.totalSpeakingTimeMs(), segmentIds, avgConfidence);
    }

    @Override
    public double[] extractEmbedding(byte[] audio, AudioSpec spec) {
        PcmAudio mono = decodeMono(audio, spec);
        return VoiceEmbeddingExtractor.extract(mono.samples(), mono.sampleRate(), embeddingDimensions);
    }

    @Override
    public VoiceProfile createVoiceProfile(List<byte[]> samples, AudioSpec spec) {
        if (samples == null || samples.isEmpty()) {
            throw new SpeakerDiarizationException("At least one audio sample is required to create a voice profile");
        }
        List<double[]> embeddings = new ArrayList<>(samples.size());
        for (byte[] sample : samples) {
            embeddings.add(extractEmbedding(sample, spec));
        }
        double[] average = new double[embeddingDimensions];
        for (double[] e : embeddings) {
            for (int i = 0; i < average.length; i++) {
                average[i] += e[i] / embeddings.size();
            }
        }
        if (VectorMath.l2Norm(average) == 0.0) {
            throw new SpeakerDiarizationException("Voice samples carry no signal; cannot create a voice profile");
        }
        double confidence = 1.0;
        if (embeddings.size() > 1) {
            double sum = 0.0;
            for (double[] e : embeddings) {
                sum += VectorMath.cosineSimilarity(average, e);
            }
            confidence = Math.max(0.0, Math.min(1.0, sum / embeddings.size()));
        }
        return VoiceProfile.of(average, confidence, samples.size());
    }

    @Override
    public VoiceProfile updateVoiceProfile(VoiceProfile profile, byte[] sample, AudioSpec spec) {
        return profile.blend(extractEmbedding(sample, spec));
    }

    private static PcmAudio decodeMono(byte[] audio, AudioSpec spec) {
        PcmAudio decoded;
        try {
            decoded = PcmCodec.decode(audio, spec);
        } catch (RuntimeException e) {
            throw new SpeakerDiarizationException("Unable to decode audio for diarization: " + e.getMessage(), e);
        }
        if (decoded.channelCount() == 1) {
            return decoded;
        }
        double[] mono = new double[decoded.frameCount()];
        for (double[] channel : decoded.channels()) {
            for (int i = 0; i < mono.length; i++) {
                mono[i] += channel[i] / decoded.channelCount();
            }
        }
        return PcmAudio.mono(mono, decoded.sampleRate());
    }

    /** Running mean embedding of one speaker during clustering. */
    private static final class Cluster {
        private final String id;
        private final double[] mean;
        private double speakingTime;
        private int members;

        Cluster(String id, double[] first, double duration) {
            this.id = id;
            this.mean = first.clone();
            this.speakingTime = duration;
            this.members = 1;
        }

        void absorb(double[] embedding, double duration) {
            members++;
            for (int i = 0; i < mean.length; i++) {
                mean[i] += (embedding[i] - mean[i]) / members;
            }
            speakingTime += duration;
        }
    }
}
