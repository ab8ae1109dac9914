package com.phillippitts.livescribe.domain;

import java.util.Arrays;

/**
 * Numeric fingerprint of a speaker's voice.
 *
 * <p>Feature vectors are always L2-normalized; features without magnitude are rejected. Instances
 * are immutable; every update returns a new profile.
 */
public final class VoiceProfile {

    /** Weight kept from the existing profile when blending in a new sample. */
    public static final double RETAINED_WEIGHT = 0.9;
    /** Weight given to a new sample when blending. */
    public static final double SAMPLE_WEIGHT = 0.1;

    private final double[] features;
    private final double confidence;
    private final int sampleCount;

    private VoiceProfile(double[] normalizedFeatures, double confidence, int sampleCount) {
        this.features = normalizedFeatures;
        this.confidence = confidence;
        this.sampleCount = sampleCount;
    }

    /**
     * Creates a profile, normalizing the given features to unit length.
     *
     * @param features raw feature vector (copied)
     * @param confidence profile confidence in [0, 1]
     * @param sampleCount number of samples the profile was built from
     * @throws IllegalArgumentException if the features are empty or have no magnitude
     */
    public static VoiceProfile of(double[] features, double confidence, int sampleCount) {
        if (features == null || features.length == 0) {
            throw new IllegalArgumentException("features must not be empty");
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
        if (sampleCount < 0) {
            throw new IllegalArgumentException("sampleCount must not be negative");
        }
        return new VoiceProfile(unit(features), confidence, sampleCount);
    }

    /**
     * Exponentially blends a new sample into this profile: {@code 0.9 * current + 0.1 * sample},
     * renormalized, with the sample count incremented.
     */
    public VoiceProfile blend(double[] sample) {
        if (sample == null || sample.length != features.length) {
            throw new IllegalArgumentException("sample must have " + features.length + " dimensions");
        }
        double[] normalizedSample = VectorMath.l2Normalize(sample);
        double[] blended = new double[features.length];
        for (int i = 0; i < blended.length; i++) {
            blended[i] = features[i] * RETAINED_WEIGHT + normalizedSample[i] * SAMPLE_WEIGHT;
        }
        return new VoiceProfile(unit(blended), confidence, sampleCount + 1);
    }

    /**
     * Averages features and confidences of two profiles and sums their sample counts.
     */
    public VoiceProfile merge(VoiceProfile other) {
        if (other.features.length != features.length) {
            throw new IllegalArgumentException("profiles have different dimensions");
        }
        double[] averaged = new double[features.length];
        for (int i = 0; i < averaged.length; i++) {
            averaged[i] = (features[i] + other.features[i]) / 2.0;
        }
        return new VoiceProfile(unit(averaged),
                (confidence + other.confidence) / 2.0,
                sampleCount + other.sampleCount);
    }

    private static double[] unit(double[] v) {
        double norm = VectorMath.l2Norm(v);
        if (norm == 0.0 || Double.isNaN(norm)) {
            throw new IllegalArgumentException("voice features must have a non-zero magnitude");
        }
        return VectorMath.l2Normalize(v);
    }

    public double similarityTo(double[] embedding) {
        return VectorMath.cosineSimilarity(features, embedding);
    }

    public double[] features() {
        return features.clone();
    }

    public int dimensions() {
        return features.length;
    }

    public double confidence() {
        return confidence;
    }

    public int sampleCount() {
        return sampleCount;
    }

    public double l2Norm() {
        return VectorMath.l2Norm(features);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VoiceProfile that)) {
            return false;
        }
        return Double.compare(confidence, that.confidence) == 0
                && sampleCount == that.sampleCount
                && Arrays.equals(features, that.features);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(features) + Double.hashCode(confidence)) + sampleCount;
    }

    @Override
    public String toString() {
        return "VoiceProfile{dimensions=" + features.length + ", confidence=" + confidence
                + ", sampleCount=" + sampleCount + '}';
    }
}
