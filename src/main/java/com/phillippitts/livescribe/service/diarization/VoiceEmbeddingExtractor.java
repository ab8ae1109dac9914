package com.phillippitts.livescribe.service.diarization;

import com.phillippitts.livescribe.domain.VectorMath;

/**
 * Fixed-length voice embeddings from windowed frame features.
 *
 * <p>Each Hamming-windowed 25 ms frame (10 ms hop) yields three features: a time-domain
 * centroid normalized by frame length, the zero-crossing rate and the mean-square energy. The
 * flattened feature sequence is reduced to the target length by averaging equal-width runs and
 * then L2-normalized.
 *
 * <p>Runs keep time order, so two clips compare well only at similar length and alignment.
 */
public final class VoiceEmbeddingExtractor {

    private VoiceEmbeddingExtractor() {
    }

    public static double[] extract(double[] samples, int sampleRate, int dimensions) {
        int frame = Math.max(1, (int) (sampleRate * VoiceActivityDetector.FRAME_SECONDS));
        int hop = Math.max(1, (int) (sampleRate * VoiceActivityDetector.HOP_SECONDS));
        int frames = samples.length < frame ? 0 : (samples.length - frame) / hop + 1;
        double[] window = hamming(frame);
        double[] features = new double[frames * 3];

        for (int f = 0; f < frames; f++) {
            int offset = f * hop;
            double weighted = 0.0;
            double magnitude = 0.0;
            double energy = 0.0;
            int crossings = 0;
            for (int j = 0; j < frame; j++) {
                double x = samples[offset + j] * window[j];
                double abs = Math.abs(x);
                weighted += j * abs;
                magnitude += abs;
                energy += x * x;
                if (j > 0 && (samples[offset + j] >= 0) != (samples[offset + j - 1] >= 0)) {
                    crossings++;
                }
            }
            features[3 * f] = magnitude == 0.0 ? 0.0 : weighted / magnitude / frame;
            features[3 * f + 1] = crossings / (double) frame;
            features[3 * f + 2] = energy / frame;
        }
        return VectorMath.l2Normalize(reduce(features, dimensions));
    }

    static double[] reduce(double[] features, int dimensions) {
        double[] out = new double[dimensions];
        if (features.length == 0) {
            return out;
        }
        int width = Math.max(1, features.length / dimensions);
        for (int i = 0; i < dimensions; i++) {
            int start = i * width;
            if (start >= features.length) {
                break;
            }
            int end = Math.min(start + width, features.length);
            double sum = 0.0;
            for (int j = start; j < end; j++) {
                sum += features[j];
            }
            out[i] = sum / (end - start);
        }
        return out;
    }

    private static double[] hamming(int n) {
        double[] w = new double[n];
        if (n == 1) {
            w[0] = 1.0;
            return w;
        }
        for (int i = 0; i < n; i++) {
            w[i] = 0.54 - 0.46 * Math.cos(2.0 * Math.PI * i / (n - 1));
        }
        return w;
    }
}
