package com.phillippitts.livescribe.service.audio.preprocess;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Computes {@link AudioQualityMetrics} from normalized samples.
 */
public final class AudioQualityAnalyzer {

    static final double SNR_WEIGHT = 0.4;
    static final double VOLUME_WEIGHT = 0.3;
    static final double CLARITY_WEIGHT = 0.3;
    /** Fraction of quietest samples treated as the noise floor. */
    static final double NOISE_FLOOR_FRACTION = 0.1;

    private AudioQualityAnalyzer() {
    }

    public static AudioQualityMetrics analyze(double[] samples) {
        if (samples.length == 0) {
            return AudioQualityMetrics.UNMEASURABLE;
        }
        double volume = Math.min(1.0, rms(samples));
        double snr = signalToNoise(samples);
        double clarity = clarity(samples);
        double overall = snr * SNR_WEIGHT + volume * VOLUME_WEIGHT + clarity * CLARITY_WEIGHT;
        return new AudioQualityMetrics(snr, volume, clarity, overall, recommendations(snr, volume, clarity));
    }

    static double rms(double[] samples) {
        if (samples.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double s : samples) {
            sum += s * s;
        }
        return Math.sqrt(sum / samples.length);
    }

    static double signalToNoise(double[] samples) {
        double signal = rms(samples);
        double[] magnitudes = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            magnitudes[i] = Math.abs(samples[i]);
        }
        Arrays.sort(magnitudes);
        int quietCount = Math.max(1, (int) (magnitudes.length * NOISE_FLOOR_FRACTION));
        double noise = rms(Arrays.copyOf(magnitudes, quietCount));
        if (noise == 0.0) {
            return signal > 0.0 ? 1.0 : 0.0;
        }
        return Math.min(1.0, signal / noise);
    }

    static double clarity(double[] samples) {
        double energy = 0.0;
        double variation = 0.0;
        for (int i = 0; i < samples.length; i++) {
            energy += Math.abs(samples[i]);
            if (i > 0) {
                variation += Math.abs(samples[i] - samples[i - 1]);
            }
        }
        return energy == 0.0 ? 0.0 : Math.min(1.0, variation / energy);
    }

    private static List<String> recommendations(double snr, double volume, double clarity) {
        List<String> out = new ArrayList<>();
        if (volume < 0.01) {
            out.add("Input is nearly silent; check the microphone or source gain");
        } else if (volume > 0.9) {
            out.add("Input is close to clipping; reduce the source gain");
        }
        if (snr < 0.5) {
            out.add("High background noise; enable noise reduction or move to a quieter room");
        }
        if (clarity < 0.1 && volume >= 0.01) {
            out.add("Low clarity; speak closer to the microphone");
        }
        return out;
    }
}
