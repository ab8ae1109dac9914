package com.phillippitts.livescribe.service.audio.preprocess;

import com.phillippitts.livescribe.service.audio.PcmAudio;

/**
 * Single-pole RC high-pass filter removing content below the configured cutoff.
 *
 * <pre>
 * rc    = 1 / (2 * pi * cutoff)
 * dt    = 1 / sampleRate
 * alpha = rc / (rc + dt)
 * y[n]  = alpha * (y[n-1] + x[n] - x[n-1])
 * </pre>
 *
 * <p>Improvement is the gain in signal-to-noise ratio.
 */
public final class NoiseReductionStep implements EnhancementStep {

    @Override
    public EnhancementType type() {
        return EnhancementType.NOISE_REDUCTION;
    }

    @Override
    public Outcome apply(PcmAudio input, PreprocessingConfig config) {
        double[] samples = input.samples();
        double[] out = highPass(samples, input.sampleRate(), config.highPassCutoffHz());
        double improvement = AudioQualityAnalyzer.signalToNoise(out) - AudioQualityAnalyzer.signalToNoise(samples);
        return new Outcome(PcmAudio.mono(out, input.sampleRate()), Math.max(0.0, improvement));
    }

    static double[] highPass(double[] samples, int sampleRate, double cutoffHz) {
        double rc = 1.0 / (2.0 * Math.PI * cutoffHz);
        double dt = 1.0 / sampleRate;
        double alpha = rc / (rc + dt);
        double[] out = new double[samples.length];
        double prevIn = 0.0;
        double prevOut = 0.0;
        for (int i = 0; i < samples.length; i++) {
            double y = alpha * (prevOut + samples[i] - prevIn);
            out[i] = y;
            prevOut = y;
            prevIn = samples[i];
        }
        return out;
    }
}
