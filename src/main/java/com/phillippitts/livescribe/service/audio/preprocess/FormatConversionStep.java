package com.phillippitts.livescribe.service.audio.preprocess;

import com.phillippitts.livescribe.service.audio.PcmAudio;

/**
 * Folds all channels to mono and linearly resamples to the target rate.
 */
public final class FormatConversionStep implements EnhancementStep {

    static final double CONVERSION_IMPROVEMENT = 0.1;

    @Override
    public EnhancementType type() {
        return EnhancementType.FORMAT_CONVERSION;
    }

    @Override
    public Outcome apply(PcmAudio input, PreprocessingConfig config) {
        boolean needsFold = input.channelCount() > 1;
        boolean needsResample = input.sampleRate() != config.targetSampleRate();
        if (!needsFold && !needsResample) {
            return null;
        }
        double[] mono = needsFold ? fold(input.channels()) : input.samples();
        double[] out = needsResample ? resample(mono, input.sampleRate(), config.targetSampleRate()) : mono;
        return new Outcome(PcmAudio.mono(out, config.targetSampleRate()), CONVERSION_IMPROVEMENT);
    }

    static double[] fold(double[][] channels) {
        int frames = channels[0].length;
        double[] mono = new double[frames];
        for (double[] channel : channels) {
            for (int i = 0; i < frames; i++) {
                mono[i] += channel[i];
            }
        }
        for (int i = 0; i < frames; i++) {
            mono[i] /= channels.length;
        }
        return mono;
    }

    static double[] resample(double[] samples, int fromRate, int toRate) {
        if (samples.length == 0) {
            return samples;
        }
        int outLength = (int) Math.max(1, Math.round(samples.length * (double) toRate / fromRate));
        double[] out = new double[outLength];
        double ratio = (double) fromRate / toRate;
        for (int i = 0; i < outLength; i++) {
            double pos = i * ratio;
            int idx = (int) pos;
            if (idx >= samples.length - 1) {
                out[i] = samples[samples.length - 1];
            } else {
                double frac = pos - idx;
                out[i] = samples[idx] * (1.0 - frac) + samples[idx + 1] * frac;
            }
        }
        return out;
    }
}
