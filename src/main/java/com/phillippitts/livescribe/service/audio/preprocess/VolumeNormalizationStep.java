package com.phillippitts.livescribe.service.audio.preprocess;

import com.phillippitts.livescribe.service.audio.PcmAudio;

/**
 * Scales samples toward the target RMS and clips to [-1, 1].
 *
 * <p>Improvement is how much closer the RMS got to the target.
 */
public final class VolumeNormalizationStep implements EnhancementStep {

    @Override
    public EnhancementType type() {
        return EnhancementType.VOLUME_NORMALIZATION;
    }

    @Override
    public Outcome apply(PcmAudio input, PreprocessingConfig config) {
        double[] samples = input.samples();
        double before = AudioQualityAnalyzer.rms(samples);
        if (before == 0.0) {
            return new Outcome(input, 0.0);
        }
        double gain = config.targetRms() / before;
        double[] out = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = Math.max(-1.0, Math.min(1.0, samples[i] * gain));
        }
        double after = AudioQualityAnalyzer.rms(out);
        double improvement = Math.abs(before - config.targetRms()) - Math.abs(after - config.targetRms());
        return new Outcome(PcmAudio.mono(out, input.sampleRate()), Math.max(0.0, improvement));
    }
}
