package com.phillippitts.livescribe.service.audio.preprocess;

import com.phillippitts.livescribe.service.audio.PcmAudio;

/**
 * Single-tap echo suppressor.
 *
 * <p>Finds the lag between 20 ms and 200 ms with the strongest normalized autocorrelation and,
 * when it exceeds {@value #ECHO_CORRELATION_THRESHOLD}, subtracts the delayed signal scaled by that
 * correlation. Improvement is the drop in correlation at the echo lag.
 */
public final class EchoCancellationStep implements EnhancementStep {

    static final double ECHO_CORRELATION_THRESHOLD = 0.3;
    private static final double MIN_LAG_SECONDS = 0.020;
    private static final double MAX_LAG_SECONDS = 0.200;
    private static final double LAG_STEP_SECONDS = 0.001;

    @Override
    public EnhancementType type() {
        return EnhancementType.ECHO_CANCELLATION;
    }

    @Override
    public Outcome apply(PcmAudio input, PreprocessingConfig config) {
        double[] samples = input.samples();
        int rate = input.sampleRate();
        int minLag = (int) (rate * MIN_LAG_SECONDS);
        int maxLag = Math.min((int) (rate * MAX_LAG_SECONDS), samples.length / 2);
        int step = Math.max(1, (int) (rate * LAG_STEP_SECONDS));
        if (maxLag <= minLag) {
            return new Outcome(input, 0.0);
        }

        int bestLag = -1;
        double bestCorrelation = 0.0;
        for (int lag = minLag; lag <= maxLag; lag += step) {
            double r = correlation(samples, lag);
            if (r > bestCorrelation) {
                bestCorrelation = r;
                bestLag = lag;
            }
        }
        if (bestLag < 0 || bestCorrelation < ECHO_CORRELATION_THRESHOLD) {
            return new Outcome(input, 0.0);
        }

        double[] out = samples.clone();
        for (int i = bestLag; i < out.length; i++) {
            out[i] = samples[i] - bestCorrelation * samples[i - bestLag];
        }
        double improvement = bestCorrelation - Math.max(0.0, correlation(out, bestLag));
        return new Outcome(PcmAudio.mono(out, rate), Math.max(0.0, improvement));
    }

    static double correlation(double[] x, int lag) {
        double cross = 0.0;
        double energy = 0.0;
        for (int i = lag; i < x.length; i++) {
            cross += x[i] * x[i - lag];
            energy += x[i] * x[i];
        }
        return energy == 0.0 ? 0.0 : cross / energy;
    }
}
