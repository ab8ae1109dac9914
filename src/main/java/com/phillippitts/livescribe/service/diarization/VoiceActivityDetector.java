package com.phillippitts.livescribe.service.diarization;

import java.util.ArrayList;
import java.util.List;

/**
 * Energy-threshold voice activity detection over 25 ms frames with a 10 ms hop.
 */
public final class VoiceActivityDetector {

    static final double FRAME_SECONDS = 0.025;
    static final double HOP_SECONDS = 0.010;

    private VoiceActivityDetector() {
    }

    /**
     * Detects voiced runs.
     *
     * @param samples mono samples in [-1, 1]
     * @param sampleRate sample rate
     * @param energyThreshold mean-square energy above which a frame is voiced
     * @param minSegmentSeconds shorter runs are discarded
     * @return voiced segments in time order
     */
    public static List<VoiceSegment> detect(double[] samples, int sampleRate, double energyThreshold,
                                            double minSegmentSeconds) {
        int frame = Math.max(1, (int) (sampleRate * FRAME_SECONDS));
        int hop = Math.max(1, (int) (sampleRate * HOP_SECONDS));
        List<VoiceSegment> segments = new ArrayList<>();
        int runStart = -1;
        int lastVoicedEnd = -1;

        for (int i = 0; i + frame <= samples.length; i += hop) {
            double energy = 0.0;
            for (int j = i; j < i + frame; j++) {
                energy += samples[j] * samples[j];
            }
            energy /= frame;
            if (energy > energyThreshold) {
                if (runStart < 0) {
                    runStart = i;
                }
                lastVoicedEnd = i + frame;
            } else if (runStart >= 0) {
                addIfLongEnough(segments, runStart, lastVoicedEnd, sampleRate, minSegmentSeconds);
                runStart = -1;
            }
        }
        if (runStart >= 0) {
            addIfLongEnough(segments, runStart, lastVoicedEnd, sampleRate, minSegmentSeconds);
        }
        return segments;
    }

    private static void addIfLongEnough(List<VoiceSegment> out, int start, int end, int sampleRate,
                                        double minSegmentSeconds) {
        VoiceSegment segment = new VoiceSegment(start, end, sampleRate);
        if (segment.durationSeconds() >= minSegmentSeconds) {
            out.add(segment);
        }
    }
}
