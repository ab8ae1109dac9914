package com.phillippitts.livescribe.service.audio.preprocess;

import java.util.List;

/**
 * Signal quality estimate of a chunk.
 *
 * @param signalToNoiseRatio ratio of overall RMS to the RMS of the quietest 10% of samples, capped at 1
 * @param volumeLevel RMS of samples scaled to [-1, 1]
 * @param clarity sum of absolute sample differences over sum of absolute samples, capped at 1
 * @param overallQuality {@code snr*0.4 + volume*0.3 + clarity*0.3}
 * @param recommendations operator hints for poor input
 */
public record AudioQualityMetrics(double signalToNoiseRatio,
                                  double volumeLevel,
                                  double clarity,
                                  double overallQuality,
                                  List<String> recommendations) {

    public static final AudioQualityMetrics UNMEASURABLE = new AudioQualityMetrics(0, 0, 0, 0, List.of());

    public AudioQualityMetrics {
        recommendations = List.copyOf(recommendations);
    }
}
