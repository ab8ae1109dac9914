package com.phillippitts.livescribe.service.metrics;

import com.phillippitts.livescribe.service.model.ModelPerformanceMetrics;

import java.util.Map;

/**
 * Read-only view of a session's quality metrics.
 *
 * @param averageLatencyMs moving average of chunk attempt latency
 * @param averageConfidence moving average of successful chunk confidence
 * @param totalAttempts chunk attempts, including fallback retries
 * @param successfulAttempts attempts that produced a segment
 * @param failedAttempts attempts that failed
 * @param modelPerformance per-model table for this session
 */
public record QualityMetricsSnapshot(double averageLatencyMs,
                                     double averageConfidence,
                                     long totalAttempts,
                                     long successfulAttempts,
                                     long failedAttempts,
                                     Map<String, ModelPerformanceMetrics> modelPerformance) {

    public QualityMetricsSnapshot {
        modelPerformance = Map.copyOf(modelPerformance);
    }

    public double successRate() {
        return totalAttempts == 0 ? 0.0 : successfulAttempts / (double) totalAttempts;
    }
}
