package com.phillippitts.livescribe.service.metrics;

import com.phillippitts.livescribe.service.model.ModelPerformanceMetrics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running quality statistics of one session.
 *
 * <p>Averages use the two-point moving average {@code avg = (avg + sample) / 2} seeded at 0,
 * so recent chunks dominate. Failures update latency but never confidence.
 *
 * <p>Owned by the session aggregate; written by the chunk pipeline and read from any thread.
 */
public final class SessionQualityMetrics {

    private double averageLatencyMs;
    private double averageConfidence;
    private long totalAttempts;
    private long successfulAttempts;
    private long failedAttempts;
    private final Map<String, ModelPerformanceMetrics> models = new LinkedHashMap<>();

    public SessionQualityMetrics(String initialModel) {
        models.put(initialModel, ModelPerformanceMetrics.empty(initialModel));
    }

    synchronized void recordSuccess(String modelName, long latencyMs, double confidence) {
        totalAttempts++;
        successfulAttempts++;
        averageLatencyMs = (averageLatencyMs + latencyMs) / 2.0;
        averageConfidence = (averageConfidence + confidence) / 2.0;
        models.compute(modelName, (k, v) ->
                (v == null ? ModelPerformanceMetrics.empty(k) : v).withSuccess(latencyMs, confidence));
    }

    synchronized void recordFailure(String modelName, long latencyMs) {
        totalAttempts++;
        failedAttempts++;
        averageLatencyMs = (averageLatencyMs + latencyMs) / 2.0;
        models.compute(modelName, (k, v) ->
                (v == null ? ModelPerformanceMetrics.empty(k) : v).withFailure(latencyMs));
    }

    public synchronized double averageConfidence() {
        return averageConfidence;
    }

    public synchronized QualityMetricsSnapshot snapshot() {
        return new QualityMetricsSnapshot(averageLatencyMs, averageConfidence,
                totalAttempts, successfulAttempts, failedAttempts, models);
    }
}
