package com.phillippitts.livescribe.service.model;

/**
 * Running performance of one model across all sessions.
 *
 * @param modelName model id
 * @param usageCount calls made, successful or not
 * @param successCount successful calls
 * @param totalProcessingTimeMs summed call time
 * @param averageConfidence mean confidence of successful calls
 */
public record ModelPerformanceMetrics(String modelName,
                                      long usageCount,
                                      long successCount,
                                      long totalProcessingTimeMs,
                                      double averageConfidence) {

    static final double SUCCESS_WEIGHT = 0.4;
    static final double CONFIDENCE_WEIGHT = 0.4;
    static final double SPEED_WEIGHT = 0.2;

    public static ModelPerformanceMetrics empty(String modelName) {
        return new ModelPerformanceMetrics(modelName, 0, 0, 0, 0.0);
    }

    public ModelPerformanceMetrics withSuccess(long processingTimeMs, double confidence) {
        long successes = successCount + 1;
        return new ModelPerformanceMetrics(modelName, usageCount + 1, successes,
                totalProcessingTimeMs + processingTimeMs,
                averageConfidence + (confidence - averageConfidence) / successes);
    }

    public ModelPerformanceMetrics withFailure(long processingTimeMs) {
        return new ModelPerformanceMetrics(modelName, usageCount + 1, successCount,
                totalProcessingTimeMs + processingTimeMs, averageConfidence);
    }

    public double averageLatencyMs() {
        return usageCount == 0 ? 0.0 : totalProcessingTimeMs / (double) usageCount;
    }

    public double successRate() {
        return usageCount == 0 ? 0.0 : successCount / (double) usageCount;
    }

    public double errorRate() {
        return usageCount == 0 ? 0.0 : (usageCount - successCount) / (double) usageCount;
    }

    /**
     * Weighted composite: {@code successRate*0.4 + averageConfidence*0.4 + (1000/max(latency,1))*0.2}.
     */
    public double score() {
        return successRate() * SUCCESS_WEIGHT
                + averageConfidence * CONFIDENCE_WEIGHT
                + (1000.0 / Math.max(averageLatencyMs(), 1.0)) * SPEED_WEIGHT;
    }
}
