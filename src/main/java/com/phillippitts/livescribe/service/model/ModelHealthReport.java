package com.phillippitts.livescribe.service.model;

import java.util.Map;

/**
 * Aggregate readiness of the model pool.
 *
 * @param status overall verdict
 * @param readyModels models in {@link ModelState#READY}
 * @param loadingModels models in {@link ModelState#LOADING}
 * @param errorModels models in {@link ModelState#ERROR}
 * @param averageLatencyMs mean latency over models that have been used
 * @param models per-model status
 */
public record ModelHealthReport(Status status,
                                int readyModels,
                                int loadingModels,
                                int errorModels,
                                double averageLatencyMs,
                                Map<String, ModelStatus> models) {

    public enum Status { HEALTHY, DEGRADED, UNHEALTHY }

    public ModelHealthReport {
        models = Map.copyOf(models);
    }
}
