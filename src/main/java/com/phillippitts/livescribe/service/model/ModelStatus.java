package com.phillippitts.livescribe.service.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Readiness record of one model. Replaced, never mutated.
 *
 * @param modelName model id
 * @param state readiness
 * @param loadTimeMs duration of the last successful load, 0 if never loaded
 * @param lastUsed last successful call or load, null if never
 * @param errorMessage last load failure, null unless {@link ModelState#ERROR}
 */
public record ModelStatus(String modelName, ModelState state, long loadTimeMs, Instant lastUsed, String errorMessage) {

    public ModelStatus {
        Objects.requireNonNull(modelName, "modelName must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    static ModelStatus loading(String modelName, ModelStatus previous) {
        return new ModelStatus(modelName, ModelState.LOADING,
                previous == null ? 0 : previous.loadTimeMs(),
                previous == null ? null : previous.lastUsed(), null);
    }

    static ModelStatus ready(String modelName, long loadTimeMs, Instant now) {
        return new ModelStatus(modelName, ModelState.READY, loadTimeMs, now, null);
    }

    static ModelStatus error(String modelName, ModelStatus previous, String message) {
        return new ModelStatus(modelName, ModelState.ERROR,
                previous == null ? 0 : previous.loadTimeMs(),
                previous == null ? null : previous.lastUsed(), message);
    }

    ModelStatus touched(Instant now) {
        return new ModelStatus(modelName, state, loadTimeMs, now, errorMessage);
    }

    public boolean isReady() {
        return state == ModelState.READY;
    }
}
