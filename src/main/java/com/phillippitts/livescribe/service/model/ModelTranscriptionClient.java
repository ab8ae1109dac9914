package com.phillippitts.livescribe.service.model;

import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.domain.TranscriptionResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Calls external speech models and tracks their readiness and performance.
 *
 * <p>Status and performance tables are shared by all sessions. Updates for one model are
 * atomic; reads never block.
 */
public interface ModelTranscriptionClient {

    /**
     * Transcribes with {@code modelName}, trying the next model of the static ordering once if
     * that call fails with anything other than an invalid audio format.
     *
     * @param audio PCM or WAV bytes
     * @param spec format of raw PCM
     * @param modelName preferred model
     * @return result naming the model that actually produced it
     */
    TranscriptionResult transcribe(byte[] audio, AudioSpec spec, String modelName);

    /**
     * Single attempt against exactly one model, loading it first if needed. The call is bounded
     * by the configured timeout.
     *
     * @throws com.phillippitts.livescribe.exception.TranscriptionException on any failure
     */
    TranscriptionResult transcribeWithModel(byte[] audio, AudioSpec spec, String modelName);

    /** Runs a smoke test and records the outcome. Never throws for model failures. */
    ModelStatus loadModel(String modelName);

    /**
     * Blocks until the model is ready, loading it within the configured retry budget.
     *
     * @throws com.phillippitts.livescribe.exception.ModelUnavailableException if every attempt fails
     */
    ModelStatus ensureReady(String modelName);

    Optional<ModelStatus> getModelStatus(String modelName);

    Map<String, ModelStatus> getModelStatuses();

    Optional<ModelPerformanceMetrics> getPerformance(String modelName);

    /** Model with the highest composite score, or the first configured model if none was used. */
    String getBestPerformingModel();

    /** Static model ordering without {@code currentModel}. */
    List<String> fallbackModelsFor(String currentModel);

    ModelHealthReport healthCheck();

    /** Readiness probe against the endpoint; false on any failure. */
    boolean probe(String modelName);
}
