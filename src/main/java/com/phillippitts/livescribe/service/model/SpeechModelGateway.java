package com.phillippitts.livescribe.service.model;

/**
 * Request/response boundary to an external speech-to-text service.
 *
 * <p>Implementations throw {@link com.phillippitts.livescribe.exception.TranscriptionException}
 * carrying a classified error code; the transport is theirs to choose. They must be thread-safe.
 */
public interface SpeechModelGateway {

    /**
     * Transcribes one WAV payload.
     *
     * @param wavAudio WAV container bytes
     * @param modelName model id
     * @return text and optional confidence
     */
    ModelOutput transcribe(byte[] wavAudio, String modelName);

    /**
     * Confirms a model can serve requests, typically by a smoke-test transcription.
     *
     * @param modelName model id
     * @throws com.phillippitts.livescribe.exception.TranscriptionException if the model is not usable
     */
    void loadModel(String modelName);

    /**
     * Readiness probe.
     *
     * @return true when the endpoint reports the model as reachable
     */
    boolean healthCheck(String modelName);
}
