package com.phillippitts.livescribe.exception;

/**
 * Thrown when diarization or speaker identification fails. Non-fatal to the pipeline, which
 * attributes the chunk to the unknown speaker instead.
 */
public class SpeakerDiarizationException extends LiveScribeException {

    public SpeakerDiarizationException(String message) {
        super(message);
    }

    public SpeakerDiarizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
