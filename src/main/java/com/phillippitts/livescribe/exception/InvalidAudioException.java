package com.phillippitts.livescribe.exception;

/**
 * Thrown when a chunk's bytes cannot be interpreted in the session's declared sample format
 * (frame misalignment, empty payload, oversized payload, unsupported WAV encoding).
 */
public class InvalidAudioException extends LiveScribeException {

    private final int audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio data: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
