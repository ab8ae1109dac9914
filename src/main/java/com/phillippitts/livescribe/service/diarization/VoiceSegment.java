package com.phillippitts.livescribe.service.diarization;

/**
 * A run of voiced frames, as sample indices into the decoded chunk.
 */
public record VoiceSegment(int startSample, int endSample, int sampleRate) {

    public double startSeconds() {
        return startSample / (double) sampleRate;
    }

    public double endSeconds() {
        return endSample / (double) sampleRate;
    }

    public double durationSeconds() {
        return (endSample - startSample) / (double) sampleRate;
    }
}
