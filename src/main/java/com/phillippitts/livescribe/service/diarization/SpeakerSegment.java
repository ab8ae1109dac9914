package com.phillippitts.livescribe.service.diarization;

/**
 * A voice segment attributed to a speaker, times in seconds from the start of the audio.
 */
public record SpeakerSegment(String speakerId, double startTime, double endTime, double confidence) {
}
