package com.phillippitts.livescribe.service.diarization;

import java.util.List;

/**
 * Output of a full diarization pass.
 *
 * @param speakers surviving speakers in creation order
 * @param segments voice segments attributed to a speaker, in time order
 * @param confidence mean segment confidence, 0 when there are no segments
 */
public record DiarizationResult(List<DiarizedSpeaker> speakers, List<SpeakerSegment> segments, double confidence) {

    public static final DiarizationResult EMPTY = new DiarizationResult(List.of(), List.of(), 0.0);

    public DiarizationResult {
        speakers = List.copyOf(speakers);
        segments = List.copyOf(segments);
    }

    public boolean hasSpeakers() {
        return !speakers.isEmpty();
    }
}
