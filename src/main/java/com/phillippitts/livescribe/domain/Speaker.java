package com.phillippitts.livescribe.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A speaker detected in (or enrolled into) a session.
 *
 * <p>Immutable; the session replaces its entry on every update. Total speaking time is the sum of
 * the durations of the segments listed in {@code segmentIds}.
 *
 * @param id speaker id, unique within the session
 * @param displayName optional human readable name
 * @param voiceProfile voice fingerprint
 * @param totalSpeakingTimeMs sum of attributed segment durations
 * @param segmentIds ids of attributed segments in attribution order
 * @param averageConfidence mean confidence of attributed segments
 */
public record Speaker(String id,
                      String displayName,
                      VoiceProfile voiceProfile,
                      long totalSpeakingTimeMs,
                      List<String> segmentIds,
                      double averageConfidence) {

    public Speaker {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(voiceProfile, "voiceProfile must not be null");
        segmentIds = List.copyOf(segmentIds);
    }

    public static Speaker detected(String id, VoiceProfile voiceProfile) {
        return new Speaker(id, null, voiceProfile, 0L, List.of(), 0.0);
    }

    /**
     * Attributes a segment to this speaker, extending speaking time and the running mean confidence.
     */
    public Speaker withSegment(TranscriptSegment segment) {
        List<String> ids = new ArrayList<>(segmentIds);
        ids.add(segment.id());
        double avg = averageConfidence + (segment.confidence() - averageConfidence) / ids.size();
        return new Speaker(id, displayName, voiceProfile, totalSpeakingTimeMs + segment.durationMs(), ids, avg);
    }

    public Speaker withVoiceProfile(VoiceProfile profile) {
        return new Speaker(id, displayName, profile, totalSpeakingTimeMs, segmentIds, averageConfidence);
    }

    public Speaker withDisplayName(String name) {
        return new Speaker(id, name, voiceProfile, totalSpeakingTimeMs, segmentIds, averageConfidence);
    }
}
