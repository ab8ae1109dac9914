package com.phillippitts.livescribe.service.diarization;

import com.phillippitts.livescribe.domain.VoiceProfile;

/**
 * A speaker found by clustering.
 *
 * @param id {@code speaker_N}
 * @param voiceProfile running cluster embedding
 * @param speakingTimeSeconds total voiced time assigned by clustering
 * @param segmentCount voice segments in the cluster
 */
public record DiarizedSpeaker(String id, VoiceProfile voiceProfile, double speakingTimeSeconds, int segmentCount) {
}
