package com.phillippitts.livescribe.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VoiceProfileTest {

    @Test
    void featuresAreNormalizedToUnitLength() {
        VoiceProfile profile = VoiceProfile.of(new double[]{3, 4}, 0.9, 1);

        assertThat(profile.l2Norm()).isCloseTo(1.0, within(1e-9));
        assertThat(profile.features()).containsExactly(new double[]{0.6, 0.8}, within(1e-9));
    }

    @Test
    void rejectsFeaturesWithoutMagnitude() {
        assertThatThrownBy(() -> VoiceProfile.of(new double[]{0, 0, 0}, 0.5, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("magnitude");
    }

    @Test
    void blendWithSilentSampleKeepsUnitLength() {
        VoiceProfile profile = VoiceProfile.of(new double[]{1, 1}, 0.9, 1);

        VoiceProfile blended = profile.blend(new double[]{0, 0});

        assertThat(blended.l2Norm()).isCloseTo(1.0, within(1e-6));
        assertThat(blended.sampleCount()).isEqualTo(2);
    }

    @Test
    void mergingOppositeProfilesIsRejected() {
        VoiceProfile a = VoiceProfile.of(new double[]{1, 0}, 0.8, 1);
        VoiceProfile b = VoiceProfile.of(new double[]{-1, 0}, 0.8, 1);

        assertThatThrownBy(() -> a.merge(b)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blendWeighsExistingProfileHeavily() {
        VoiceProfile profile = VoiceProfile.of(new double[]{1, 0}, 0.9, 1);

        VoiceProfile blended = profile.blend(new double[]{0, 1});

        assertThat(blended.sampleCount()).isEqualTo(2);
        assertThat(blended.l2Norm()).isCloseTo(1.0, within(1e-9));
        assertThat(blended.features()[0]).isGreaterThan(blended.features()[1]);
        assertThat(blended.similarityTo(new double[]{1, 0})).isGreaterThan(0.99);
    }

    @Test
    void blendRejectsDimensionMismatch() {
        VoiceProfile profile = VoiceProfile.of(new double[]{1, 0}, 0.9, 1);

        assertThatThrownBy(() -> profile.blend(new double[]{1, 0, 0}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergeAveragesAndSumsSampleCounts() {
        VoiceProfile a = VoiceProfile.of(new double[]{1, 0}, 0.8, 3);
        VoiceProfile b = VoiceProfile.of(new double[]{0, 1}, 0.6, 2);

        VoiceProfile merged = a.merge(b);

        assertThat(merged.sampleCount()).isEqualTo(5);
        assertThat(merged.confidence()).isCloseTo(0.7, within(1e-9));
        assertThat(merged.features()).containsExactly(
                new double[]{Math.sqrt(0.5), Math.sqrt(0.5)}, within(1e-9));
    }

    @Test
    void rejectsInvalidConfidence() {
        assertThatThrownBy(() -> VoiceProfile.of(new double[]{1}, 1.5, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void profilesCompareByValue() {
        assertThat(VoiceProfile.of(new double[]{2, 0}, 0.5, 1))
                .isEqualTo(VoiceProfile.of(new double[]{1, 0}, 0.5, 1));
    }
}
