package com.phillippitts.livescribe.service.validation;

import com.phillippitts.livescribe.config.properties.AudioValidationProperties;
import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.exception.InvalidAudioException;
import com.phillippitts.livescribe.service.audio.WavCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioValidatorTest {

    private AudioValidator validator;
    private AudioValidationProperties props;

    @BeforeEach
    void setup() {
        props = new AudioValidationProperties();
        props.setMaxChunkBytes(64 * 1024);
        validator = new AudioValidator(props);
    }

    @Test
    void pcmShouldAcceptFrameAlignedPayload() {
        // ~1 second at 16kHz mono 16-bit = 32,000 bytes
        byte[] pcm = new byte[32_000];

        assertThat(validator.validate(pcm, AudioSpec.PCM16_MONO_16K)).isEqualTo(AudioSpec.PCM16_MONO_16K);
    }

    @Test
    void pcmShouldRejectMisalignedPayload() {
        AudioSpec stereo = new AudioSpec(16_000, 2, 16);

        assertThatThrownBy(() -> validator.validate(new byte[6], stereo))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("block size (4 bytes)");
    }

    @Test
    void wavShouldReportHeaderFormat() {
        AudioSpec header = new AudioSpec(8_000, 1, 16);
        byte[] wav = WavCodec.wrap(new byte[1_600], header);

        assertThat(validator.validate(wav, AudioSpec.PCM16_MONO_16K)).isEqualTo(header);
    }

    @Test
    void wavShouldRejectEmptyDataChunk() {
        byte[] wav = WavCodec.wrap(new byte[0], AudioSpec.PCM16_MONO_16K);

        assertThatThrownBy(() -> validator.validate(wav, AudioSpec.PCM16_MONO_16K))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("data chunk is empty");
    }

    @Test
    void shouldRejectNullAndEmpty() {
        assertThatThrownBy(() -> validator.validate(null, AudioSpec.PCM16_MONO_16K))
                .isInstanceOf(InvalidAudioException.class);
        assertThatThrownBy(() -> validator.validate(new byte[0], AudioSpec.PCM16_MONO_16K))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void shouldRejectOversizedChunk() {
        byte[] big = new byte[64 * 1024 + 2];

        assertThatThrownBy(() -> validator.validate(big, AudioSpec.PCM16_MONO_16K))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("too large");
    }
}
