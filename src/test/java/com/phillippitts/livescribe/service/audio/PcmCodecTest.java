package com.phillippitts.livescribe.service.audio;

import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.exception.InvalidAudioException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PcmCodecTest {

    @Test
    void decodesInterleavedStereoIntoChannels() {
        // frame 0: L=16384, R=-16384
        byte[] pcm = {0x00, 0x40, 0x00, (byte) 0xC0};

        PcmAudio audio = PcmCodec.decode(pcm, new AudioSpec(16_000, 2, 16));

        assertThat(audio.channelCount()).isEqualTo(2);
        assertThat(audio.channels()[0][0]).isCloseTo(0.5, within(1e-9));
        assertThat(audio.channels()[1][0]).isCloseTo(-0.5, within(1e-9));
    }

    @Test
    void eightBitSamplesAreUnsigned() {
        PcmAudio audio = PcmCodec.decode(new byte[]{(byte) 128, (byte) 255, 0}, new AudioSpec(8_000, 1, 8));

        assertThat(audio.samples()[0]).isZero();
        assertThat(audio.samples()[1]).isCloseTo(127 / 128.0, within(1e-9));
        assertThat(audio.samples()[2]).isEqualTo(-1.0);
    }

    @Test
    void wavInputUsesContainerFormatOverDeclared() {
        byte[] wav = WavCodec.wrap(new byte[8_000 * 2], new AudioSpec(8_000, 1, 16));

        PcmAudio audio = PcmCodec.decode(wav, AudioSpec.PCM16_MONO_16K);

        assertThat(audio.sampleRate()).isEqualTo(8_000);
        assertThat(audio.durationMs()).isEqualTo(1_000);
    }

    @Test
    void rejectsMisalignedPcm() {
        assertThatThrownBy(() -> PcmCodec.decode(new byte[3], AudioSpec.PCM16_MONO_16K))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("frame size");
    }

    @Test
    void encodeClipsOutOfRangeSamples() {
        byte[] out = PcmCodec.encodePcm16Mono(PcmAudio.mono(new double[]{2.0, -2.0}, 16_000));

        double[] back = PcmCodec.decodePcm16Mono(out);
        assertThat(back[0]).isCloseTo(32767 / 32768.0, within(1e-9));
        assertThat(back[1]).isCloseTo(-32767 / 32768.0, within(1e-9));
    }
}
