package com.phillippitts.livescribe.service.validation;

import com.phillippitts.livescribe.config.properties.AudioValidationProperties;
import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.exception.InvalidAudioException;
import com.phillippitts.livescribe.service.audio.WavCodec;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Validates an incoming chunk as either WAV (RIFF/WAVE) or raw PCM before it enters the pipeline.
 *
 * <p>WAV: the chunk structure must carry a PCM fmt chunk and a data chunk; the header's format
 * wins over the session's declared format.
 *
 * <p>PCM: the payload must be aligned to the declared block size.
 */
@Component
public class AudioValidator {

    private final AudioValidationProperties props;

    public AudioValidator(AudioValidationProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    /**
     * Validates a chunk and returns the format it is actually encoded in.
     *
     * @param data chunk bytes
     * @param declared format configured for the session
     * @return the WAV header's format for WAV input, otherwise {@code declared}
     * @throws InvalidAudioException when the chunk is empty, oversized or malformed
     */
    public AudioSpec validate(byte[] data, AudioSpec declared) {
        Objects.requireNonNull(declared, "declared must not be null");
        if (data == null) {
            throw new InvalidAudioException("Audio data is null");
        }
        if (data.length == 0) {
            throw new InvalidAudioException(0, "Audio chunk is empty");
        }
        if (data.length > props.getMaxChunkBytes()) {
            throw new InvalidAudioException(data.length,
                    "Audio chunk too large: " + data.length + " bytes. Max: " + props.getMaxChunkBytes() + " bytes");
        }

        if (WavCodec.isWav(data)) {
            WavCodec.WavContent content = WavCodec.parse(data);
            if (content.pcm().length == 0) {
                throw new InvalidAudioException(data.length, "WAV data chunk is empty");
            }
            return content.spec();
        }

        if (data.length % declared.blockAlign() != 0) {
            throw new InvalidAudioException(data.length, "PCM data not aligned to block size ("
                    + declared.blockAlign() + " bytes). Size: " + data.length);
        }
        return declared;
    }
}
