package com.phillippitts.livescribe.domain;

/**
 * Sample format of raw PCM audio: signed little-endian integers, interleaved channels.
 *
 * @param sampleRate samples per second per channel
 * @param channels number of interleaved channels
 * @param bitDepth bits per sample, a positive multiple of 8
 */
public record AudioSpec(int sampleRate, int channels, int bitDepth) {

    /** 16 kHz, mono, 16-bit: the canonical internal format. */
    public static final AudioSpec PCM16_MONO_16K = new AudioSpec(16_000, 1, 16);

    public AudioSpec {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive");
        }
        if (bitDepth <= 0 || bitDepth % 8 != 0 || bitDepth > 32) {
            throw new IllegalArgumentException("bitDepth must be 8, 16, 24 or 32");
        }
    }

    public int bytesPerSample() {
        return bitDepth / 8;
    }

    /** Bytes per sample frame (all channels). */
    public int blockAlign() {
        return bytesPerSample() * channels;
    }

    public int byteRate() {
        return sampleRate * blockAlign();
    }

    /**
     * Duration of {@code byteCount} bytes of audio in this format.
     *
     * @return duration in milliseconds
     */
    public long durationMs(long byteCount) {
        return Math.round(byteCount / (double) byteRate() * 1000.0);
    }
}
