package com.phillippitts.livescribe.service.audio;

import java.util.Objects;

/**
 * Decoded audio as per-channel sample arrays scaled to [-1, 1].
 *
 * <p>The arrays are shared, not copied; pipeline steps treat an instance as owned by the step
 * that created it.
 *
 * @param channels one array per channel, all of equal length
 * @param sampleRate samples per second per channel
 */
public record PcmAudio(double[][] channels, int sampleRate) {

    public PcmAudio {
        Objects.requireNonNull(channels, "channels must not be null");
        if (channels.length == 0) {
            throw new IllegalArgumentException("at least one channel is required");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        int length = channels[0].length;
        for (double[] channel : channels) {
            if (channel.length != length) {
                throw new IllegalArgumentException("channels must have equal length");
            }
        }
    }

    public static PcmAudio mono(double[] samples, int sampleRate) {
        return new PcmAudio(new double[][] {samples}, sampleRate);
    }

    public int channelCount() {
        return channels.length;
    }

    public int frameCount() {
        return channels[0].length;
    }

    /** First channel; the only one after channel folding. */
    public double[] samples() {
        return channels[0];
    }

    public long durationMs() {
        return Math.round(frameCount() * 1000.0 / sampleRate);
    }
}
