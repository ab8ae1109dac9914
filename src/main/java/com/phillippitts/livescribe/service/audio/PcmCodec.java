package com.phillippitts.livescribe.service.audio;

import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.exception.InvalidAudioException;

/**
 * Converts between signed little-endian PCM bytes and {@link PcmAudio}.
 *
 * <p>Input may be a WAV container, whose fmt chunk then overrides the declared format, or raw
 * PCM in the declared format. Output is always raw PCM16LE.
 */
public final class PcmCodec {

    private PcmCodec() {
    }

    /**
     * Decodes WAV or raw PCM bytes.
     *
     * @param bytes audio bytes
     * @param declared format assumed for raw PCM
     * @throws InvalidAudioException if the payload is not frame aligned or the container is malformed
     */
    public static PcmAudio decode(byte[] bytes, AudioSpec declared) {
        if (bytes == null) {
            throw new InvalidAudioException("Audio data is null");
        }
        byte[] pcm = bytes;
        AudioSpec spec = declared;
        if (WavCodec.isWav(bytes)) {
            WavCodec.WavContent content = WavCodec.parse(bytes);
            pcm = content.pcm();
            spec = content.spec();
        }
        if (pcm.length % spec.blockAlign() != 0) {
            throw new InvalidAudioException(pcm.length, "PCM not aligned to frame size (" + spec.blockAlign() + " bytes)");
        }
        int frames = pcm.length / spec.blockAlign();
        int bytesPerSample = spec.bytesPerSample();
        double scale = Math.pow(2, spec.bitDepth() - 1);
        double[][] channels = new double[spec.channels()][frames];
        int pos = 0;
        for (int f = 0; f < frames; f++) {
            for (int c = 0; c < spec.channels(); c++) {
                channels[c][f] = readSample(pcm, pos, bytesPerSample) / scale;
                pos += bytesPerSample;
            }
        }
        return new PcmAudio(channels, spec.sampleRate());
    }

    /**
     * Encodes the first channel as PCM16LE mono, clipping to [-1, 1].
     */
    public static byte[] encodePcm16Mono(PcmAudio audio) {
        double[] samples = audio.samples();
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            double clipped = Math.max(-1.0, Math.min(1.0, samples[i]));
            int v = (int) Math.round(clipped * 32767.0);
            out[2 * i] = (byte) (v & 0xFF);
            out[2 * i + 1] = (byte) ((v >> 8) & 0xFF);
        }
        return out;
    }

    /** Convenience for decoding canonical PCM16LE mono bytes to samples. */
    public static double[] decodePcm16Mono(byte[] pcm) {
        int n = pcm.length / 2;
        double[] samples = new double[n];
        for (int i = 0; i < n; i++) {
            int v = (pcm[2 * i] & 0xFF) | (pcm[2 * i + 1] << 8);
            samples[i] = v / 32768.0;
        }
        return samples;
    }

    private static int readSample(byte[] a, int off, int bytesPerSample) {
        switch (bytesPerSample) {
            case 1:
                // 8-bit WAV is unsigned
                return (a[off] & 0xFF) - 128;
            case 2:
                return (a[off] & 0xFF) | (a[off + 1] << 8);
            case 3:
                return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8) | (a[off + 2] << 16);
            default:
                return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8) | ((a[off + 2] & 0xFF) << 16) | (a[off + 3] << 24);
        }
    }
}
