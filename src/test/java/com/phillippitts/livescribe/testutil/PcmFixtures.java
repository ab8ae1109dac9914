package com.phillippitts.livescribe.testutil;

import com.phillippitts.livescribe.domain.AudioSpec;

/**
 * Synthetic 16-bit little-endian PCM for tests.
 */
public final class PcmFixtures {

    private PcmFixtures() {
    }

    public static byte[] silence(int millis) {
        return new byte[bytesFor(millis, AudioSpec.PCM16_MONO_16K)];
    }

    /** Sine tone at {@code amplitude} of full scale, mono 16 kHz. */
    public static byte[] tone(int millis, double frequencyHz, double amplitude) {
        AudioSpec spec = AudioSpec.PCM16_MONO_16K;
        int frames = bytesFor(millis, spec) / 2;
        byte[] out = new byte[frames * 2];
        for (int i = 0; i < frames; i++) {
            double v = amplitude * Math.sin(2 * Math.PI * frequencyHz * i / spec.sampleRate());
            short s = (short) Math.round(v * Short.MAX_VALUE);
            out[2 * i] = (byte) (s & 0xFF);
            out[2 * i + 1] = (byte) ((s >> 8) & 0xFF);
        }
        return out;
    }

    /** A loud voiced-like signal: two harmonics of a 180 Hz fundamental. */
    public static byte[] voice(int millis) {
        byte[] a = tone(millis, 180, 0.3);
        byte[] b = tone(millis, 360, 0.15);
        byte[] out = new byte[a.length];
        for (int i = 0; i < a.length; i += 2) {
            int sa = (short) ((a[i] & 0xFF) | (a[i + 1] << 8));
            int sb = (short) ((b[i] & 0xFF) | (b[i + 1] << 8));
            short s = (short) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, sa + sb));
            out[i] = (byte) (s & 0xFF);
            out[i + 1] = (byte) ((s >> 8) & 0xFF);
        }
        return out;
    }

    public static int bytesFor(int millis, AudioSpec spec) {
        long frames = (long) spec.sampleRate() * millis / 1000;
        return (int) (frames * spec.blockAlign());
    }
}
