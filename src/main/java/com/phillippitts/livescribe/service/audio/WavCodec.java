package com.phillippitts.livescribe.service.audio;

import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.exception.InvalidAudioException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Reads and writes PCM WAV (RIFF/WAVE) containers.
 *
 * <p><b>Layout:</b>
 * <pre>
 * RIFF header (12 bytes)   "RIFF" size "WAVE"
 * fmt chunk                id + size (8 bytes), PCM fields (at least 16 bytes)
 * data chunk               id + size (8 bytes), interleaved PCM samples
 * </pre>
 *
 * <p>Parsing tolerates additional chunks and extended fmt chunks.
 */
public final class WavCodec {

    public static final int RIFF_HEADER_SIZE = 12;
    public static final int CHUNK_HEADER_SIZE = 8;
    public static final int FMT_CHUNK_MIN_SIZE = 16;
    public static final int AUDIO_FORMAT_PCM = 1;
    public static final int CANONICAL_HEADER_SIZE = 44;

    private WavCodec() {
    }

    /**
     * Parsed WAV container: format from the fmt chunk and a copy of the data chunk payload.
     */
    public record WavContent(AudioSpec spec, byte[] pcm) {
    }

    public static boolean isWav(byte[] a) {
        return a != null && a.length >= RIFF_HEADER_SIZE
                && a[0] == 'R' && a[1] == 'I' && a[2] == 'F' && a[3] == 'F'
                && a[8] == 'W' && a[9] == 'A' && a[10] == 'V' && a[11] == 'E';
    }

    /**
     * Parses a WAV container.
     *
     * @throws InvalidAudioException when chunks are missing, truncated or not integer PCM
     */
    public static WavContent parse(byte[] wav) {
        if (!isWav(wav)) {
            throw new InvalidAudioException(wav == null ? 0 : wav.length, "Not a RIFF/WAVE container");
        }
        int offset = RIFF_HEADER_SIZE;
        int fmtOffset = -1;
        int fmtSize = 0;
        int dataOffset = -1;
        int dataSize = 0;

        while (offset + CHUNK_HEADER_SIZE <= wav.length) {
            String chunkId = new String(wav, offset, 4, StandardCharsets.US_ASCII);
            int chunkSize = readLEInt(wav, offset + 4);
            if (chunkSize < 0) {
                throw new InvalidAudioException(wav.length, "Invalid chunk size " + chunkSize + " at offset " + offset);
            }
            if ("fmt ".equals(chunkId)) {
                fmtOffset = offset + CHUNK_HEADER_SIZE;
                fmtSize = chunkSize;
            } else if ("data".equals(chunkId)) {
                dataOffset = offset + CHUNK_HEADER_SIZE;
                // streaming writers leave the data size unset; clamp to what was received
                dataSize = Math.min(chunkSize, wav.length - dataOffset);
                break;
            }
            offset += CHUNK_HEADER_SIZE + chunkSize + (chunkSize % 2);
        }

        if (fmtOffset == -1 || fmtOffset + FMT_CHUNK_MIN_SIZE > wav.length || fmtSize < FMT_CHUNK_MIN_SIZE) {
            throw new InvalidAudioException(wav.length, "Missing or truncated fmt chunk");
        }
        if (dataOffset == -1) {
            throw new InvalidAudioException(wav.length, "Missing data chunk");
        }

        int audioFormat = readLEShort(wav, fmtOffset);
        int channels = readLEShort(wav, fmtOffset + 2);
        int sampleRate = readLEInt(wav, fmtOffset + 4);
        int bitsPerSample = readLEShort(wav, fmtOffset + 14);
        if (audioFormat != AUDIO_FORMAT_PCM) {
            throw new InvalidAudioException(wav.length, "Unsupported WAV encoding " + audioFormat
                    + " (expected " + AUDIO_FORMAT_PCM + " for PCM)");
        }
        AudioSpec spec;
        try {
            spec = new AudioSpec(sampleRate, channels, bitsPerSample);
        } catch (IllegalArgumentException e) {
            throw new InvalidAudioException(wav.length, "Unsupported WAV format: " + e.getMessage());
        }
        int usable = dataSize - (dataSize % spec.blockAlign());
        return new WavContent(spec, Arrays.copyOfRange(wav, dataOffset, dataOffset + usable));
    }

    /**
     * Wraps raw little-endian PCM in a canonical 44-byte WAV header.
     */
    public static byte[] wrap(byte[] pcm, AudioSpec spec) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(CANONICAL_HEADER_SIZE + pcm.length);
        out.writeBytes(new byte[] {'R', 'I', 'F', 'F'});
        writeLEInt(out, 36 + pcm.length);
        out.writeBytes(new byte[] {'W', 'A', 'V', 'E'});
        out.writeBytes(new byte[] {'f', 'm', 't', ' '});
        writeLEInt(out, FMT_CHUNK_MIN_SIZE);
        writeLEShort(out, AUDIO_FORMAT_PCM);
        writeLEShort(out, spec.channels());
        writeLEInt(out, spec.sampleRate());
        writeLEInt(out, spec.byteRate());
        writeLEShort(out, spec.blockAlign());
        writeLEShort(out, spec.bitDepth());
        out.writeBytes(new byte[] {'d', 'a', 't', 'a'});
        writeLEInt(out, pcm.length);
        out.writeBytes(pcm);
        return out.toByteArray();
    }

    static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
                | ((a[off + 1] & 0xFF) << 8)
                | ((a[off + 2] & 0xFF) << 16)
                | ((a[off + 3] & 0xFF) << 24);
    }

    private static void writeLEShort(ByteArrayOutputStream os, int v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(ByteArrayOutputStream os, int v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
