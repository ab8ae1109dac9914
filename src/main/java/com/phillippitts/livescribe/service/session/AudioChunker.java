package com.phillippitts.livescribe.service.session;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Cuts a byte stream into fixed-size overlapping windows.
 *
 * <p>Bytes accumulate until the buffer holds {@code chunkSize}; that window is emitted and its
 * trailing {@code overlapSize} bytes seed the next one. On end of stream, {@link #flush()} emits
 * the remainder if it holds bytes no window has carried yet.
 *
 * <p>Not thread-safe; owned by one stream consumer.
 */
final class AudioChunker {

    private final int chunkSize;
    private final int overlapSize;
    private byte[] buffer;
    private int length;
    private int retained;

    AudioChunker(int chunkSize, int overlapSize) {
        if (chunkSize <= 0 || overlapSize < 0 || overlapSize >= chunkSize) {
            throw new IllegalArgumentException("Require 0 <= overlapSize < chunkSize, got "
                    + overlapSize + "/" + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.overlapSize = overlapSize;
        this.buffer = new byte[chunkSize];
    }

    /**
     * Appends stream bytes.
     *
     * @return windows completed by this append, in stream order
     */
    List<byte[]> append(byte[] data, int offset, int count) {
        List<byte[]> windows = new ArrayList<>();
        int pos = offset;
        int end = offset + count;
        while (pos < end) {
            int n = Math.min(chunkSize - length, end - pos);
            System.arraycopy(data, pos, buffer, length, n);
            length += n;
            pos += n;
            if (length == chunkSize) {
                windows.add(Arrays.copyOf(buffer, chunkSize));
                System.arraycopy(buffer, chunkSize - overlapSize, buffer, 0, overlapSize);
                length = overlapSize;
                retained = overlapSize;
            }
        }
        return windows;
    }

    List<byte[]> append(byte[] data) {
        return append(data, 0, data.length);
    }

    /**
     * Emits the final partial window.
     *
     * @return the remainder, or empty when it only repeats the previous window's overlap
     */
    Optional<byte[]> flush() {
        if (length <= retained) {
            discard();
            return Optional.empty();
        }
        byte[] last = Arrays.copyOf(buffer, length);
        discard();
        return Optional.of(last);
    }

    /** Drops buffered bytes. */
    void discard() {
        length = 0;
        retained = 0;
    }

    int buffered() {
        return length;
    }
}
