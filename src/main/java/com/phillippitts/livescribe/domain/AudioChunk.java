package com.phillippitts.livescribe.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * A bounded slice of raw audio owned by the pipeline for the duration of one processing pass.
 *
 * <p>Not retained after its segment is emitted. Not thread-safe; a chunk is only touched by the
 * thread running its session's pipeline.
 */
public final class AudioChunk {

    private final String id;
    private final byte[] data;
    private final long arrivalOffsetMs;
    private final long durationMs;
    private final AudioSpec audioSpec;
    private boolean processed;
    private String segmentId;

    public AudioChunk(byte[] data, long arrivalOffsetMs, AudioSpec audioSpec) {
        this.id = UUID.randomUUID().toString();
        this.data = Objects.requireNonNull(data, "data must not be null");
        this.audioSpec = Objects.requireNonNull(audioSpec, "audioSpec must not be null");
        this.arrivalOffsetMs = arrivalOffsetMs;
        this.durationMs = audioSpec.durationMs(data.length);
    }

    public String getId() {
        return id;
    }

    /** Returns the backing array; callers must not modify it. */
    public byte[] getData() {
        return data;
    }

    public long getArrivalOffsetMs() {
        return arrivalOffsetMs;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public AudioSpec getAudioSpec() {
        return audioSpec;
    }

    public boolean isProcessed() {
        return processed;
    }

    public String getSegmentId() {
        return segmentId;
    }

    public void markProcessed(String segmentId) {
        this.processed = true;
        this.segmentId = segmentId;
    }
}
