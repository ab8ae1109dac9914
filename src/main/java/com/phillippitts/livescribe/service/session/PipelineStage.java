package com.phillippitts.livescribe.service.session;

/**
 * One step of the chunk pipeline. Exactly one implementation exists per {@link StageKind}.
 */
interface PipelineStage {

    StageKind kind();

    /** Whether the stage runs for this chunk; defaults to always. */
    default boolean appliesTo(ChunkContext context) {
        return true;
    }

    void apply(ChunkContext context);
}
