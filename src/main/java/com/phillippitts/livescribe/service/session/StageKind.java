package com.phillippitts.livescribe.service.session;

/**
 * Stages of the chunk pipeline, declared in execution order.
 */
enum StageKind {
    PREPROCESS,
    DIARIZE,
    TRANSCRIBE
}
