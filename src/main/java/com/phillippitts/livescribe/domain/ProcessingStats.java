package com.phillippitts.livescribe.domain;

/**
 * Aggregate processing statistics of a finalized session.
 *
 * @param totalChunks segments produced
 * @param averageProcessingTimeMs mean per-chunk pipeline time
 * @param modelSwitches model switches performed by the session, fallback and manual
 * @param errorCount chunk attempt failures
 * @param retryCount fallback retries performed
 */
public record ProcessingStats(int totalChunks,
                              double averageProcessingTimeMs,
                              int modelSwitches,
                              int errorCount,
                              int retryCount) {
}
