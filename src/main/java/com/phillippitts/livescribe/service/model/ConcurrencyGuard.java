package com.phillippitts.livescribe.service.model;

import com.phillippitts.livescribe.domain.TranscriptionErrorCode;
import com.phillippitts.livescribe.exception.TranscriptionExceptionBuilder;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds concurrent calls to one model with a semaphore.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * guard.acquire();
 * try {
 *     // call the model
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 */
final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String modelName;

    ConcurrencyGuard(int permits, long timeoutMs, String modelName) {
        this.semaphore = new Semaphore(permits, true);
        this.timeoutMs = timeoutMs;
        this.modelName = modelName;
    }

    /**
     * Waits up to the configured timeout for a permit.
     *
     * @throws com.phillippitts.livescribe.exception.TranscriptionException with
     *         {@link TranscriptionErrorCode#RATE_LIMIT_EXCEEDED} when no permit frees up in time
     */
    void acquire() {
        try {
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw TranscriptionExceptionBuilder.create("Concurrency limit reached")
                        .model(modelName)
                        .code(TranscriptionErrorCode.RATE_LIMIT_EXCEEDED)
                        .metadata("waitMs", timeoutMs)
                        .build();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TranscriptionExceptionBuilder.create("Interrupted while waiting for a model call slot")
                    .model(modelName)
                    .code(TranscriptionErrorCode.UNKNOWN_ERROR)
                    .cause(e)
                    .build();
        }
    }

    void release() {
        semaphore.release();
    }

    int availablePermits() {
        return semaphore.availablePermits();
    }
}
