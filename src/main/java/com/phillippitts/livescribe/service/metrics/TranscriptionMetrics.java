package com.phillippitts.livescribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer instrumentation for the chunk pipeline.
 *
 * <p>Provides:
 * <ul>
 *   <li>Chunk transcription latency per model</li>
 *   <li>Success and failure counts per model, failures tagged with the error code</li>
 *   <li>Model switches (fallback or manual)</li>
 *   <li>Number of live sessions</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class TranscriptionMetrics {

    static final String METRIC_PREFIX = "livescribe.transcription";

    private final MeterRegistry registry;
    private final AtomicInteger activeSessions = new AtomicInteger();

    public TranscriptionMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".sessions.active", activeSessions, AtomicInteger::get)
                .description("Sessions currently accepting or processing audio")
                .register(registry);
    }

    /**
     * Records transcription latency of one chunk attempt.
     *
     * @param modelName model that handled the attempt
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String modelName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to transcribe one chunk")
                .tag("model", modelName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String modelName) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successfully transcribed chunks")
                .tag("model", modelName)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param modelName model that failed
     * @param code error code name (MODEL_TIMEOUT, NETWORK_ERROR, ...)
     */
    public void incrementFailure(String modelName, String code) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed chunk transcriptions")
                .tag("model", modelName)
                .tag("code", code)
                .register(registry)
                .increment();
    }

    public void recordModelSwitch(String fromModel, String toModel) {
        Counter.builder(METRIC_PREFIX + ".model.switch")
                .description("Number of session model switches")
                .tag("from", fromModel)
                .tag("to", toModel)
                .register(registry)
                .increment();
    }

    public void sessionOpened() {
        activeSessions.incrementAndGet();
    }

    public void sessionClosed() {
        activeSessions.updateAndGet(n -> Math.max(0, n - 1));
    }

    int activeSessionCount() {
        return activeSessions.get();
    }
}
