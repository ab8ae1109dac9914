package com.phillippitts.livescribe.service.model;

import com.phillippitts.livescribe.config.properties.ModelClientProperties;
import com.phillippitts.livescribe.domain.AudioSpec;
import com.phillippitts.livescribe.domain.TranscriptionErrorCode;
import com.phillippitts.livescribe.domain.TranscriptionResult;
import com.phillippitts.livescribe.exception.ModelUnavailableException;
import com.phillippitts.livescribe.exception.TranscriptionException;
import com.phillippitts.livescribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.livescribe.service.audio.WavCodec;
import com.phillippitts.livescribe.service.model.watchdog.ModelFailureEvent;
import com.phillippitts.livescribe.util.TimeUtils;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Default {@link ModelTranscriptionClient}.
 *
 * <p><b>Bounded calls:</b> every gateway call runs on the model executor and is abandoned after
 * {@code livescribe.model.call-timeout-ms}; a timeout is reported as
 * {@link TranscriptionErrorCode#MODEL_TIMEOUT} so a hung endpoint never blocks a session.
 *
 * <p><b>Shared tables:</b> statuses and performance live in concurrent maps and are replaced
 * through {@code compute}, so each model has one writer at a time. Loads of the same model are
 * serialized by a per-model lock.
 */
@Component
public class DefaultModelTranscriptionClient implements ModelTranscriptionClient {

    private static final Logger LOG = LogManager.getLogger(DefaultModelTranscriptionClient.class);

    private final SpeechModelGateway gateway;
    private final ModelClientProperties properties;
    private final Executor modelExecutor;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final ConcurrentMap<String, ModelStatus> statuses = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ModelPerformanceMetrics> performance = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> loadLocks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConcurrencyGuard> guards = new ConcurrentHashMap<>();

    public DefaultModelTranscriptionClient(SpeechModelGateway gateway,
                                           ModelClientProperties properties,
                                           @Qualifier("modelExecutor") Executor modelExecutor,
                                           ApplicationEventPublisher publisher,
                                           Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.modelExecutor = Objects.requireNonNull(modelExecutor, "modelExecutor must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @PostConstruct
    void preloadModels() {
        if (!properties.isPreloadOnStartup()) {
            return;
        }
        LOG.info("Preloading models: {}", properties.getModels());
        for (String model : properties.getModels()) {
            ModelStatus status = loadModel(model);
            LOG.info("Preload {} -> {}", model, status.state());
        }
    }

    @Override
    public TranscriptionResult transcribe(byte[] audio, AudioSpec spec, String modelName) {
        try {
            return transcribeWithModel(audio, spec, modelName);
        } catch (TranscriptionException primary) {
            if (primary.getErrorCode() == TranscriptionErrorCode.INVALID_AUDIO_FORMAT) {
                throw primary;
            }
            Optional<String> next = nextFallback(modelName);
            if (next.isEmpty()) {
                throw primary;
            }
            LOG.warn("Model {} failed ({}); trying fallback {}", modelName, primary.getErrorCode(), next.get());
            try {
                return transcribeWithModel(audio, spec, next.get());
            } catch (TranscriptionException secondary) {
                secondary.addSuppressed(primary);
                throw secondary;
            }
        }
    }

    @Override
    public TranscriptionResult transcribeWithModel(byte[] audio, AudioSpec spec, String modelName) {
        Objects.requireNonNull(audio, "audio must not be null");
        Objects.requireNonNull(spec, "spec must not be null");
        ensureReady(modelName);

        ConcurrencyGuard guard = guards.computeIfAbsent(modelName,
                m -> new ConcurrencyGuard(properties.getMaxConcurrentCallsPerModel(),
                        properties.getCallTimeoutMs(), m));
        guard.acquire();
        long start = System.nanoTime();
        try {
            byte[] wav = WavCodec.isWav(audio) ? audio : WavCodec.wrap(audio, spec);
            ModelOutput output = callBounded(modelName, () -> gateway.transcribe(wav, modelName));
            long elapsed = TimeUtils.elapsedMillis(start);
            double confidence = clampConfidence(output.confidence());
            performance.compute(modelName, (k, v) -> orEmpty(k, v).withSuccess(elapsed, confidence));
            statuses.computeIfPresent(modelName, (k, v) -> v.touched(clock.instant()));
            LOG.debug("Model {} transcribed {} bytes in {} ms", modelName, audio.length, elapsed);
            return new TranscriptionResult(output.text(), confidence, modelName, elapsed);
        } catch (TranscriptionException e) {
            long elapsed = TimeUtils.elapsedMillis(start);
            performance.compute(modelName, (k, v) -> orEmpty(k, v).withFailure(elapsed));
            onCallFailure(modelName, e);
            throw e;
        } finally {
            guard.release();
        }
    }

    @Override
    public ModelStatus loadModel(String modelName) {
        ReentrantLock lock = loadLocks.computeIfAbsent(modelName, m -> new ReentrantLock());
        lock.lock();
        try {
            return doLoad(modelName);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ModelStatus ensureReady(String modelName) {
        ModelStatus current = statuses.get(modelName);
        if (current != null && current.isReady()) {
            return current;
        }
        int attempts = properties.getLoadMaxAttempts();
        ReentrantLock lock = loadLocks.computeIfAbsent(modelName, m -> new ReentrantLock());
        String lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            lock.lock();
            try {
                ModelStatus latest = statuses.get(modelName);
                if (latest != null && latest.isReady()) {
                    return latest;
                }
                ModelStatus loaded = doLoad(modelName);
                if (loaded.isReady()) {
                    return loaded;
                }
                lastError = loaded.errorMessage();
            } finally {
                lock.unlock();
            }
            if (attempt < attempts) {
                sleepQuietly(properties.getLoadRetryBackoffMs() * attempt);
            }
        }
        throw new ModelUnavailableException(modelName,
                "failed to load after " + attempts + " attempts: " + lastError);
    }

    private ModelStatus doLoad(String modelName) {
        ModelStatus previous = statuses.get(modelName);
        statuses.put(modelName, ModelStatus.loading(modelName, previous));
        long start = System.nanoTime();
        try {
            callBounded(modelName, () -> {
                gateway.loadModel(modelName);
                return Boolean.TRUE;
            });
            ModelStatus ready = ModelStatus.ready(modelName, TimeUtils.elapsedMillis(start), clock.instant());
            statuses.put(modelName, ready);
            LOG.info("Model {} ready in {} ms", modelName, ready.loadTimeMs());
            return ready;
        } catch (TranscriptionException e) {
            ModelStatus failed = ModelStatus.error(modelName, previous, e.getMessage());
            statuses.put(modelName, failed);
            LOG.warn("Model {} failed to load: {}", modelName, e.getMessage());
            publishFailure(modelName, e, "load");
            return failed;
        }
    }

    @Override
    public Optional<ModelStatus> getModelStatus(String modelName) {
        return Optional.ofNullable(statuses.get(modelName));
    }

    @Override
    public Map<String, ModelStatus> getModelStatuses() {
        return Map.copyOf(statuses);
    }

    @Override
    public Optional<ModelPerformanceMetrics> getPerformance(String modelName) {
        return Optional.ofNullable(performance.get(modelName));
    }

    @Override
    public String getBestPerformingModel() {
        String best = null;
        double bestScore = 0.0;
        for (ModelPerformanceMetrics metrics : performance.values()) {
            if (metrics.usageCount() == 0) {
                continue;
            }
            double score = metrics.score();
            if (score > bestScore) {
                bestScore = score;
                best = metrics.modelName();
            }
        }
        return best != null ? best : properties.getModels().get(0);
    }

    @Override
    public List<String> fallbackModelsFor(String currentModel) {
        List<String> out = new ArrayList<>(properties.getModels());
        out.remove(currentModel);
        return List.copyOf(out);
    }

    @Override
    public ModelHealthReport healthCheck() {
        int ready = 0;
        int loading = 0;
        int error = 0;
        Map<String, ModelStatus> snapshot = new LinkedHashMap<>(statuses);
        for (ModelStatus status : snapshot.values()) {
            switch (status.state()) {
                case READY -> ready++;
                case LOADING -> loading++;
                case ERROR -> error++;
            }
        }
        double latencySum = 0.0;
        int used = 0;
        for (ModelPerformanceMetrics metrics : performance.values()) {
            if (metrics.usageCount() > 0) {
                latencySum += metrics.averageLatencyMs();
                used++;
            }
        }
        double averageLatency = used == 0 ? 0.0 : latencySum / used;

        ModelHealthReport.Status verdict;
        if (ready == 0) {
            verdict = ModelHealthReport.Status.UNHEALTHY;
        } else if (error > ready || averageLatency > properties.getDegradedLatencyMs()) {
            verdict = ModelHealthReport.Status.DEGRADED;
        } else {
            verdict = ModelHealthReport.Status.HEALTHY;
        }
        return new ModelHealthReport(verdict, ready, loading, error, averageLatency, snapshot);
    }

    @Override
    public boolean probe(String modelName) {
        try {
            return gateway.healthCheck(modelName);
        } catch (RuntimeException e) {
            LOG.debug("Probe of {} failed: {}", modelName, e.toString());
            return false;
        }
    }

    private Optional<String> nextFallback(String failedModel) {
        List<String> candidates = fallbackModelsFor(failedModel);
        for (String candidate : candidates) {
            ModelStatus status = statuses.get(candidate);
            if (status == null || status.state() != ModelState.ERROR) {
                return Optional.of(candidate);
            }
        }
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    private <T> T callBounded(String modelName, Supplier<T> call) {
        long timeoutMs = properties.getCallTimeoutMs();
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, modelExecutor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw TranscriptionExceptionBuilder.create("Model call timed out")
                    .model(modelName)
                    .code(TranscriptionErrorCode.MODEL_TIMEOUT)
                    .durationMs(timeoutMs)
                    .build();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TranscriptionException te) {
                throw te;
            }
            throw TranscriptionExceptionBuilder.create("Model call failed")
                    .model(modelName)
                    .code(ErrorClassifier.classify(cause))
                    .cause(cause)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw TranscriptionExceptionBuilder.create("Interrupted while waiting for model")
                    .model(modelName)
                    .code(TranscriptionErrorCode.MODEL_TIMEOUT)
                    .cause(e)
                    .build();
        }
    }

    private void onCallFailure(String modelName, TranscriptionException e) {
        LOG.warn("Model {} call failed: code={}, msg={}", modelName, e.getErrorCode(), e.getMessage());
        if (e.getErrorCode() == TranscriptionErrorCode.MODEL_UNAVAILABLE) {
            statuses.computeIfPresent(modelName, (k, v) -> ModelStatus.error(k, v, e.getMessage()));
        }
        publishFailure(modelName, e, "transcribe");
        if (e.getErrorCode() == TranscriptionErrorCode.RATE_LIMIT_EXCEEDED) {
            sleepQuietly(properties.getRateLimitBackoffMs());
        }
    }

    private void publishFailure(String modelName, TranscriptionException e, String phase) {
        try {
            publisher.publishEvent(new ModelFailureEvent(modelName, clock.instant(), e.getErrorCode(),
                    e.getMessage(), Map.of("phase", phase)));
        } catch (RuntimeException ex) {
            LOG.warn("Failed to publish model failure event for {}: {}", modelName, ex.toString());
        }
    }

    private double clampConfidence(Double reported) {
        double c = reported != null && !reported.isNaN() ? reported : properties.getDefaultConfidence();
        return Math.max(0.0, Math.min(1.0, c));
    }

    private static ModelPerformanceMetrics orEmpty(String modelName, ModelPerformanceMetrics existing) {
        return existing != null ? existing : ModelPerformanceMetrics.empty(modelName);
    }

    private static void sleepQuietly(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
