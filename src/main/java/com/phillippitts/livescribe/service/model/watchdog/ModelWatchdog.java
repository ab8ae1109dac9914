package com.phillippitts.livescribe.service.model.watchdog;

import com.phillippitts.livescribe.config.properties.ModelWatchdogProperties;
import com.phillippitts.livescribe.domain.TranscriptionErrorCode;
import com.phillippitts.livescribe.service.model.ModelStatus;
import com.phillippitts.livescribe.service.model.ModelTranscriptionClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event-driven watchdog that reloads models after call failures, within a budget.
 *
 * <p>Detection model:
 * <ul>
 *   <li>The model client publishes {@link ModelFailureEvent} when a call fails.</li>
 *   <li>Failures that suggest the model went away ({@code MODEL_UNAVAILABLE}, {@code MODEL_TIMEOUT})
 *       trigger a probe and reload, tracked in a sliding window per model.</li>
 *   <li>Once the window budget is spent the model is DISABLED until the cooldown elapses.</li>
 * </ul>
 *
 * <p>Load failures are ignored here: loads already run under the client's own retry budget.
 */
@Component
@ConditionalOnProperty(prefix = "livescribe.watchdog", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ModelWatchdog {

    private static final Logger LOG = LogManager.getLogger(ModelWatchdog.class);

    private static final Set<TranscriptionErrorCode> RELOAD_TRIGGERS =
            EnumSet.of(TranscriptionErrorCode.MODEL_UNAVAILABLE, TranscriptionErrorCode.MODEL_TIMEOUT);

    public enum WatchState { HEALTHY, DEGRADED, DISABLED }

    private final ModelTranscriptionClient client;
    private final ModelWatchdogProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final ConcurrentMap<String, Deque<Instant>> reloadWindow = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, WatchState> state = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> disabledUntil = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> reloadLocks = new ConcurrentHashMap<>();

    public ModelWatchdog(ModelTranscriptionClient client,
                         ModelWatchdogProperties props,
                         ApplicationEventPublisher publisher,
                         Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** Visible for tests. */
    WatchState getState(String model) {
        return state.getOrDefault(model, WatchState.HEALTHY);
    }

    /**
     * True unless the model is disabled and its cooldown has not elapsed.
     *
     * @param model model name
     * @return whether reloads of this model are currently allowed
     */
    public boolean isModelEnabled(String model) {
        Instant until = disabledUntil.get(model);
        return until == null || !clock.instant().isBefore(until);
    }

    @EventListener
    public void onFailure(ModelFailureEvent event) {
        String model = event.modelName();
        if ("load".equals(event.context().get("phase"))) {
            return;
        }
        if (!RELOAD_TRIGGERS.contains(event.code())) {
            LOG.debug("Model {} failure {} does not warrant a reload", model, event.code());
            return;
        }
        LOG.warn("Model failure: model={}, code={}, msg={}", model, event.code(), event.message());
        if (!isModelEnabled(model)) {
            LOG.warn("Model {} disabled until {}", model, disabledUntil.get(model));
            return;
        }
        state.put(model, WatchState.DEGRADED);
        attemptReload(model);
    }

    @EventListener
    public void onRecovered(ModelRecoveredEvent event) {
        String model = event.modelName();
        state.put(model, WatchState.HEALTHY);
        windowFor(model).clear();
        disabledUntil.remove(model);
        LOG.info("Model recovered: {}", model);
    }

    @Scheduled(fixedRateString = "${livescribe.watchdog.summary-interval-ms:60000}")
    void logHealthSummary() {
        if (state.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder("Watchdog states: ");
        state.forEach((name, st) -> sb.append(name).append('=').append(st).append(' '));
        LOG.info(sb.toString().trim());
    }

    private void attemptReload(String model) {
        ReentrantLock lock = reloadLocks.computeIfAbsent(model, m -> new ReentrantLock());
        if (!lock.tryLock()) {
            LOG.debug("Reload already in progress for {}", model);
            return;
        }
        try {
            if (!isModelEnabled(model)) {
                return;
            }
            Deque<Instant> window = windowFor(model);
            pruneOld(window);
            if (window.size() >= props.getMaxReloadsPerWindow()) {
                disable(model, window.size());
                return;
            }
            window.addLast(clock.instant());
            if (tryReload(model)) {
                publisher.publishEvent(new ModelRecoveredEvent(model, clock.instant()));
            } else {
                state.put(model, WatchState.DEGRADED);
                LOG.warn("Model {} reload failed; remaining DEGRADED", model);
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean tryReload(String model) {
        if (!client.probe(model)) {
            LOG.warn("Model {} endpoint probe failed; skipping reload", model);
            return false;
        }
        LOG.warn("Reloading model {}", model);
        ModelStatus status = client.loadModel(model);
        return status.isReady();
    }

    private void disable(String model, int attempts) {
        state.put(model, WatchState.DISABLED);
        Instant until = clock.instant().plus(Duration.ofMinutes(props.getCooldownMinutes()));
        disabledUntil.put(model, until);
        LOG.error("Model {} disabled after {} reloads within {}m; cooldown until {}",
                model, attempts, props.getWindowMinutes(), until);
    }

    private Deque<Instant> windowFor(String model) {
        return reloadWindow.computeIfAbsent(model, m -> new ArrayDeque<>());
    }

    private void pruneOld(Deque<Instant> window) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(props.getWindowMinutes()));
        while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
            window.removeFirst();
        }
    }
}
