package com.phillippitts.livescribe.service.metrics;

import com.phillippitts.livescribe.domain.TranscriptionErrorCode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Single write path for chunk-attempt outcomes.
 *
 * <p>Folds each attempt into the session's {@link SessionQualityMetrics} and mirrors it to the
 * process-wide Micrometer meters. Successes and failures take different update paths; a failure
 * never moves the confidence average.
 */
@Component
public class QualityMetricsAggregator {

    private static final Logger LOG = LogManager.getLogger(QualityMetricsAggregator.class);

    private final TranscriptionMetrics meters;

    public QualityMetricsAggregator(TranscriptionMetrics meters) {
        this.meters = Objects.requireNonNull(meters, "meters must not be null");
    }

    public SessionQualityMetrics initialize(String sessionId, String initialModel) {
        meters.sessionOpened();
        LOG.debug("Quality metrics initialized for session {} on {}", sessionId, initialModel);
        return new SessionQualityMetrics(initialModel);
    }

    public void recordSuccess(SessionQualityMetrics metrics, String modelName, long latencyMs, double confidence) {
        metrics.recordSuccess(modelName, latencyMs, confidence);
        meters.recordLatency(modelName, TimeUnit.MILLISECONDS.toNanos(latencyMs));
        meters.incrementSuccess(modelName);
    }

    public void recordFailure(SessionQualityMetrics metrics, String modelName, long latencyMs,
                              TranscriptionErrorCode code) {
        metrics.recordFailure(modelName, latencyMs);
        meters.recordLatency(modelName, TimeUnit.MILLISECONDS.toNanos(latencyMs));
        meters.incrementFailure(modelName, code.name());
    }

    public void recordModelSwitch(String fromModel, String toModel) {
        meters.recordModelSwitch(fromModel, toModel);
    }

    /** Called once when a session leaves the registry. */
    public void remove(String sessionId) {
        meters.sessionClosed();
        LOG.debug("Quality metrics released for session {}", sessionId);
    }
}
