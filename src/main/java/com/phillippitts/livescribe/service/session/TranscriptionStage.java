package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.TranscriptionErrorCode;
import com.phillippitts.livescribe.domain.TranscriptionError;
import com.phillippitts.livescribe.domain.TranscriptionResult;
import com.phillippitts.livescribe.exception.TranscriptionException;
import com.phillippitts.livescribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.livescribe.service.metrics.QualityMetricsAggregator;
import com.phillippitts.livescribe.service.model.ErrorClassifier;
import com.phillippitts.livescribe.service.model.ModelTranscriptionClient;
import com.phillippitts.livescribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;

/**
 * Transcribes a chunk with the session's active model, owning the session's fallback policy.
 *
 * <p><b>Fallback:</b> every failed attempt increments the session's error count and becomes
 * its last error. After a failure the session switches to its next fallback model and retries
 * the chunk once, provided a fallback is left, the error count is still below the error budget
 * and the failure is not {@link TranscriptionErrorCode#INVALID_AUDIO_FORMAT}. Otherwise the
 * failure propagates.
 */
final class TranscriptionStage implements PipelineStage {

    private static final Logger LOG = LogManager.getLogger(TranscriptionStage.class);

    private final ModelTranscriptionClient client;
    private final QualityMetricsAggregator aggregator;
    private final int errorBudget;
    private final Clock clock;

    TranscriptionStage(ModelTranscriptionClient client, QualityMetricsAggregator aggregator,
                       int errorBudget, Clock clock) {
        this.client = client;
        this.aggregator = aggregator;
        this.errorBudget = errorBudget;
        this.clock = clock;
    }

    @Override
    public StageKind kind() {
        return StageKind.TRANSCRIBE;
    }

    @Override
    public void apply(ChunkContext context) {
        TranscriptionSession session = context.session();
        String model = session.currentModel();
        try {
            context.result(attempt(context, model));
        } catch (TranscriptionException first) {
            int errors = recordFailure(context, model, first);
            if (!canFallBack(session, first, errors)) {
                throw first;
            }
            String next = session.switchToNextFallback();
            aggregator.recordModelSwitch(model, next);
            LOG.warn("Model {} failed ({}); session switched to {} and retries chunk {}",
                    model, first.getErrorCode(), next, context.chunk().getId());
            try {
                context.result(attempt(context, next));
            } catch (TranscriptionException second) {
                recordFailure(context, next, second);
                second.addSuppressed(first);
                throw second;
            }
        }
    }

    private boolean canFallBack(TranscriptionSession session, TranscriptionException failure, int errors) {
        return failure.getErrorCode() != TranscriptionErrorCode.INVALID_AUDIO_FORMAT
                && session.hasFallback()
                && errors < errorBudget;
    }

    private TranscriptionResult attempt(ChunkContext context, String model) {
        TranscriptionSession session = context.session();
        long start = System.nanoTime();
        try {
            TranscriptionResult result = client.transcribeWithModel(context.audio(), context.spec(), model);
            aggregator.recordSuccess(session.metrics(), model, result.processingTimeMs(), result.confidence());
            return result;
        } catch (TranscriptionException e) {
            aggregator.recordFailure(session.metrics(), model, TimeUtils.elapsedMillis(start), e.getErrorCode());
            throw e;
        } catch (RuntimeException e) {
            TranscriptionException wrapped = TranscriptionExceptionBuilder.create("Transcription failed")
                    .model(model)
                    .code(ErrorClassifier.classify(e))
                    .cause(e)
                    .build();
            aggregator.recordFailure(session.metrics(), model, TimeUtils.elapsedMillis(start),
                    wrapped.getErrorCode());
            throw wrapped;
        }
    }

    private int recordFailure(ChunkContext context, String model, TranscriptionException failure) {
        TranscriptionError error = new TranscriptionError(failure.getErrorCode(), failure.getMessage(),
                model, clock.instant());
        context.failures().add(error);
        return context.session().recordFailure(error);
    }
}
