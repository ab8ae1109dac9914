package com.phillippitts.livescribe.service.postprocessing;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Publishes {@link PostProcessingRequestedEvent} on the event executor, off the finalizing thread.
 */
@Component
public class ApplicationEventPostProcessingScheduler implements PostProcessingScheduler {

    private static final Logger LOG = LogManager.getLogger(ApplicationEventPostProcessingScheduler.class);

    private final ApplicationEventPublisher publisher;
    private final Executor eventExecutor;
    private final Clock clock;

    public ApplicationEventPostProcessingScheduler(ApplicationEventPublisher publisher,
                                                   @Qualifier("eventExecutor") Executor eventExecutor,
                                                   Clock clock) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void schedule(PostProcessingRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        PostProcessingRequestedEvent event = new PostProcessingRequestedEvent(request, clock.instant());
        try {
            eventExecutor.execute(() -> publish(event));
        } catch (RejectedExecutionException e) {
            LOG.error("Post-processing for session {} not scheduled: event executor saturated",
                    request.sessionId());
        }
    }

    private void publish(PostProcessingRequestedEvent event) {
        try {
            publisher.publishEvent(event);
            LOG.info("Post-processing requested for transcript {} ({} segments)",
                    event.request().transcriptId(), event.request().segmentCount());
        } catch (RuntimeException e) {
            LOG.error("Post-processing listener failed for session {}", event.request().sessionId(), e);
        }
    }
}
