package com.phillippitts.livescribe.service.postprocessing;

/**
 * Fire-and-forget handoff of finalized transcripts.
 */
public interface PostProcessingScheduler {

    /**
     * Submits the job asynchronously. Never blocks on the job and never throws for delivery failures.
     */
    void schedule(PostProcessingRequest request);
}
