package com.phillippitts.livescribe.domain;

import java.util.List;

/**
 * Model usage summary attached to a full transcript.
 *
 * @param primaryModel model the session was configured with
 * @param fallbackModelsUsed distinct models other than the primary that produced segments
 * @param averageConfidence mean segment confidence, 0 with no segments
 * @param processingStats processing statistics
 * @param totalTokens whitespace separated word count over all segments
 * @param apiCalls model calls that produced segments
 * @param estimatedCost cost estimate in USD
 */
public record ModelMetadata(String primaryModel,
                            List<String> fallbackModelsUsed,
                            double averageConfidence,
                            ProcessingStats processingStats,
                            long totalTokens,
                            int apiCalls,
                            double estimatedCost) {

    public ModelMetadata {
        fallbackModelsUsed = List.copyOf(fallbackModelsUsed);
    }
}
