package com.phillippitts.livescribe.service.model.watchdog;

import com.phillippitts.livescribe.domain.TranscriptionErrorCode;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a model call or load fails.
 *
 * @param modelName failing model
 * @param timestamp when the failure was observed
 * @param code classified failure
 * @param message failure description
 * @param context additional diagnostic details
 */
public record ModelFailureEvent(String modelName,
                                Instant timestamp,
                                TranscriptionErrorCode code,
                                String message,
                                Map<String, String> context) {

    public ModelFailureEvent {
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
