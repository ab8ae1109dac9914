package com.phillippitts.livescribe.service.model.watchdog;

import java.time.Instant;

/**
 * Published when the watchdog brought a failed model back to ready.
 */
public record ModelRecoveredEvent(String modelName, Instant timestamp) {
}
