/**
 * Failure-driven model reloads with a sliding-window budget and cooldown.
 */
package com.phillippitts.livescribe.service.model.watchdog;
