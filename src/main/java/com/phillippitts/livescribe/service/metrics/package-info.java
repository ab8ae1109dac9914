/**
 * Per-session quality statistics and process-wide Micrometer meters.
 */
package com.phillippitts.livescribe.service.metrics;
