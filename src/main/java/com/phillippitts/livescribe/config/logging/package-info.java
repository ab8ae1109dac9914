/**
 * Log4j2 ThreadContext (MDC) scoping: {@code requestId} for HTTP requests and {@code sessionId}
 * for everything a transcription session does.
 */
package com.phillippitts.livescribe.config.logging;
