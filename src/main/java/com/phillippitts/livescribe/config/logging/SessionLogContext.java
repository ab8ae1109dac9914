package com.phillippitts.livescribe.config.logging;

import org.apache.logging.log4j.ThreadContext;

/**
 * Scopes {@code sessionId} in the Log4j2 ThreadContext for the duration of a session operation.
 *
 * <pre>
 * try (SessionLogContext ignored = SessionLogContext.open(sessionId)) {
 *     ...
 * }
 * </pre>
 *
 * <p>Restores whatever value the thread carried before, so nested scopes are safe.
 */
public final class SessionLogContext implements AutoCloseable {

    public static final String SESSION_ID = "sessionId";

    private final String previous;

    private SessionLogContext(String sessionId) {
        this.previous = ThreadContext.get(SESSION_ID);
        ThreadContext.put(SESSION_ID, sessionId);
    }

    public static SessionLogContext open(String sessionId) {
        return new SessionLogContext(sessionId);
    }

    @Override
    public void close() {
        if (previous == null) {
            ThreadContext.remove(SESSION_ID);
        } else {
            ThreadContext.put(SESSION_ID, previous);
        }
    }
}
