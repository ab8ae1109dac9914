package com.phillippitts.livescribe.exception;

/**
 * Thrown when an operation names a session id that was never registered.
 */
public class SessionNotFoundException extends LiveScribeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
