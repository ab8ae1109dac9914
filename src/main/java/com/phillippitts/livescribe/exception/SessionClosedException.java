package com.phillippitts.livescribe.exception;

import com.phillippitts.livescribe.domain.SessionStatus;

/**
 * Thrown when an operation targets a session that already reached a terminal state.
 */
public class SessionClosedException extends LiveScribeException {

    private final String sessionId;
    private final SessionStatus status;

    public SessionClosedException(String sessionId, SessionStatus status) {
        super("Session " + sessionId + " is closed (status: " + status + ")");
        this.sessionId = sessionId;
        this.status = status;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
