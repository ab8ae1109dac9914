package com.phillippitts.livescribe.exception;

import com.phillippitts.livescribe.domain.SessionStatus;

/**
 * Thrown when an operation requires an {@link SessionStatus#ACTIVE} session but the session is
 * initializing or paused.
 */
public class SessionNotActiveException extends LiveScribeException {

    private final String sessionId;
    private final SessionStatus status;

    public SessionNotActiveException(String sessionId, SessionStatus status) {
        super("Session " + sessionId + " is not active (status: " + status + ")");
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
