package com.phillippitts.livescribe.service.session.event;

import com.phillippitts.livescribe.domain.SessionStatus;

/**
 * A session moved between lifecycle states.
 */
public record SessionStatusChangedEvent(String sessionId, SessionStatus from, SessionStatus to) {
}
