package com.phillippitts.livescribe.service.session.event;

import com.phillippitts.livescribe.domain.SessionSnapshot;

/**
 * A session became active.
 */
public record SessionStartedEvent(SessionSnapshot session) {
}
