package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.config.properties.TranscriptionProperties;
import com.phillippitts.livescribe.domain.SessionSnapshot;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.exception.LiveScribeException;
import com.phillippitts.livescribe.exception.SessionClosedException;
import com.phillippitts.livescribe.exception.SessionNotFoundException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * The single owner of live sessions, keyed by id.
 *
 * <p>Evicted sessions leave a tombstone (bounded, oldest dropped first) so late callers get
 * {@link SessionClosedException} instead of {@link SessionNotFoundException}. Sessions that
 * ended in {@link SessionStatus#ERROR} keep their final snapshot in the tombstone and stay
 * queryable.
 */
@Component
public class SessionRegistry {

    static final int MAX_TOMBSTONES = 1024;

    private final int maxActiveSessions;
    private final ConcurrentMap<String, TranscriptionSession> live = new ConcurrentHashMap<>();
    private final Map<String, Tombstone> tombstones = new LinkedHashMap<>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Tombstone> eldest) {
            return size() > MAX_TOMBSTONES;
        }
    };

    public SessionRegistry(TranscriptionProperties properties) {
        this.maxActiveSessions = properties.getMaxActiveSessions();
    }

    private record Tombstone(SessionStatus status, SessionSnapshot finalSnapshot) {
    }

    void register(TranscriptionSession session) {
        Objects.requireNonNull(session, "session must not be null");
        synchronized (live) {
            if (live.size() >= maxActiveSessions) {
                throw new LiveScribeException("Session limit reached (" + maxActiveSessions + ")");
            }
            live.put(session.id(), session);
        }
    }

    /**
     * Live session by id.
     *
     * @throws SessionClosedException if the session was evicted
     * @throws SessionNotFoundException if the id was never registered
     */
    TranscriptionSession require(String sessionId) {
        TranscriptionSession session = live.get(sessionId);
        if (session != null) {
            return session;
        }
        Tombstone tombstone = tombstone(sessionId);
        if (tombstone != null) {
            throw new SessionClosedException(sessionId, tombstone.status());
        }
        throw new SessionNotFoundException(sessionId);
    }

    Optional<TranscriptionSession> find(String sessionId) {
        return Optional.ofNullable(live.get(sessionId));
    }

    /** Final snapshot of a session evicted in {@link SessionStatus#ERROR}. */
    Optional<SessionSnapshot> retainedSnapshot(String sessionId) {
        Tombstone tombstone = tombstone(sessionId);
        return tombstone == null ? Optional.empty() : Optional.ofNullable(tombstone.finalSnapshot());
    }

    /**
     * Removes a session that reached a terminal status.
     *
     * @param finalSnapshot kept for {@link SessionStatus#ERROR} sessions, ignored otherwise
     */
    void evict(String sessionId, SessionStatus status, SessionSnapshot finalSnapshot) {
        SessionSnapshot kept = status == SessionStatus.ERROR ? finalSnapshot : null;
        synchronized (tombstones) {
            tombstones.put(sessionId, new Tombstone(status, kept));
        }
        live.remove(sessionId);
    }

    public Set<String> activeSessionIds() {
        return Set.copyOf(live.keySet());
    }

    public int size() {
        return live.size();
    }

    private Tombstone tombstone(String sessionId) {
        synchronized (tombstones) {
            return tombstones.get(sessionId);
        }
    }
}
