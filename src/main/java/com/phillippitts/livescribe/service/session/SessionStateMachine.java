package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.exception.SessionClosedException;
import com.phillippitts.livescribe.exception.SessionNotActiveException;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Guarded lifecycle status of one session.
 *
 * <pre>
 * INITIALIZING -> ACTIVE <-> PAUSED -> { COMPLETED | CANCELLED | ERROR }
 * </pre>
 *
 * <p>Transitions never wait for the chunk pipeline; a pause lands between chunks because the
 * pipeline re-checks {@link #requireActive()} after it acquires the session's pipeline lock.
 * Every transition wakes threads blocked in {@link #awaitNotPaused(long)}.
 *
 * <p>{@link #whileOpen(Supplier)} runs an action under the status lock; a transition requested
 * meanwhile (a cancel, say) waits until the action returns.
 */
final class SessionStateMachine {

    private final String sessionId;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private SessionStatus status = SessionStatus.INITIALIZING;

    SessionStateMachine(String sessionId) {
        this.sessionId = sessionId;
    }

    SessionStatus current() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    boolean isTerminal() {
        return current().isTerminal();
    }

    /**
     * Moves to {@code target}.
     *
     * @return the previous status
     * @throws SessionClosedException if the session already reached a terminal status
     * @throws SessionNotActiveException if the lifecycle does not allow the move
     */
    SessionStatus transitionTo(SessionStatus target) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                throw new SessionClosedException(sessionId, status);
            }
            if (!status.canTransitionTo(target)) {
                throw new SessionNotActiveException(sessionId, status);
            }
            SessionStatus previous = status;
            status = target;
            changed.signalAll();
            return previous;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pauses an active session.
     *
     * @return true if the status changed, false if it was already paused
     */
    boolean pause() {
        lock.lock();
        try {
            if (status == SessionStatus.PAUSED) {
                return false;
            }
            transitionTo(SessionStatus.PAUSED);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resumes a paused session.
     *
     * @return true if the status changed, false if it was already active
     */
    boolean resume() {
        lock.lock();
        try {
            if (status == SessionStatus.ACTIVE) {
                return false;
            }
            if (status != SessionStatus.PAUSED && !status.isTerminal()) {
                throw new SessionNotActiveException(sessionId, status);
            }
            transitionTo(SessionStatus.ACTIVE);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} while no transition can happen, provided the session is not terminal.
     * The action may itself call {@link #transitionTo(SessionStatus)}.
     *
     * @return the action's result
     * @throws SessionClosedException if the session already reached a terminal status
     */
    <T> T whileOpen(Supplier<T> action) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                throw new SessionClosedException(sessionId, status);
            }
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Throws unless the session currently accepts chunks.
     */
    void requireActive() {
        lock.lock();
        try {
            if (status.isTerminal()) {
                throw new SessionClosedException(sessionId, status);
            }
            if (!status.acceptsChunks()) {
                throw new SessionNotActiveException(sessionId, status);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks while the session is paused.
     *
     * @param timeoutMs upper bound of a single wait
     * @return the status observed on return
     * @throws InterruptedException if the waiting thread is interrupted
     */
    SessionStatus awaitNotPaused(long timeoutMs) throws InterruptedException {
        lock.lock();
        try {
            long remaining = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            while (status == SessionStatus.PAUSED && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            return status;
        } finally {
            lock.unlock();
        }
    }
}
