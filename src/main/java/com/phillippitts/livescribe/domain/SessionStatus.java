package com.phillippitts.livescribe.domain;

/**
 * Lifecycle status of a transcription session.
 *
 * <pre>
 * INITIALIZING -> ACTIVE <-> PAUSED -> { COMPLETED | CANCELLED | ERROR }
 * </pre>
 *
 * <p>Terminal states are sinks. Only {@link #ACTIVE} accepts audio chunks.
 */
public enum SessionStatus {
    INITIALIZING,
    ACTIVE,
    PAUSED,
    COMPLETED,
    CANCELLED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == ERROR;
    }

    public boolean acceptsChunks() {
        return this == ACTIVE;
    }

    /**
     * Returns true when the lifecycle allows moving from this status to {@code target}.
     */
    public boolean canTransitionTo(SessionStatus target) {
        return switch (this) {
            case INITIALIZING -> target == ACTIVE || target == CANCELLED || target == ERROR;
            case ACTIVE -> target == PAUSED || target == COMPLETED || target == CANCELLED || target == ERROR;
            case PAUSED -> target == ACTIVE || target == COMPLETED || target == CANCELLED || target == ERROR;
            case COMPLETED, CANCELLED, ERROR -> false;
        };
    }
}
