package com.phillippitts.livescribe.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class SessionStatusTest {

    @ParameterizedTest
    @EnumSource(value = SessionStatus.class, names = {"COMPLETED", "CANCELLED", "ERROR"})
    void terminalStatesAreSinks(SessionStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (SessionStatus target : SessionStatus.values()) {
            assertThat(terminal.canTransitionTo(target)).isFalse();
        }
    }

    @Test
    void pauseAndResumeAlternate() {
        assertThat(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.PAUSED)).isTrue();
        assertThat(SessionStatus.PAUSED.canTransitionTo(SessionStatus.ACTIVE)).isTrue();
        assertThat(SessionStatus.INITIALIZING.canTransitionTo(SessionStatus.PAUSED)).isFalse();
    }

    @Test
    void onlyActiveAcceptsChunks() {
        for (SessionStatus s : SessionStatus.values()) {
            assertThat(s.acceptsChunks()).isEqualTo(s == SessionStatus.ACTIVE);
        }
    }
}
