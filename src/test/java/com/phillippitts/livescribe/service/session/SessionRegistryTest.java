package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.config.properties.TranscriptionProperties;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.TranscriptionConfig;
import com.phillippitts.livescribe.exception.LiveScribeException;
import com.phillippitts.livescribe.exception.SessionClosedException;
import com.phillippitts.livescribe.exception.SessionNotFoundException;
import com.phillippitts.livescribe.service.metrics.SessionQualityMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        TranscriptionProperties props = new TranscriptionProperties();
        props.setMaxActiveSessions(2);
        registry = new SessionRegistry(props);
    }

    @Test
    void unknownIdIsNotFound() {
        assertThatThrownBy(() -> registry.require("nope")).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void enforcesSessionLimit() {
        registry.register(session("a"));
        registry.register(session("b"));

        assertThatThrownBy(() -> registry.register(session("c")))
                .isInstanceOf(LiveScribeException.class)
                .hasMessageContaining("limit");
        assertThat(registry.activeSessionIds()).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void evictedSessionIsClosedNotMissing() {
        TranscriptionSession session = session("a");
        registry.register(session);

        registry.evict("a", SessionStatus.COMPLETED, session.snapshot());

        assertThat(registry.size()).isZero();
        assertThatThrownBy(() -> registry.require("a"))
                .isInstanceOf(SessionClosedException.class)
                .extracting(e -> ((SessionClosedException) e).getStatus())
                .isEqualTo(SessionStatus.COMPLETED);
        assertThat(registry.retainedSnapshot("a")).isEmpty();
    }

    @Test
    void failedSessionKeepsFinalSnapshot() {
        TranscriptionSession session = session("a");
        registry.register(session);

        registry.evict("a", SessionStatus.ERROR, session.snapshot());

        assertThat(registry.retainedSnapshot("a")).hasValueSatisfying(s -> assertThat(s.id()).isEqualTo("a"));
        assertThat(registry.find("a")).isEmpty();
    }

    @Test
    void evictionFreesCapacity() {
        registry.register(session("a"));
        registry.register(session("b"));
        registry.evict("a", SessionStatus.CANCELLED, null);

        registry.register(session("c"));

        assertThat(registry.activeSessionIds()).containsExactlyInAnyOrder("b", "c");
    }

    private static TranscriptionSession session(String id) {
        TranscriptionConfig config = TranscriptionConfig.builder().build();
        return new TranscriptionSession(id, config, Instant.EPOCH, List.of(),
                new SessionQualityMetrics(config.modelName()), SessionEventSink.NOOP);
    }
}
