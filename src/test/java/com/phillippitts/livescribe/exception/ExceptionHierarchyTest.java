package com.phillippitts.livescribe.exception;

import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.TranscriptionErrorCode;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void liveScribeExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        LiveScribeException ex = new LiveScribeException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void transcriptionExceptionDefaultsToUnknown() {
        TranscriptionException ex = new TranscriptionException("transcription failed");

        assertThat(ex.getErrorCode()).isEqualTo(TranscriptionErrorCode.UNKNOWN_ERROR);
        assertThat(ex.getModelName()).isEqualTo("unknown");
        assertThat(ex.isRetryable()).isTrue();
    }

    @Test
    void transcriptionExceptionShouldIncludeModelAndCode() {
        TranscriptionException ex = new TranscriptionException("timeout occurred",
                TranscriptionErrorCode.MODEL_TIMEOUT, "openai/whisper-base");

        assertThat(ex.getMessage()).contains("timeout occurred", "openai/whisper-base", "MODEL_TIMEOUT");
        assertThat(ex).isInstanceOf(LiveScribeException.class);
    }

    @Test
    void builderFormatsDurationAndMetadata() {
        TranscriptionException ex = TranscriptionExceptionBuilder.create("Model call timed out")
                .model("m")
                .code(TranscriptionErrorCode.MODEL_TIMEOUT)
                .durationMs(250)
                .metadata("bytes", 4096)
                .build();

        assertThat(ex.getMessage()).startsWith("Model call timed out (durationMs=250, bytes=4096)");
        assertThat(ex.getErrorCode()).isEqualTo(TranscriptionErrorCode.MODEL_TIMEOUT);
    }

    @Test
    void builderProducesModelUnavailableSubtype() {
        TranscriptionException ex = TranscriptionExceptionBuilder.create("gone")
                .code(TranscriptionErrorCode.MODEL_UNAVAILABLE)
                .build();

        assertThat(ex).isInstanceOf(ModelUnavailableException.class);
        assertThat(ex.isRetryable()).isFalse();
    }

    @Test
    void sessionExceptionsCarrySessionContext() {
        SessionClosedException closed = new SessionClosedException("s-1", SessionStatus.CANCELLED);
        SessionNotActiveException paused = new SessionNotActiveException("s-2", SessionStatus.PAUSED);
        SessionNotFoundException missing = new SessionNotFoundException("s-3");

        assertThat(closed.getStatus()).isEqualTo(SessionStatus.CANCELLED);
        assertThat(paused.getMessage()).contains("s-2", "PAUSED");
        assertThat(missing.getSessionId()).isEqualTo("s-3");
    }

    @Test
    void invalidAudioExceptionShouldIncludeSize() {
        InvalidAudioException ex = new InvalidAudioException(3, "not frame aligned");

        assertThat(ex.getMessage()).contains("3 bytes", "not frame aligned");
        assertThat(ex.getReason()).isEqualTo("not frame aligned");
    }
}
