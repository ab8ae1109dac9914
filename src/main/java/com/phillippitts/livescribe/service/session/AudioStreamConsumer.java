package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.config.logging.SessionLogContext;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.exception.InvalidAudioException;
import com.phillippitts.livescribe.exception.SessionClosedException;
import com.phillippitts.livescribe.exception.SessionNotActiveException;
import com.phillippitts.livescribe.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Reads a session's input stream, windows it and feeds each window to the chunk pipeline.
 *
 * <p>While the session is paused the consumer stops reading. A window rejected because a pause
 * raced with it is retried after resume, so no window is lost. A window whose transcription
 * failed is dropped and consumption continues. Consumption ends at end of stream, on
 * {@link #stop()}, or once the session is closed.
 */
final class AudioStreamConsumer implements Runnable {

    private static final Logger LOG = LogManager.getLogger(AudioStreamConsumer.class);

    static final long PAUSE_POLL_MS = 1_000;

    /** Pipeline entry point for one window. */
    @FunctionalInterface
    interface WindowProcessor {
        void process(byte[] window);
    }

    private final String sessionId;
    private final InputStream stream;
    private final AudioChunker chunker;
    private final SessionStateMachine state;
    private final WindowProcessor processor;
    private final int readBufferBytes;
    private final int blockAlign;
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile boolean stopped;

    AudioStreamConsumer(String sessionId,
                        InputStream stream,
                        AudioChunker chunker,
                        SessionStateMachine state,
                        WindowProcessor processor,
                        int readBufferBytes,
                        int blockAlign) {
        this.sessionId = sessionId;
        this.stream = stream;
        this.chunker = chunker;
        this.state = state;
        this.processor = processor;
        this.readBufferBytes = readBufferBytes;
        this.blockAlign = blockAlign;
    }

    @Override
    public void run() {
        try (SessionLogContext ignored = SessionLogContext.open(sessionId); InputStream in = stream) {
            byte[] buffer = new byte[readBufferBytes];
            while (!stopped) {
                if (!waitWhilePaused()) {
                    return;
                }
                int n = in.read(buffer);
                if (n < 0) {
                    flushRemainder();
                    LOG.info("Input stream ended");
                    return;
                }
                for (byte[] window : chunker.append(buffer, 0, n)) {
                    if (!deliver(window)) {
                        return;
                    }
                }
            }
        } catch (IOException e) {
            if (stopped || state.isTerminal()) {
                LOG.debug("Input stream closed after session end: {}", e.toString());
            } else {
                LOG.error("Input stream failed; consumption stopped", e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Stream consumer interrupted");
        } finally {
            chunker.discard();
            done.countDown();
        }
    }

    /** Stops reading and closes the input stream. */
    void stop() {
        stopped = true;
        try {
            stream.close();
        } catch (IOException e) {
            LOG.debug("Error closing input stream of session {}: {}", sessionId, e.toString());
        }
    }

    /**
     * Waits for the consumer to finish: every window read so far delivered, the final partial
     * window flushed. A stream that is still open keeps the consumer running, so the wait ends at
     * the timeout.
     *
     * @return true if the consumer is done, false if the wait timed out
     */
    boolean awaitDrained(long timeoutMs) throws InterruptedException {
        return done.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private void flushRemainder() throws InterruptedException {
        Optional<byte[]> last = chunker.flush();
        if (last.isEmpty()) {
            return;
        }
        byte[] remainder = last.get();
        int aligned = remainder.length - (remainder.length % blockAlign);
        if (aligned == 0) {
            return;
        }
        if (!waitWhilePaused()) {
            return;
        }
        deliver(aligned == remainder.length ? remainder : Arrays.copyOf(remainder, aligned));
    }

    /**
     * Runs one window through the pipeline.
     *
     * @return false when the session is closed and consumption must end
     */
    private boolean deliver(byte[] window) throws InterruptedException {
        while (!stopped) {
            try {
                processor.process(window);
                return true;
            } catch (SessionNotActiveException e) {
                if (!waitWhilePaused()) {
                    return false;
                }
            } catch (SessionClosedException e) {
                return false;
            } catch (TranscriptionException | InvalidAudioException e) {
                LOG.warn("Dropping window of {} bytes: {}", window.length, e.getMessage());
                return true;
            }
        }
        return false;
    }

    /**
     * @return false when the session is closed or the consumer was stopped
     */
    private boolean waitWhilePaused() throws InterruptedException {
        SessionStatus status = state.current();
        while (status == SessionStatus.PAUSED && !stopped) {
            status = state.awaitNotPaused(PAUSE_POLL_MS);
        }
        return !stopped && !status.isTerminal();
    }
}
