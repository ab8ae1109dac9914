package com.phillippitts.livescribe.service.distribution;

import java.io.IOException;

/**
 * Transport-neutral outbound channel to one subscriber.
 *
 * <p>Implementations may block in {@link #send}; the hub only calls it from its event workers.
 */
public interface SubscriberChannel {

    /**
     * Delivers one message.
     *
     * @throws IOException when the underlying connection is broken; the hub then drops the subscriber
     */
    void send(TranscriptionMessage message) throws IOException;

    /**
     * Sends a transport-level keep-alive. The transport reports the answer through
     * {@link DistributionHub#touch(String)}.
     *
     * @throws IOException when the underlying connection is broken; the hub then drops the subscriber
     */
    void ping() throws IOException;

    boolean isOpen();

    /** Closes the connection; must tolerate repeated calls. */
    void close();
}
