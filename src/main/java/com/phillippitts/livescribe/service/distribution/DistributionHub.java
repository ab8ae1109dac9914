package com.phillippitts.livescribe.service.distribution;

/**
 * Per-session publish/subscribe fan-out.
 *
 * <p><b>Delivery:</b> best effort, in publish order per subscriber. {@link #broadcast} never
 * blocks on subscriber I/O; a slow or broken subscriber affects only itself.
 */
public interface DistributionHub {

    /**
     * Opens the channel of a session. Subscribers can attach once it exists.
     *
     * @return connection id used to {@link #close} the channel
     */
    String createConnection(String sessionId);

    /**
     * Attaches a subscriber to an open session channel.
     *
     * @return subscriber id
     * @throws IllegalStateException when the session has no open channel
     */
    String subscribe(String sessionId, SubscriberChannel channel);

    void unsubscribe(String subscriberId);

    /** Marks a subscriber as alive without sending anything to it. */
    void touch(String subscriberId);

    /** Queues a message for every subscriber of the session; no-op for unknown sessions. */
    void broadcast(String sessionId, TranscriptionMessage message);

    /**
     * Closes a session channel after flushing queued messages, then closes its subscribers.
     * Repeated calls are ignored.
     */
    void close(String connectionId);

    int subscriberCount(String sessionId);
}
