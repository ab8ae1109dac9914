package com.phillippitts.livescribe.service.distribution;

import com.phillippitts.livescribe.config.properties.DistributionProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process {@link DistributionHub}.
 *
 * <p>Every subscriber owns a bounded queue drained by at most one event worker at a time, which
 * keeps its messages in publish order. When a queue is full the oldest message is dropped, so a
 * stalled subscriber costs bounded memory and never pushes back on the pipeline.
 *
 * <p>A heartbeat prunes subscribers whose channel closed or that showed no activity for
 * {@code livescribe.distribution.stale-after-ms}, then pings the rest. A subscriber that answers
 * pings stays alive on a quiet session.
 */
@Component
public class DefaultDistributionHub implements DistributionHub {

    private static final Logger LOG = LogManager.getLogger(DefaultDistributionHub.class);

    private final DistributionProperties props;
    private final Executor eventExecutor;
    private final Clock clock;

    private final ConcurrentMap<String, Topic> topicsBySession = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> sessionByConnection = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    public DefaultDistributionHub(DistributionProperties props,
                                  @Qualifier("eventExecutor") Executor eventExecutor,
                                  Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String createConnection(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Topic topic = topicsBySession.computeIfAbsent(sessionId, id -> {
            Topic created = new Topic(UUID.randomUUID().toString());
            sessionByConnection.put(created.connectionId, id);
            return created;
        });
        LOG.debug("Connection {} open for session {}", topic.connectionId, sessionId);
        return topic.connectionId;
    }

    @Override
    public String subscribe(String sessionId, SubscriberChannel channel) {
        Objects.requireNonNull(channel, "channel must not be null");
        Topic topic = topicsBySession.get(sessionId);
        if (topic == null) {
            throw new IllegalStateException("No open channel for session " + sessionId);
        }
        Subscriber subscriber = new Subscriber(UUID.randomUUID().toString(), sessionId, channel, clock.instant());
        subscribers.put(subscriber.id, subscriber);
        topic.subscribers.add(subscriber);
        LOG.info("Subscriber {} attached to session {} ({} total)",
                subscriber.id, sessionId, topic.subscribers.size());
        return subscriber.id;
    }

    @Override
    public void unsubscribe(String subscriberId) {
        Subscriber subscriber = subscribers.get(subscriberId);
        if (subscriber != null) {
            remove(subscriber, "unsubscribed");
        }
    }

    @Override
    public void touch(String subscriberId) {
        Subscriber subscriber = subscribers.get(subscriberId);
        if (subscriber != null) {
            subscriber.lastActivity = clock.instant();
        }
    }

    @Override
    public void broadcast(String sessionId, TranscriptionMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        Topic topic = topicsBySession.get(sessionId);
        if (topic == null) {
            LOG.debug("Dropping {} for session {} without open channel", message.type(), sessionId);
            return;
        }
        for (Subscriber subscriber : topic.subscribers) {
            if (subscriber.enqueue(message, props.getSubscriberQueueCapacity())) {
                LOG.debug("Subscriber {} queue full; dropped oldest message", subscriber.id);
            }
            scheduleDrain(subscriber);
        }
    }

    @Override
    public void close(String connectionId) {
        String sessionId = sessionByConnection.remove(connectionId);
        if (sessionId == null) {
            return;
        }
        Topic topic = topicsBySession.remove(sessionId);
        if (topic == null) {
            return;
        }
        for (Subscriber subscriber : topic.subscribers) {
            subscriber.closeAfterDrain = true;
            scheduleDrain(subscriber);
        }
        LOG.info("Connection {} for session {} closed", connectionId, sessionId);
    }

    @Override
    public int subscriberCount(String sessionId) {
        Topic topic = topicsBySession.get(sessionId);
        return topic == null ? 0 : topic.subscribers.size();
    }

    @Scheduled(fixedRateString = "${livescribe.distribution.heartbeat-interval-ms:30000}")
    void heartbeat() {
        int pruned = pruneStale();
        if (pruned > 0) {
            LOG.info("Heartbeat pruned {} subscribers", pruned);
        }
        pingAll();
    }

    /**
     * Pings every remaining subscriber; one whose ping fails is removed.
     */
    void pingAll() {
        for (Subscriber subscriber : List.copyOf(subscribers.values())) {
            try {
                subscriber.channel.ping();
            } catch (IOException | RuntimeException e) {
                LOG.warn("Ping to subscriber {} of session {} failed: {}",
                        subscriber.id, subscriber.sessionId, e.toString());
                remove(subscriber, "ping failed");
            }
        }
    }

    /**
     * Removes closed or stale subscribers.
     *
     * @return number of subscribers removed
     */
    int pruneStale() {
        Instant cutoff = clock.instant().minusMillis(props.getStaleAfterMs());
        int pruned = 0;
        for (Subscriber subscriber : List.copyOf(subscribers.values())) {
            if (!subscriber.channel.isOpen()) {
                remove(subscriber, "channel closed");
                pruned++;
            } else if (subscriber.lastActivity.isBefore(cutoff)) {
                remove(subscriber, "stale since " + subscriber.lastActivity);
                pruned++;
            }
        }
        return pruned;
    }

    private void scheduleDrain(Subscriber subscriber) {
        if (!subscriber.draining.compareAndSet(false, true)) {
            return;
        }
        try {
            eventExecutor.execute(() -> drain(subscriber));
        } catch (RejectedExecutionException e) {
            subscriber.draining.set(false);
            LOG.warn("Event executor saturated; delivery to {} deferred to next publish", subscriber.id);
        }
    }

    private void drain(Subscriber subscriber) {
        try {
            TranscriptionMessage message;
            while ((message = subscriber.poll()) != null) {
                if (!deliver(subscriber, message)) {
                    return;
                }
            }
            if (subscriber.closeAfterDrain) {
                remove(subscriber, "session channel closed");
            }
        } finally {
            subscriber.draining.set(false);
        }
        if (subscriber.hasPending() && !subscriber.removed.get()) {
            scheduleDrain(subscriber);
        }
    }

    private boolean deliver(Subscriber subscriber, TranscriptionMessage message) {
        if (!subscriber.channel.isOpen()) {
            remove(subscriber, "channel closed");
            return false;
        }
        try {
            subscriber.channel.send(message);
            subscriber.lastActivity = clock.instant();
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Connection lost to subscriber {} of session {}: {}",
                    subscriber.id, subscriber.sessionId, e.toString());
            remove(subscriber, "send failed");
            return false;
        }
    }

    private void remove(Subscriber subscriber, String reason) {
        if (!subscriber.removed.compareAndSet(false, true)) {
            return;
        }
        subscribers.remove(subscriber.id);
        Topic topic = topicsBySession.get(subscriber.sessionId);
        if (topic != null) {
            topic.subscribers.remove(subscriber);
        }
        subscriber.clear();
        try {
            subscriber.channel.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing subscriber {}: {}", subscriber.id, e.toString());
        }
        LOG.info("Subscriber {} removed from session {}: {}", subscriber.id, subscriber.sessionId, reason);
    }

    private static final class Topic {
        private final String connectionId;
        private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();

        private Topic(String connectionId) {
            this.connectionId = connectionId;
        }
    }

    private static final class Subscriber {
        private final String id;
        private final String sessionId;
        private final SubscriberChannel channel;
        private final Deque<TranscriptionMessage> queue = new ArrayDeque<>();
        private final AtomicBoolean draining = new AtomicBoolean();
        private final AtomicBoolean removed = new AtomicBoolean();
        private volatile Instant lastActivity;
        private volatile boolean closeAfterDrain;

        private Subscriber(String id, String sessionId, SubscriberChannel channel, Instant now) {
            this.id = id;
            this.sessionId = sessionId;
            this.channel = channel;
            this.lastActivity = now;
        }

        /** Returns true when the oldest message had to be dropped. */
        private synchronized boolean enqueue(TranscriptionMessage message, int capacity) {
            boolean dropped = false;
            if (queue.size() >= capacity) {
                queue.pollFirst();
                dropped = true;
            }
            queue.addLast(message);
            return dropped;
        }

        private synchronized TranscriptionMessage poll() {
            return queue.pollFirst();
        }

        private synchronized boolean hasPending() {
            return !queue.isEmpty();
        }

        private synchronized void clear() {
            queue.clear();
        }
    }
}
