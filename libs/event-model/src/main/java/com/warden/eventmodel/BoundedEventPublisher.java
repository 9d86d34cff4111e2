package com.warden.eventmodel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process publisher backed by a bounded channel.
 * <p>
 * {@link #publish(String, byte[])} waits up to the offer timeout for room in
 * the channel and fails with {@link EventPublishException} when the channel
 * stays full. Subscribers pull messages with {@link #poll(Duration)} or
 * {@link #drain()}.
 */
public final class BoundedEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(BoundedEventPublisher.class);

    private final BlockingQueue<PublishedMessage> channel;
    private final Duration offerTimeout;

    /**
     * @param capacity     maximum number of undelivered messages
     * @param offerTimeout how long a publish may wait for room
     */
    public BoundedEventPublisher(int capacity, Duration offerTimeout) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (offerTimeout == null || offerTimeout.isNegative()) {
            throw new IllegalArgumentException("offerTimeout must not be null or negative");
        }
        this.channel = new ArrayBlockingQueue<>(capacity);
        this.offerTimeout = offerTimeout;
    }

    @Override
    public void publish(String topic, byte[] payload) {
        if (topic == null || topic.isBlank()) {
            throw new EventPublishException("topic must not be null or blank");
        }
        var message = new PublishedMessage(topic, payload);
        boolean accepted;
        try {
            accepted = channel.offer(message, offerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing to " + topic, e);
        }
        if (!accepted) {
            throw new EventPublishException("Event channel full, dropped message for " + topic);
        }
        log.debug("Published message on {}", topic);
    }

    /**
     * Waits up to {@code timeout} for the next message.
     */
    public Optional<PublishedMessage> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(channel.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /** Removes and returns every pending message. */
    public List<PublishedMessage> drain() {
        List<PublishedMessage> messages = new ArrayList<>();
        channel.drainTo(messages);
        return messages;
    }

    /** Number of messages waiting for a subscriber. */
    public int pending() {
        return channel.size();
    }
}
