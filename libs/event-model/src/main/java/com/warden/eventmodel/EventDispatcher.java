package com.warden.eventmodel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drains a {@link BoundedEventPublisher} on a single background thread and hands
 * every message to one subscriber, in publish order.
 * <p>
 * A subscriber failure is logged and counted; the message is not redelivered.
 * {@link #close()} stops the thread and delivers whatever is still queued.
 */
public final class EventDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final BoundedEventPublisher publisher;
    private final EventSubscriber subscriber;
    private final Duration pollInterval;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private ExecutorService executor;
    private volatile boolean running;

    public EventDispatcher(BoundedEventPublisher publisher, EventSubscriber subscriber, Duration pollInterval) {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.publisher = publisher;
        this.subscriber = subscriber;
        this.pollInterval = pollInterval;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "warden-event-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
        executor.submit(this::loop);
        log.info("Event dispatcher started");
    }

    private void loop() {
        while (running) {
            Optional<PublishedMessage> next;
            try {
                next = publisher.poll(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            next.ifPresent(this::deliver);
        }
    }

    private void deliver(PublishedMessage message) {
        try {
            subscriber.onMessage(message);
            delivered.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.error("Subscriber failed on message for {}", message.topic(), e);
        }
    }

    public boolean isRunning() {
        return running;
    }

    /** Messages the subscriber accepted. */
    public long delivered() {
        return delivered.get();
    }

    /** Messages the subscriber threw on. */
    public long failed() {
        return failed.get();
    }

    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Event dispatcher did not stop within {}, interrupting", SHUTDOWN_GRACE);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        publisher.drain().forEach(this::deliver);
        log.info("Event dispatcher stopped after {} messages ({} failed)", delivered.get(), failed.get());
    }
}
