package com.warden.eventmodel;

/**
 * Receives messages taken off a {@link BoundedEventPublisher} by an {@link EventDispatcher}.
 */
@FunctionalInterface
public interface EventSubscriber {

    void onMessage(PublishedMessage message);
}
