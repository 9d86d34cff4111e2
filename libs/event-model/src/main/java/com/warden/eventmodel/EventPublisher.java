package com.warden.eventmodel;

/**
 * Outbound side of the event bus.
 *
 * <p>Publishing is fire-and-forget from the caller's point of view: callers treat a failure as
 * non-fatal and log it. Delivery is at-least-once, so subscribers must be idempotent.
 */
public interface EventPublisher {

    /**
     * Hands a serialized message to the bus. May block briefly when the bus is saturated.
     *
     * @param topic   topic name
     * @param payload serialized message
     * @throws EventPublishException if the message could not be accepted
     */
    void publish(String topic, byte[] payload);

    /**
     * Validates, serializes and publishes an envelope on its own topic.
     *
     * @throws EventPublishException if the envelope is invalid or could not be accepted
     */
    default void publish(EventEnvelope<?> event) {
        EventValidator.requireValid(event);
        PublishedMessage message = EventSerializer.encode(event);
        publish(message.topic(), message.payload());
    }
}
