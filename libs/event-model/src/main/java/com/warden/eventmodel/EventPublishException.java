package com.warden.eventmodel;

/**
 * Thrown when a message cannot be handed to the event bus.
 */
public class EventPublishException extends RuntimeException {

    public EventPublishException(String message) {
        super(message);
    }

    public EventPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
