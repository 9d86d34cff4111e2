package com.warden.eventmodel;

/**
 * A message accepted by a publisher, as seen by subscribers.
 *
 * @param topic   topic name
 * @param payload serialized message
 */
public record PublishedMessage(String topic, byte[] payload) {

    /** Decodes the payload as an envelope of the given payload type. */
    public <T> EventEnvelope<T> envelope(Class<T> payloadType) {
        return EventSerializer.decode(this, payloadType);
    }
}
