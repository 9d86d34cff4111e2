package com.warden.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Wire codec between {@link EventEnvelope} and the {@link PublishedMessage} carried by the bus.
 * Envelopes are UTF-8 JSON with ISO 8601 instants. Unknown fields are ignored on decode.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private EventSerializer() {
        // utility class
    }

    /**
     * Encodes an envelope as a message on the envelope's own topic.
     *
     * @throws EventPublishException if the payload cannot be written as JSON
     */
    public static PublishedMessage encode(EventEnvelope<?> event) {
        try {
            return new PublishedMessage(event.topic(), MAPPER.writeValueAsBytes(event));
        } catch (JsonProcessingException e) {
            throw new EventPublishException("Cannot encode event " + event.eventId(), e);
        }
    }

    /**
     * Decodes a message into an envelope with a known payload type.
     *
     * @throws IllegalArgumentException if the message is not an envelope of that payload type
     */
    public static <T> EventEnvelope<T> decode(PublishedMessage message, Class<T> payloadType) {
        JavaType type = MAPPER.getTypeFactory()
                .constructParametricType(EventEnvelope.class, payloadType);
        try {
            return MAPPER.readValue(message.payload(), type);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Message on " + message.topic() + " is not a " + payloadType.getSimpleName()
                            + " envelope", e);
        }
    }
}
