package com.warden.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for creating {@link EventEnvelope} instances.
 */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /**
     * Creates a version 1 envelope with a generated eventId and correlationId.
     */
    public static <T> EventEnvelope<T> create(
            EventTopic topic,
            String producer,
            String projectId,
            T payload
    ) {
        return create(topic, producer, projectId, UUID.randomUUID().toString(), payload);
    }

    /**
     * Creates a version 1 envelope that keeps the caller's correlation id.
     */
    public static <T> EventEnvelope<T> create(
            EventTopic topic,
            String producer,
            String projectId,
            String correlationId,
            T payload
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                topic.value(),
                1,
                Instant.now(),
                producer,
                projectId,
                correlationId == null ? UUID.randomUUID().toString() : correlationId,
                payload
        );
    }

    /**
     * Creates the envelope announcing that the provider's profiles in a project changed.
     */
    public static EventEnvelope<ProfileInitPayload> profileInitialised(
            String producer,
            String provider,
            String projectId,
            String correlationId
    ) {
        return create(EventTopic.PROFILE_INITIALISED, producer, projectId, correlationId,
                new ProfileInitPayload(provider, projectId));
    }
}
