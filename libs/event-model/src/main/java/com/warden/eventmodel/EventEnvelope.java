package com.warden.eventmodel;

import java.time.Instant;

/**
 * Envelope wrapping every message handed to an {@link EventPublisher}.
 *
 * <p>Carries identification, correlation and project scoping next to the topic-specific payload.
 * Subscribers receive at-least-once delivery and should deduplicate on {@code eventId}.
 *
 * @param <T> the type of the topic-specific payload
 */
public record EventEnvelope<T>(
        /** Unique identifier for this event instance (UUID v4). */
        String eventId,

        /** Topic the event is published on (e.g. "profile-initialised"). */
        String topic,

        /** Schema version of the payload, starts at 1. */
        int eventVersion,

        /** When the event was created. */
        Instant occurredAt,

        /** Name of the service that produced this event. */
        String producer,

        /** Project the event belongs to. */
        String projectId,

        /** Correlation ID of the call that caused this event. */
        String correlationId,

        /** Topic-specific event data. */
        T payload) {}
