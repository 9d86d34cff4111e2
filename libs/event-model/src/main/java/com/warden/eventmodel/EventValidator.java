package com.warden.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks an {@link EventEnvelope} for the fields every subscriber relies on.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Lists every problem with the envelope, in field order.
     *
     * @return human-readable problems, empty when the envelope can be published
     */
    public static List<String> problems(EventEnvelope<?> event) {
        List<String> problems = new ArrayList<>();

        if (isBlank(event.eventId())) {
            problems.add("eventId must not be null or blank");
        }
        if (isBlank(event.topic())) {
            problems.add("topic must not be null or blank");
        } else if (EventTopic.fromString(event.topic()).isEmpty()) {
            problems.add("topic is not a known topic: " + event.topic());
        }
        if (event.eventVersion() < 1) {
            problems.add("eventVersion must be >= 1");
        }
        if (event.occurredAt() == null) {
            problems.add("occurredAt must not be null");
        }
        if (isBlank(event.producer())) {
            problems.add("producer must not be null or blank");
        }
        if (isBlank(event.projectId())) {
            problems.add("projectId must not be null or blank");
        }
        if (event.payload() == null) {
            problems.add("payload must not be null");
        }
        return problems;
    }

    /**
     * @throws EventPublishException naming every problem when the envelope is not publishable
     */
    public static void requireValid(EventEnvelope<?> event) {
        List<String> problems = problems(event);
        if (!problems.isEmpty()) {
            throw new EventPublishException("Refusing to publish invalid event: " + problems);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
