package com.warden.eventmodel;

import java.util.Optional;

/**
 * Topics the control plane publishes on.
 *
 * <p>The {@code value} field holds the wire name used by the event bus.
 */
public enum EventTopic {

    /** A profile was created or updated and its entities need (re)evaluation. */
    PROFILE_INITIALISED("profile-initialised");

    private final String value;

    EventTopic(String value) {
        this.value = value;
    }

    /** The wire name of the topic (e.g. "profile-initialised"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a topic by its wire name.
     *
     * @param value the string to match
     * @return the matching topic, or empty if not found
     */
    public static Optional<EventTopic> fromString(String value) {
        for (EventTopic topic : values()) {
            if (topic.value.equals(value)) {
                return Optional.of(topic);
            }
        }
        return Optional.empty();
    }
}
