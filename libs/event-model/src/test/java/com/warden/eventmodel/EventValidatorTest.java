package com.warden.eventmodel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventValidator")
class EventValidatorTest {

    @Test
    @DisplayName("accepts a factory-built envelope")
    void acceptsFactoryEnvelope() {
        var event = EventFactory.profileInitialised("control-plane", "github", "p-1", null);

        assertThat(EventValidator.problems(event)).isEmpty();
        assertThat(event.correlationId()).isNotBlank();
    }

    @Test
    @DisplayName("reports every missing field at once")
    void reportsAllProblems() {
        var event = new EventEnvelope<>(null, "no-such-topic", 0, null, " ", null, null, null);

        assertThat(EventValidator.problems(event)).containsExactly(
                "eventId must not be null or blank",
                "topic is not a known topic: no-such-topic",
                "eventVersion must be >= 1",
                "occurredAt must not be null",
                "producer must not be null or blank",
                "projectId must not be null or blank",
                "payload must not be null");
    }

    @Test
    @DisplayName("requireValid() throws with the problems in the message")
    void requireValid() {
        var event = new EventEnvelope<>("id", "profile-initialised", 1, Instant.now(), "p", null, "c", "x");

        assertThatThrownBy(() -> EventValidator.requireValid(event))
                .isInstanceOf(EventPublishException.class)
                .hasMessage("Refusing to publish invalid event: [projectId must not be null or blank]");
    }

    @Test
    @DisplayName("topic lookup uses wire names")
    void topicLookup() {
        var event = new EventEnvelope<>("id", "profile-initialised", 1, Instant.now(), "p", "x", "c", "payload");

        assertThat(EventTopic.fromString("profile-initialised")).contains(EventTopic.PROFILE_INITIALISED);
        assertThat(EventTopic.fromString("PROFILE_INITIALISED")).isEmpty();
        assertThatCode(() -> EventValidator.requireValid(event)).doesNotThrowAnyException();
    }
}
