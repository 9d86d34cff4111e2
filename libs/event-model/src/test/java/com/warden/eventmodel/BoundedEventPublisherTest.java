package com.warden.eventmodel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BoundedEventPublisher")
class BoundedEventPublisherTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("delivers messages in publish order")
    void fifo() throws Exception {
        var publisher = new BoundedEventPublisher(4, Duration.ofMillis(10));

        publisher.publish("a", bytes("1"));
        publisher.publish("b", bytes("2"));

        assertThat(publisher.pending()).isEqualTo(2);
        assertThat(publisher.poll(Duration.ofMillis(10))).get()
                .extracting(PublishedMessage::topic).isEqualTo("a");
        assertThat(publisher.drain()).extracting(PublishedMessage::topic).containsExactly("b");
        assertThat(publisher.poll(Duration.ofMillis(1))).isEmpty();
    }

    @Test
    @DisplayName("fails when the channel stays full")
    void full() {
        var publisher = new BoundedEventPublisher(1, Duration.ZERO);
        publisher.publish("a", bytes("1"));

        assertThatThrownBy(() -> publisher.publish("a", bytes("2")))
                .isInstanceOf(EventPublishException.class)
                .hasMessageContaining("channel full");
    }

    @Test
    @DisplayName("publishes a validated envelope on its topic")
    void envelope() {
        var publisher = new BoundedEventPublisher(4, Duration.ofMillis(10));

        publisher.publish(EventFactory.profileInitialised("control-plane", "github", "p-1", "c-1"));

        var message = publisher.drain().get(0);
        assertThat(message.topic()).isEqualTo("profile-initialised");
        assertThat(message.envelope(ProfileInitPayload.class).payload())
                .isEqualTo(new ProfileInitPayload("github", "p-1"));
    }

    @Test
    @DisplayName("refuses an invalid envelope")
    void invalidEnvelope() {
        var publisher = new BoundedEventPublisher(4, Duration.ofMillis(10));
        var invalid = EventFactory.create(EventTopic.PROFILE_INITIALISED, "control-plane", null, "x");

        assertThatThrownBy(() -> publisher.publish(invalid))
                .isInstanceOf(EventPublishException.class)
                .hasMessageContaining("projectId");
        assertThat(publisher.pending()).isZero();
    }
}
