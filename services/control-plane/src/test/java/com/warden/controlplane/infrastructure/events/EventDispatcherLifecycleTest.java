package com.warden.controlplane.infrastructure.events;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.eventmodel.BoundedEventPublisher;
import com.warden.eventmodel.EventDispatcher;
import com.warden.eventmodel.EventFactory;
import com.warden.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Event dispatcher lifecycle")
class EventDispatcherLifecycleTest {

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final BoundedEventPublisher publisher =
            new BoundedEventPublisher(4, Duration.ofSeconds(2));
    private final EventDispatcherLifecycle lifecycle =
            new EventDispatcherLifecycle(
                    new EventDispatcher(
                            publisher,
                            new EventLogSubscriber(new MetricFactory(meters, "test")),
                            Duration.ofMillis(5)));

    private double dispatched(String topic) {
        return meters.get(EventLogSubscriber.DISPATCHED).tag("topic", topic).counter().count();
    }

    @Test
    @DisplayName("publishing well past capacity neither blocks nor drops")
    void publishesPastCapacity() {
        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();

        for (int i = 0; i < 100; i++) {
            publisher.publish(
                    EventFactory.profileInitialised(
                            "warden-test", "github", "project-" + i, "corr-" + i));
        }
        lifecycle.stop();

        assertThat(lifecycle.isRunning()).isFalse();
        assertThat(publisher.pending()).isZero();
        assertThat(dispatched("profile-initialised")).isEqualTo(100);
    }

    @Test
    @DisplayName("counts events on unknown topics without decoding them")
    void unknownTopic() {
        lifecycle.start();
        publisher.publish("audit", "{}".getBytes(StandardCharsets.UTF_8));
        lifecycle.stop();

        assertThat(dispatched("audit")).isEqualTo(1);
    }
}
