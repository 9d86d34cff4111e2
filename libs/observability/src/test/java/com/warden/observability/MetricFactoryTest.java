package com.warden.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "control-plane");
    }

    @Test
    @DisplayName("should tag counters with the service name")
    void shouldTagCounters() {
        Counter counter = factory.counter("warden.events.dropped", "dropped events", "topic", "profile-initialised");
        counter.increment();

        Counter found = registry.find("warden.events.dropped")
                .tag(MetricFactory.TAG_SERVICE, "control-plane")
                .tag("topic", "profile-initialised")
                .counter();
        assertThat(found).isNotNull();
        assertThat(found.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return the same timer for the same name and tags")
    void shouldReuseTimers() {
        Timer first = factory.timer("warden.grpc.server.calls", "calls", "code", "OK");
        Timer second = factory.timer("warden.grpc.server.calls", "calls", "code", "OK");
        first.record(Duration.ofMillis(5));

        assertThat(second).isSameAs(first);
        assertThat(second.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject odd tag lists")
    void shouldRejectOddTags() {
        assertThatThrownBy(() -> factory.counter("x", "x", "lonely"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject blank service name")
    void shouldRejectBlankServiceName() {
        assertThatThrownBy(() -> new MetricFactory(registry, " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("serviceName");
    }
}
