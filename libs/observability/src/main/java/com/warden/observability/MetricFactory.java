package com.warden.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Meters are cached by the registry, so asking for the same name and tags
 * twice returns the same meter.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns a counter tagged with the service and the given key-value pairs.
     *
     * @param name        metric name (e.g., "warden.events.dropped")
     * @param description human-readable description
     * @param tags        additional tags as alternating keys and values
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    /**
     * Returns a timer tagged with the service and the given key-value pairs.
     *
     * @param name        metric name (e.g., "warden.grpc.server.calls")
     * @param description human-readable description
     * @param tags        additional tags as alternating keys and values
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tags(String... extraTags) {
        if (extraTags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key-value pairs");
        }
        return Tags.of(TAG_SERVICE, serviceName).and(extraTags);
    }
}
