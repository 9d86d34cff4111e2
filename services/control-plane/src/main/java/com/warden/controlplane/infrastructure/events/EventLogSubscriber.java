package com.warden.controlplane.infrastructure.events;

import com.warden.eventmodel.EventEnvelope;
import com.warden.eventmodel.EventSubscriber;
import com.warden.eventmodel.EventTopic;
import com.warden.eventmodel.ProfileInitPayload;
import com.warden.eventmodel.PublishedMessage;
import com.warden.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal subscriber of the in-process event channel: records each event in the log and counts
 * it by topic as {@code warden.events.dispatched}. Evaluation engines are not hosted here.
 */
public class EventLogSubscriber implements EventSubscriber {

    private static final Logger log = LoggerFactory.getLogger(EventLogSubscriber.class);

    static final String DISPATCHED = "warden.events.dispatched";

    private final MetricFactory metrics;

    public EventLogSubscriber(MetricFactory metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onMessage(PublishedMessage message) {
        metrics.counter(
                        DISPATCHED,
                        "Events taken off the in-process channel",
                        "topic",
                        message.topic())
                .increment();
        if (EventTopic.fromString(message.topic()).orElse(null) != EventTopic.PROFILE_INITIALISED) {
            log.warn("Dropping event on unknown topic {}", message.topic());
            return;
        }
        EventEnvelope<ProfileInitPayload> event = message.envelope(ProfileInitPayload.class);
        log.info(
                "Profiles initialised in project {} for provider {} (event {}, correlation {})",
                event.payload().projectId(),
                event.payload().provider(),
                event.eventId(),
                event.correlationId());
    }
}
