package com.tradewise.common.event;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * Base implementation of a domain event.
 * Ids are {@code EVT-} followed by a dashless UUID; the topic is derived from the event type.
 */
public abstract class AbstractDomainEvent implements DomainEvent {

    public static final String TOPIC_PREFIX = "domain-events.";

    private final String eventId;
    private final LocalDateTime timestamp;

    protected AbstractDomainEvent() {
        this.eventId = "EVT-" + UUID.randomUUID().toString().replace("-", "");
        this.timestamp = LocalDateTime.now();
    }

    @Override
    public String getEventId() {
        return eventId;
    }

    @Override
    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String getEventType() {
        return this.getClass().getSimpleName();
    }

    @Override
    public String getTopic() {
        return TOPIC_PREFIX + getEventType().toLowerCase(Locale.ROOT);
    }
}
