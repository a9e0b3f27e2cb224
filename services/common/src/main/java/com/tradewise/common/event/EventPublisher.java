package com.tradewise.common.event;

import java.util.List;

/**
 * Outbound event sink. Implementations decide where serialized events go.
 */
public interface EventPublisher {

    /**
     * Publishes a domain event, keyed by its event id
     */
    void publishDomainEvent(String topic, DomainEvent event);

    /**
     * Messages accepted so far, oldest first
     */
    List<PublishedMessage> getPublishedMessages();
}
