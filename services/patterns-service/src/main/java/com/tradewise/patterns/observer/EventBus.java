package com.tradewise.patterns.observer;

import com.tradewise.common.event.DomainEvent;

/**
 * In-process publish/subscribe bus for domain events.
 */
public interface EventBus {

    <E extends DomainEvent> void subscribe(EventHandler<E> handler);

    /**
     * Delivers the event to every handler subscribed to its type, in subscription order,
     * then forwards it to the outbound event sink.
     */
    void publish(DomainEvent event);
}
