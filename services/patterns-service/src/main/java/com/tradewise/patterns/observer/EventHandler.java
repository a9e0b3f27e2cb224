package com.tradewise.patterns.observer;

import com.tradewise.common.event.DomainEvent;

/**
 * Subscriber for one event type.
 */
public interface EventHandler<E extends DomainEvent> {

    Class<E> eventType();

    void handle(E event);
}
