package com.tradewise.patterns.observer;

import com.tradewise.common.event.DomainEvent;
import com.tradewise.common.event.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous event bus. A failing handler is logged and does not stop the others;
 * a failing sink is logged as a warning and does not fail the publish.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryEventBus implements EventBus {

    private final EventPublisher eventPublisher;

    private final Map<Class<?>, List<EventHandler<?>>> handlers = new ConcurrentHashMap<>();

    @Override
    public <E extends DomainEvent> void subscribe(EventHandler<E> handler) {
        handlers.computeIfAbsent(handler.eventType(), type -> new CopyOnWriteArrayList<>()).add(handler);
        log.info("Subscribed handler {} to event {}",
            handler.getClass().getSimpleName(), handler.eventType().getSimpleName());
    }

    @Override
    public void publish(DomainEvent event) {
        log.info("Publishing event {} {}", event.getEventType(), event.getEventId());

        for (EventHandler<?> handler : handlers.getOrDefault(event.getClass(), List.of())) {
            try {
                dispatch(handler, event);
            } catch (RuntimeException e) {
                log.error("Error handling event {} with handler {}",
                    event.getEventId(), handler.getClass().getSimpleName(), e);
            }
        }

        try {
            eventPublisher.publishDomainEvent(event.getTopic(), event);
        } catch (RuntimeException e) {
            log.warn("Failed to forward event {} to topic {}", event.getEventId(), event.getTopic(), e);
        }
    }

    int subscriberCount(Class<? extends DomainEvent> eventType) {
        return handlers.getOrDefault(eventType, List.of()).size();
    }

    @SuppressWarnings("unchecked")
    private static <E extends DomainEvent> void dispatch(EventHandler<E> handler, DomainEvent event) {
        handler.handle((E) event);
    }
}
