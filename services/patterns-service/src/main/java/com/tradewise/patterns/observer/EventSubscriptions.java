package com.tradewise.patterns.observer;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Subscribes every {@link EventHandler} bean to the bus at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventSubscriptions {

    private final EventBus eventBus;
    private final List<EventHandler<?>> eventHandlers;

    @PostConstruct
    public void subscribeHandlers() {
        for (EventHandler<?> handler : eventHandlers) {
            eventBus.subscribe(handler);
        }
        log.info("Subscribed {} event handlers", eventHandlers.size());
    }
}
