package com.tradewise.patterns.observer;

import com.tradewise.common.event.EventPublisher;
import com.tradewise.common.event.PublishedMessage;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.scenario.PatternScenario;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ObserverScenario implements PatternScenario {

    private final EventBus eventBus;
    private final EventPublisher eventPublisher;
    private final OrderNotificationHandler notificationHandler;

    @Override
    public String slug() {
        return "observer";
    }

    @Override
    public String patternName() {
        return "Observer / Pub-Sub";
    }

    @Override
    public PatternDemoResponse runDemo() {
        OrderPlacedEvent placed = new OrderPlacedEvent("ORD-OBS-001", "ACC-001", "AAPL", 100, new BigDecimal("150"));
        eventBus.publish(placed);

        OrderFilledEvent filled = new OrderFilledEvent("ORD-OBS-001", "ACC-001", 100, new BigDecimal("150.25"));
        eventBus.publish(filled);

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates observer pattern: domain events published and handled by multiple subscribers, then forwarded to the outbound event sink.")
            .result(List.of(
                new PublishedEvent(placed.getEventType(), placed.getEventId(), placed.getOrderId(), placed.getTopic()),
                new PublishedEvent(filled.getEventType(), filled.getEventId(), filled.getOrderId(), filled.getTopic())))
            .metadata(Map.of(
                "EventTypes", List.of(OrderPlacedEvent.EVENT_TYPE, OrderFilledEvent.EVENT_TYPE, OrderCancelledEvent.EVENT_TYPE),
                "EventSink", "Events are serialized and recorded by the event publisher"))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        long handledBefore = notificationHandler.handledCount();
        OrderPlacedEvent placed = new OrderPlacedEvent("ORD-TEST", "ACC-TEST", "TEST", 10, new BigDecimal("100"));
        eventBus.publish(placed);
        checks.add(new TestCheck("Event Publishing", notificationHandler.handledCount() > handledBefore,
            "Published event " + placed.getEventId()));

        checks.add(new TestCheck("Event Properties",
            placed.getEventId().startsWith("EVT-") && !placed.getEventType().isEmpty(),
            String.format("EventId=%s, EventType=%s", placed.getEventId(), placed.getEventType())));

        OrderCancelledEvent cancelled = new OrderCancelledEvent("ORD-TEST", "ACC-TEST", "User request");
        eventBus.publish(cancelled);
        boolean forwarded = eventPublisher.getPublishedMessages().stream()
            .map(PublishedMessage::key)
            .anyMatch(cancelled.getEventId()::equals);
        checks.add(new TestCheck("Multiple Event Types", forwarded,
            "Published " + cancelled.getEventType() + " event to " + cancelled.getTopic()));

        return PatternTestResponse.of(patternName(), checks);
    }

    public record PublishedEvent(String event, String eventId, String orderId, String topic) {
    }
}
