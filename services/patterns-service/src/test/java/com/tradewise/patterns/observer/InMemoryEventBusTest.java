package com.tradewise.patterns.observer;

import com.tradewise.common.event.EventPublisher;
import com.tradewise.common.metrics.MetricsSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for InMemoryEventBus
 *
 * Handlers run synchronously in subscription order; failures stay local to the failing handler.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("In-Memory Event Bus Unit Tests")
class InMemoryEventBusTest {

    @Mock
    private EventPublisher eventPublisher;

    @Mock
    private MetricsSink metricsSink;

    private InMemoryEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new InMemoryEventBus(eventPublisher);
    }

    @Test
    @DisplayName("Delivers to subscribers of the event type and forwards to the publisher")
    void deliversAndForwards() {
        OrderNotificationHandler notifications = new OrderNotificationHandler();
        CancellationAuditHandler audit = new CancellationAuditHandler();
        eventBus.subscribe(notifications);
        eventBus.subscribe(audit);

        OrderPlacedEvent event = new OrderPlacedEvent("ORD-1", "ACC-001", "AAPL", 100, new BigDecimal("150"));
        eventBus.publish(event);

        assertThat(notifications.handledCount()).isEqualTo(1);
        assertThat(audit.auditTrail()).isEmpty();
        verify(eventPublisher).publishDomainEvent("domain-events.orderplaced", event);
    }

    @Test
    @DisplayName("Publishing with no subscribers still forwards")
    void noSubscribers() {
        OrderCancelledEvent event = new OrderCancelledEvent("ORD-1", "ACC-001", "User request");

        eventBus.publish(event);

        verify(eventPublisher).publishDomainEvent(eq("domain-events.ordercancelled"), same(event));
    }

    @Test
    @DisplayName("A failing handler does not stop later handlers")
    void isolatesHandlerFailures() {
        List<String> calls = new ArrayList<>();
        eventBus.subscribe(new RecordingHandler(calls, "first", true));
        eventBus.subscribe(new RecordingHandler(calls, "second", false));

        assertThatCode(() -> eventBus.publish(new OrderFilledEvent("ORD-1", "ACC-001", 100, new BigDecimal("150"))))
            .doesNotThrowAnyException();

        assertThat(calls).containsExactly("first", "second");
        verify(eventPublisher).publishDomainEvent(anyString(), any());
    }

    @Test
    @DisplayName("A failing sink does not fail the publish")
    void toleratesSinkFailure() {
        OrderNotificationHandler notifications = new OrderNotificationHandler();
        eventBus.subscribe(notifications);
        doThrow(new IllegalStateException("sink down")).when(eventPublisher).publishDomainEvent(anyString(), any());

        assertThatCode(() -> eventBus.publish(new OrderPlacedEvent("ORD-1", "ACC-001", "AAPL", 1, BigDecimal.ONE)))
            .doesNotThrowAnyException();
        assertThat(notifications.handledCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Fill analytics records count and volume")
    void fillAnalytics() {
        FillAnalyticsHandler analytics = new FillAnalyticsHandler(metricsSink);
        eventBus.subscribe(analytics);

        eventBus.publish(new OrderFilledEvent("ORD-1", "ACC-001", 100, new BigDecimal("150")));
        eventBus.publish(new OrderFilledEvent("ORD-2", "ACC-001", 50, new BigDecimal("300")));

        assertThat(analytics.filledVolume()).isEqualTo(150);
        verify(metricsSink, times(2)).incrementCounter(eq("orders.filled"), anyMap());
        assertThat(eventBus.subscriberCount(OrderFilledEvent.class)).isEqualTo(1);
    }

    private static final class RecordingHandler implements EventHandler<OrderFilledEvent> {

        private final List<String> calls;
        private final String name;
        private final boolean fail;

        private RecordingHandler(List<String> calls, String name, boolean fail) {
            this.calls = calls;
            this.name = name;
            this.fail = fail;
        }

        @Override
        public Class<OrderFilledEvent> eventType() {
            return OrderFilledEvent.class;
        }

        @Override
        public void handle(OrderFilledEvent event) {
            calls.add(name);
            if (fail) {
                throw new IllegalStateException(name + " failed");
            }
        }
    }
}
