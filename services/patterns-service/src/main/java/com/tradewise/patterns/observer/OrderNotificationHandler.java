package com.tradewise.patterns.observer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Notifies the account holder that an order was accepted.
 */
@Slf4j
@Component
public class OrderNotificationHandler implements EventHandler<OrderPlacedEvent> {

    private final AtomicLong handled = new AtomicLong();

    @Override
    public Class<OrderPlacedEvent> eventType() {
        return OrderPlacedEvent.class;
    }

    @Override
    public void handle(OrderPlacedEvent event) {
        handled.incrementAndGet();
        log.info("Order placed notification: orderId={}, symbol={}, quantity={}",
            event.getOrderId(), event.getSymbol(), event.getQuantity());
    }

    public long handledCount() {
        return handled.get();
    }
}
