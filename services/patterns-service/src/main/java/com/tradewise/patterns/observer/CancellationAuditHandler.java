package com.tradewise.patterns.observer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps an audit record of every cancellation.
 */
@Slf4j
@Component
public class CancellationAuditHandler implements EventHandler<OrderCancelledEvent> {

    private final List<String> auditTrail = new CopyOnWriteArrayList<>();

    @Override
    public Class<OrderCancelledEvent> eventType() {
        return OrderCancelledEvent.class;
    }

    @Override
    public void handle(OrderCancelledEvent event) {
        auditTrail.add(event.getOrderId() + ": " + event.getReason());
        log.info("Order cancelled: orderId={}, reason={}", event.getOrderId(), event.getReason());
    }

    public List<String> auditTrail() {
        return List.copyOf(auditTrail);
    }
}
