package com.tradewise.patterns.observer;

import com.tradewise.common.metrics.MetricsSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accumulates filled volume for trading analytics.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FillAnalyticsHandler implements EventHandler<OrderFilledEvent> {

    private final MetricsSink metrics;

    private final AtomicLong filledVolume = new AtomicLong();

    @Override
    public Class<OrderFilledEvent> eventType() {
        return OrderFilledEvent.class;
    }

    @Override
    public void handle(OrderFilledEvent event) {
        long volume = filledVolume.addAndGet(event.getFilledQuantity());
        metrics.incrementCounter("orders.filled", Map.of());
        metrics.setGauge("orders.filled.volume", volume, Map.of());
        log.info("Order filled: orderId={}, filledQuantity={}, fillPrice={}",
            event.getOrderId(), event.getFilledQuantity(), event.getFillPrice());
    }

    public long filledVolume() {
        return filledVolume.get();
    }
}
