package com.tradewise.patterns.observer;

import com.tradewise.common.event.AbstractDomainEvent;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class OrderPlacedEvent extends AbstractDomainEvent {

    public static final String EVENT_TYPE = "OrderPlaced";

    private final String orderId;
    private final String accountId;
    private final String symbol;
    private final long quantity;
    private final BigDecimal price;

    public OrderPlacedEvent(String orderId, String accountId, String symbol, long quantity, BigDecimal price) {
        this.orderId = orderId;
        this.accountId = accountId;
        this.symbol = symbol;
        this.quantity = quantity;
        this.price = price;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
