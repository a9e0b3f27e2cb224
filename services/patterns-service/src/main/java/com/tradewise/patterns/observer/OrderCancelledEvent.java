package com.tradewise.patterns.observer;

import com.tradewise.common.event.AbstractDomainEvent;
import lombok.Getter;

@Getter
public class OrderCancelledEvent extends AbstractDomainEvent {

    public static final String EVENT_TYPE = "OrderCancelled";

    private final String orderId;
    private final String accountId;
    private final String reason;

    public OrderCancelledEvent(String orderId, String accountId, String reason) {
        this.orderId = orderId;
        this.accountId = accountId;
        this.reason = reason;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
