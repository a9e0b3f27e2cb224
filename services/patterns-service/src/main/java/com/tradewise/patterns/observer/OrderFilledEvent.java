package com.tradewise.patterns.observer;

import com.tradewise.common.event.AbstractDomainEvent;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class OrderFilledEvent extends AbstractDomainEvent {

    public static final String EVENT_TYPE = "OrderFilled";

    private final String orderId;
    private final String accountId;
    private final long filledQuantity;
    private final BigDecimal fillPrice;

    public OrderFilledEvent(String orderId, String accountId, long filledQuantity, BigDecimal fillPrice) {
        this.orderId = orderId;
        this.accountId = accountId;
        this.filledQuantity = filledQuantity;
        this.fillPrice = fillPrice;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
