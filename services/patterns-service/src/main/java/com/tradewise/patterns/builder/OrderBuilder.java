package com.tradewise.patterns.builder;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.common.domain.OrderStatus;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Fluent, step-by-step construction of a new {@link Order}.
 * Required fields are checked only when {@link #build()} is called.
 * <p>
 * Holds mutable state, so each injection point receives its own instance.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class OrderBuilder {

    private String accountId;
    private String symbol;
    private OrderSide side;
    private Long quantity;
    private BigDecimal price;
    private BigDecimal limitPrice;

    public OrderBuilder withAccount(String accountId) {
        this.accountId = accountId;
        return this;
    }

    public OrderBuilder withSymbol(String symbol) {
        this.symbol = symbol;
        return this;
    }

    public OrderBuilder withSide(OrderSide side) {
        this.side = side;
        return this;
    }

    public OrderBuilder withQuantity(long quantity) {
        this.quantity = quantity;
        return this;
    }

    public OrderBuilder withPrice(BigDecimal price) {
        this.price = price;
        return this;
    }

    /**
     * A limit price, when present, becomes the order's price.
     */
    public OrderBuilder withLimitPrice(BigDecimal limitPrice) {
        this.limitPrice = limitPrice;
        return this;
    }

    /**
     * @throws IllegalStateException naming the first missing or invalid field
     */
    public Order build() {
        BigDecimal effectivePrice = limitPrice != null ? limitPrice : price;

        if (accountId == null || accountId.isBlank()) {
            throw new IllegalStateException("Account ID is required");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalStateException("Symbol is required");
        }
        if (side == null) {
            throw new IllegalStateException("Side is required");
        }
        if (quantity == null || quantity <= 0) {
            throw new IllegalStateException("Quantity must be greater than zero");
        }
        if (effectivePrice == null || effectivePrice.signum() <= 0) {
            throw new IllegalStateException("Price must be greater than zero");
        }

        return Order.builder()
            .orderId("ORD-" + UUID.randomUUID().toString().replace("-", ""))
            .accountId(accountId)
            .symbol(symbol)
            .side(side)
            .quantity(quantity)
            .price(effectivePrice)
            .status(OrderStatus.PENDING)
            .createdAt(Instant.now())
            .rowVersion(0)
            .build();
    }

    public OrderBuilder reset() {
        accountId = null;
        symbol = null;
        side = null;
        quantity = null;
        price = null;
        limitPrice = null;
        return this;
    }
}
