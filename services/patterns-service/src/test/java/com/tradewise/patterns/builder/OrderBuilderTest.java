package com.tradewise.patterns.builder;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.common.domain.OrderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Order Builder Unit Tests")
class OrderBuilderTest {

    private OrderBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new OrderBuilder();
    }

    @Test
    @DisplayName("Builds a pending order with a generated id")
    void buildsPendingOrder() {
        Order order = complete().build();

        assertThat(order.getOrderId()).startsWith("ORD-");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getRowVersion()).isZero();
        assertThat(order.getPrice()).isEqualByComparingTo("150");
    }

    @Test
    @DisplayName("Limit price overrides the plain price")
    void limitPriceWins() {
        Order order = complete().withLimitPrice(new BigDecimal("155")).build();

        assertThat(order.getPrice()).isEqualByComparingTo("155");
    }

    @Test
    @DisplayName("Reports the first missing field")
    void reportsFirstMissingField() {
        assertThatThrownBy(() -> builder.withSymbol("AAPL").build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Account ID is required");
        assertThatThrownBy(() -> builder.reset().withAccount("ACC-001").build())
            .hasMessage("Symbol is required");
        assertThatThrownBy(() -> builder.reset().withAccount("ACC-001").withSymbol("AAPL").build())
            .hasMessage("Side is required");
    }

    @Test
    @DisplayName("Rejects non-positive quantity and price")
    void rejectsNonPositiveValues() {
        assertThatThrownBy(() -> complete().withQuantity(0).build())
            .hasMessage("Quantity must be greater than zero");
        assertThatThrownBy(() -> complete().withPrice(BigDecimal.ZERO).build())
            .hasMessage("Price must be greater than zero");
    }

    @Test
    @DisplayName("Reset clears earlier values")
    void resetClears() {
        complete().build();

        assertThatThrownBy(() -> builder.reset().build()).hasMessage("Account ID is required");
    }

    private OrderBuilder complete() {
        return builder.reset()
            .withAccount("ACC-001")
            .withSymbol("AAPL")
            .withSide(OrderSide.BUY)
            .withQuantity(100)
            .withPrice(new BigDecimal("150"));
    }
}
