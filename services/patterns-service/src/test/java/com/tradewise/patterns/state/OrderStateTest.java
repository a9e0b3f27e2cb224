package com.tradewise.patterns.state;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.common.domain.OrderStatus;
import com.tradewise.patterns.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the order lifecycle states
 */
@DisplayName("Order State Unit Tests")
class OrderStateTest {

    @Nested
    @DisplayName("Happy path")
    class HappyPath {

        @Test
        @DisplayName("Pending, place, full fill ends Filled")
        void placeThenFill() {
            Order order = pending(100);

            Order placed = OrderStateFactory.forStatus(order.getStatus()).place(order);
            Order filled = OrderStateFactory.forStatus(placed.getStatus()).fill(placed, 100);

            assertThat(placed.getStatus()).isEqualTo(OrderStatus.PLACED);
            assertThat(filled.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(filled.getRowVersion()).isEqualTo(2);
            assertThat(filled.getUpdatedAt()).isNotNull();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        }

        @Test
        @DisplayName("Partial fill leaves the order partially filled")
        void partialFill() {
            Order placed = new PendingOrderState().place(pending(100));

            Order partial = new PlacedOrderState().fill(placed, 40);

            assertThat(partial.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        }

        @Test
        @DisplayName("Pending orders can be cancelled or rejected")
        void pendingExits() {
            PendingOrderState state = new PendingOrderState();

            assertThat(state.cancel(pending(10), "User request").getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(state.reject(pending(10), "Risk").getStatus()).isEqualTo(OrderStatus.REJECTED);
        }

        @Test
        @DisplayName("Placed orders can be cancelled")
        void placedCancel() {
            Order placed = new PendingOrderState().place(pending(10));

            assertThat(new PlacedOrderState().cancel(placed, "User request").getStatus())
                .isEqualTo(OrderStatus.CANCELLED);
        }
    }

    @Nested
    @DisplayName("Rejected transitions")
    class RejectedTransitions {

        @Test
        @DisplayName("Filled orders reject every operation")
        void filledIsTerminal() {
            Order filled = pending(10).withStatus(OrderStatus.FILLED);
            OrderState state = OrderStateFactory.forStatus(OrderStatus.FILLED);

            List<Function<Order, Order>> operations = List.of(
                state::place,
                o -> state.fill(o, 1),
                o -> state.cancel(o, "Test"),
                o -> state.reject(o, "Test"));

            for (Function<Order, Order> operation : operations) {
                assertThatThrownBy(() -> operation.apply(filled))
                    .isInstanceOf(InvalidStateTransitionException.class);
            }
        }

        @Test
        @DisplayName("Cancelling a filled order explains the terminal state")
        void cancelFilledMessage() {
            assertThatThrownBy(() -> new FilledOrderState().cancel(pending(10), "Test"))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessage("Cannot cancel order in Filled state (terminal).")
                .satisfies(e -> {
                    InvalidStateTransitionException ex = (InvalidStateTransitionException) e;
                    assertThat(ex.getCurrentStatus()).isEqualTo(OrderStatus.FILLED);
                    assertThat(ex.getOperation()).isEqualTo("cancel");
                    assertThat(ex.getStatusCode()).isEqualTo(409);
                });
        }

        @Test
        @DisplayName("Cancelled orders reject every operation")
        void cancelledIsTerminal() {
            CancelledOrderState state = new CancelledOrderState();
            Order order = pending(10);

            assertThatThrownBy(() -> state.place(order)).isInstanceOf(InvalidStateTransitionException.class);
            assertThatThrownBy(() -> state.fill(order, 1)).isInstanceOf(InvalidStateTransitionException.class);
            assertThatThrownBy(() -> state.cancel(order, "again"))
                .hasMessage("Order is already cancelled.");
            assertThatThrownBy(() -> state.reject(order, "x")).isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("Pending orders must be placed before filling")
        void pendingFill() {
            assertThatThrownBy(() -> new PendingOrderState().fill(pending(10), 10))
                .hasMessage("Cannot fill order in Pending state. Must place order first.");
        }

        @Test
        @DisplayName("Placed orders cannot be placed again or rejected")
        void placedRestrictions() {
            PlacedOrderState state = new PlacedOrderState();

            assertThatThrownBy(() -> state.place(pending(10))).hasMessage("Order is already placed.");
            assertThatThrownBy(() -> state.reject(pending(10), "x"))
                .hasMessage("Cannot reject order in Placed state. Use Cancel instead.");
        }
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"PENDING", "VALIDATED", "PARTIALLY_FILLED", "REJECTED"})
    @DisplayName("Statuses without dedicated behaviour map to Pending")
    void fallsBackToPending(OrderStatus status) {
        assertThat(OrderStateFactory.forStatus(status)).isInstanceOf(PendingOrderState.class);
    }

    private static Order pending(long quantity) {
        return Order.builder()
            .orderId("ORD-STATE")
            .accountId("ACC-001")
            .symbol("AAPL")
            .side(OrderSide.BUY)
            .quantity(quantity)
            .price(new BigDecimal("150"))
            .build();
    }
}
