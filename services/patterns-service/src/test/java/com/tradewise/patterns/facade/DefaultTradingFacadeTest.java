package com.tradewise.patterns.facade;

import com.tradewise.common.domain.CancelOrderRequest;
import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.common.domain.OrderStatus;
import com.tradewise.common.domain.PlaceOrderRequest;
import com.tradewise.patterns.command.Command;
import com.tradewise.patterns.command.CommandHandler;
import com.tradewise.patterns.command.CommandResult;
import com.tradewise.patterns.command.InMemoryOrderRepository;
import com.tradewise.patterns.config.PatternsProperties;
import com.tradewise.patterns.factorymethod.OrderValidatorFactory;
import com.tradewise.patterns.observer.EventBus;
import com.tradewise.patterns.observer.OrderCancelledEvent;
import com.tradewise.patterns.observer.OrderPlacedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DefaultTradingFacade
 *
 * Validation and storage are real; the command handler and event bus are mocked.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Trading Facade Unit Tests")
class DefaultTradingFacadeTest {

    @Mock
    private CommandHandler commandHandler;

    @Mock
    private EventBus eventBus;

    private InMemoryOrderRepository orderRepository;
    private DefaultTradingFacade facade;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
        facade = new DefaultTradingFacade(
            new OrderValidatorFactory(new PatternsProperties()), orderRepository, commandHandler, eventBus);
    }

    // ==================== Place ====================

    @Nested
    @DisplayName("Place order")
    class Place {

        @Test
        @DisplayName("Valid order is stored through a command and announced")
        void placesValidOrder() {
            when(commandHandler.execute(any())).thenAnswer(invocation -> invocation.<Command>getArgument(0).execute());

            PlaceOrderResult result = facade.placeOrder(
                new PlaceOrderRequest("ACC-001", "AAPL", OrderSide.BUY, 100, new BigDecimal("150")));

            assertThat(result.success()).isTrue();
            Order order = result.order();
            assertThat(order.getOrderId()).startsWith("ORD-");
            assertThat(order.getPrice()).isEqualByComparingTo("150");
            assertThat(orderRepository.findById(order.getOrderId())).contains(order);

            ArgumentCaptor<OrderPlacedEvent> event = ArgumentCaptor.forClass(OrderPlacedEvent.class);
            verify(eventBus).publish(event.capture());
            assertThat(event.getValue().getOrderId()).isEqualTo(order.getOrderId());
            assertThat(event.getValue().getQuantity()).isEqualTo(100);
        }

        @Test
        @DisplayName("Invalid order is rejected before any command runs")
        void rejectsInvalidOrder() {
            PlaceOrderResult result = facade.placeOrder(
                new PlaceOrderRequest("ACC-001", "", OrderSide.BUY, -10, new BigDecimal("150")));

            assertThat(result.success()).isFalse();
            assertThat(result.order()).isNull();
            assertThat(result.errors()).containsExactly("Quantity must be greater than zero", "Symbol is required");
            verifyNoInteractions(commandHandler, eventBus);
        }

        @Test
        @DisplayName("Market order without a price is rejected")
        void rejectsMarketOrder() {
            PlaceOrderResult result = facade.placeOrder(
                new PlaceOrderRequest("ACC-001", "AAPL", OrderSide.BUY, 10, null));

            assertThat(result.errors()).containsExactly("Price must be greater than zero");
        }

        @Test
        @DisplayName("Command failure is reported without an event")
        void commandFailure() {
            when(commandHandler.execute(any())).thenReturn(CommandResult.failure("store offline"));

            PlaceOrderResult result = facade.placeOrder(
                new PlaceOrderRequest("ACC-001", "AAPL", OrderSide.SELL, 10, new BigDecimal("150")));

            assertThat(result.success()).isFalse();
            assertThat(result.errors()).containsExactly("store offline");
            verifyNoInteractions(eventBus);
        }
    }

    // ==================== Cancel ====================

    @Nested
    @DisplayName("Cancel order")
    class Cancel {

        @Test
        @DisplayName("Owner can cancel and the cancellation is announced")
        void cancelsOwnOrder() {
            orderRepository.add(order("ORD-1", "ACC-001"));

            CancelOrderResult result = facade.cancelOrder(new CancelOrderRequest("ORD-1", "ACC-001"));

            assertThat(result.success()).isTrue();
            assertThat(result.errorMessage()).isNull();
            assertThat(orderRepository.findById("ORD-1")).get()
                .extracting(Order::getStatus).isEqualTo(OrderStatus.CANCELLED);

            ArgumentCaptor<OrderCancelledEvent> event = ArgumentCaptor.forClass(OrderCancelledEvent.class);
            verify(eventBus).publish(event.capture());
            assertThat(event.getValue().getReason()).isEqualTo("User request");
        }

        @Test
        @DisplayName("Unknown order")
        void unknownOrder() {
            CancelOrderResult result = facade.cancelOrder(new CancelOrderRequest("ORD-404", "ACC-001"));

            assertThat(result.success()).isFalse();
            assertThat(result.errorMessage()).isEqualTo("Order not found");
            verifyNoInteractions(eventBus);
        }

        @Test
        @DisplayName("Another account cannot cancel")
        void unauthorized() {
            orderRepository.add(order("ORD-1", "ACC-001"));

            CancelOrderResult result = facade.cancelOrder(new CancelOrderRequest("ORD-1", "ACC-002"));

            assertThat(result.errorMessage()).isEqualTo("Unauthorized");
            assertThat(orderRepository.findById("ORD-1")).get()
                .extracting(Order::getStatus).isEqualTo(OrderStatus.PENDING);
        }
    }

    private static Order order(String orderId, String accountId) {
        return Order.builder()
            .orderId(orderId)
            .accountId(accountId)
            .symbol("AAPL")
            .side(OrderSide.BUY)
            .quantity(10)
            .price(new BigDecimal("150"))
            .build();
    }
}
