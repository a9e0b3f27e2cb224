package com.tradewise.patterns.facade;

import com.tradewise.common.domain.CancelOrderRequest;
import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderStatus;
import com.tradewise.common.domain.PlaceOrderRequest;
import com.tradewise.patterns.command.CommandHandler;
import com.tradewise.patterns.command.CommandResult;
import com.tradewise.patterns.command.OrderRepository;
import com.tradewise.patterns.command.PlaceOrderCommand;
import com.tradewise.patterns.factorymethod.OrderValidatorFactory;
import com.tradewise.patterns.factorymethod.ValidationResult;
import com.tradewise.patterns.observer.EventBus;
import com.tradewise.patterns.observer.OrderCancelledEvent;
import com.tradewise.patterns.observer.OrderPlacedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultTradingFacade implements TradingFacade {

    static final String ORDER_NOT_FOUND = "Order not found";
    static final String UNAUTHORIZED = "Unauthorized";
    static final String CANCEL_REASON = "User request";

    private final OrderValidatorFactory validatorFactory;
    private final OrderRepository orderRepository;
    private final CommandHandler commandHandler;
    private final EventBus eventBus;

    @Override
    public PlaceOrderResult placeOrder(PlaceOrderRequest request) {
        try {
            Order order = Order.builder()
                .orderId("ORD-" + UUID.randomUUID().toString().replace("-", ""))
                .accountId(request.accountId())
                .symbol(request.symbol())
                .side(request.side())
                .quantity(request.quantity())
                .price(Objects.requireNonNullElse(request.limitPrice(), BigDecimal.ZERO))
                .build();

            ValidationResult validation = validatorFactory.createValidator(order).validate(order);
            if (!validation.valid()) {
                log.info("Order rejected by {} validation: {}", validation.validatorType(), validation.errors());
                return PlaceOrderResult.rejected(validation.errors());
            }

            CommandResult commandResult = commandHandler.execute(new PlaceOrderCommand(order, orderRepository));
            if (!commandResult.success()) {
                return PlaceOrderResult.rejected(List.of(
                    Objects.requireNonNullElse(commandResult.errorMessage(), "Command failed")));
            }

            eventBus.publish(new OrderPlacedEvent(
                order.getOrderId(), order.getAccountId(), order.getSymbol(), order.getQuantity(), order.getPrice()));

            log.info("Order placed via facade: {}", order.getOrderId());
            return PlaceOrderResult.placed(order);
        } catch (RuntimeException e) {
            log.error("Error placing order via facade", e);
            return PlaceOrderResult.rejected(List.of(String.valueOf(e.getMessage())));
        }
    }

    @Override
    public CancelOrderResult cancelOrder(CancelOrderRequest request) {
        try {
            Optional<Order> existing = orderRepository.findById(request.orderId());
            if (existing.isEmpty()) {
                return CancelOrderResult.failed(ORDER_NOT_FOUND);
            }

            Order order = existing.get();
            if (!Objects.equals(order.getAccountId(), request.accountId())) {
                log.warn("Account {} attempted to cancel order {} owned by another account",
                    request.accountId(), order.getOrderId());
                return CancelOrderResult.failed(UNAUTHORIZED);
            }

            orderRepository.update(order.withStatus(OrderStatus.CANCELLED));
            eventBus.publish(new OrderCancelledEvent(order.getOrderId(), order.getAccountId(), CANCEL_REASON));

            log.info("Order cancelled via facade: {}", order.getOrderId());
            return CancelOrderResult.cancelled();
        } catch (RuntimeException e) {
            log.error("Error cancelling order via facade", e);
            return CancelOrderResult.failed(e.getMessage());
        }
    }
}
