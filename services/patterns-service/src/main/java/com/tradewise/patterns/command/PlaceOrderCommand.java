package com.tradewise.patterns.command;

import com.tradewise.common.domain.Order;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.UUID;

/**
 * Stores an order, remembering what was stored under the same id before so the placement can be undone.
 */
@Slf4j
public class PlaceOrderCommand implements Command {

    private final String commandId;
    private final Order order;
    private final OrderRepository repository;

    private volatile Order previous;

    public PlaceOrderCommand(Order order, OrderRepository repository) {
        this.commandId = "CMD-" + UUID.randomUUID().toString().replace("-", "");
        this.order = order;
        this.repository = repository;
    }

    @Override
    public String getCommandId() {
        return commandId;
    }

    public Order getOrder() {
        return order;
    }

    @Override
    public boolean supportsUndo() {
        return true;
    }

    @Override
    public CommandResult execute() {
        try {
            log.info("Executing PlaceOrderCommand {} for order {}", commandId, order.getOrderId());
            previous = repository.findById(order.getOrderId()).orElse(null);
            repository.add(order);
            return CommandResult.ok(Map.of("orderId", order.getOrderId()));
        } catch (RuntimeException e) {
            log.error("Failed to execute PlaceOrderCommand {}", commandId, e);
            return CommandResult.failure(e.getMessage());
        }
    }

    @Override
    public CommandResult undo() {
        try {
            if (previous == null) {
                repository.delete(order.getOrderId());
            } else {
                repository.update(previous);
            }
            log.info("Undone PlaceOrderCommand {}", commandId);
            return CommandResult.ok();
        } catch (RuntimeException e) {
            log.error("Failed to undo PlaceOrderCommand {}", commandId, e);
            return CommandResult.failure(e.getMessage());
        }
    }
}
