package com.tradewise.patterns.command;

import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.scenario.PatternScenario;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class CommandScenario implements PatternScenario {

    private static final int AUDIT_PREVIEW_SIZE = 5;

    private final CommandHandler commandHandler;
    private final OrderRepository orderRepository;

    @Override
    public String slug() {
        return "command";
    }

    @Override
    public String patternName() {
        return "Command";
    }

    @Override
    public PatternDemoResponse runDemo() {
        List<Object> results = new ArrayList<>();

        PlaceOrderCommand placeCommand = new PlaceOrderCommand(
            order("ORD-CMD-001", "AAPL", OrderSide.BUY, 100, "150"), orderRepository);
        CommandResult executeResult = commandHandler.execute(placeCommand);
        results.add(new ExecutedCommand("Execute Command", placeCommand.getCommandId(), executeResult));

        PlaceOrderCommand queuedCommand = new PlaceOrderCommand(
            order("ORD-CMD-002", "MSFT", OrderSide.SELL, 50, "300"), orderRepository);
        commandHandler.queue(queuedCommand);
        results.add(new QueuedCommand("Queue Command", queuedCommand.getCommandId(), commandHandler.queuedCount()));

        List<CommandAuditEntry> auditLog = commandHandler.auditLog();
        results.add(new AuditPreview("Audit Log", auditLog.stream().limit(AUDIT_PREVIEW_SIZE).toList()));

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates command pattern: encapsulates requests as objects with retry, queue, and audit support.")
            .result(results)
            .metadata(Map.of(
                "RetrySupport", true,
                "QueueSupport", true,
                "AuditSupport", true,
                "UndoSupport", true))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        Order order = order("ORD-TEST-001", "TEST", OrderSide.BUY, 10, "100");
        PlaceOrderCommand command = new PlaceOrderCommand(order, orderRepository);
        CommandResult result = commandHandler.execute(command);
        checks.add(new TestCheck("Command Execution", result.success(),
            String.format("Command %s executed: %s", command.getCommandId(), result.success())));

        Optional<Order> stored = orderRepository.findById(order.getOrderId());
        checks.add(new TestCheck("Order Persisted", stored.isPresent(),
            String.format("Order %s was persisted", order.getOrderId())));

        if (command.supportsUndo()) {
            CommandResult undoResult = command.undo();
            boolean removed = orderRepository.findById(order.getOrderId()).isEmpty();
            checks.add(new TestCheck("Command Undo", undoResult.success() && removed,
                "Command undo: " + undoResult.success()));
        }

        commandHandler.queue(new PlaceOrderCommand(order, orderRepository));
        int queued = commandHandler.queuedCount();
        checks.add(new TestCheck("Command Queue", queued > 0, "Commands in queue: " + queued));

        return PatternTestResponse.of(patternName(), checks);
    }

    private static Order order(String orderId, String symbol, OrderSide side, long quantity, String price) {
        return Order.builder()
            .orderId(orderId)
            .accountId("ACC-001")
            .symbol(symbol)
            .side(side)
            .quantity(quantity)
            .price(new BigDecimal(price))
            .build();
    }

    public record ExecutedCommand(String action, String commandId, CommandResult result) {
    }

    public record QueuedCommand(String action, String commandId, int queueCount) {
    }

    public record AuditPreview(String action, List<CommandAuditEntry> entries) {
    }
}
