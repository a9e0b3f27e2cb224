package com.tradewise.patterns.command;

import com.tradewise.common.metrics.MetricsSink;
import com.tradewise.patterns.config.ResilienceConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes commands with bounded linear-backoff retries and keeps an append-only audit trail.
 * <p>
 * Every attempt writes an EXECUTE entry carrying its zero-based retry count. The run then ends with
 * exactly one of SUCCESS, FAILED (all attempts reported failure; the last result is returned)
 * or EXCEPTION (all attempts threw; a failed result carrying the message is returned).
 * <p>
 * The audit trail and the queue are unbounded and live as long as the handler.
 */
@Slf4j
@Service
public class RetryingCommandHandler implements CommandHandler {

    private final Retry retry;
    private final int maxAttempts;
    private final MetricsSink metrics;

    private final Queue<Command> commandQueue = new ConcurrentLinkedQueue<>();
    private final List<CommandAuditEntry> auditLog = new ArrayList<>();
    private final Object auditLock = new Object();

    public RetryingCommandHandler(RetryRegistry retryRegistry, MetricsSink metrics) {
        RetryConfig config = RetryConfig.<CommandResult>from(
                retryRegistry.getConfiguration(ResilienceConfig.COMMAND_RETRY)
                    .orElseGet(retryRegistry::getDefaultConfig))
            .retryOnResult(result -> !result.success())
            .build();
        this.retry = retryRegistry.retry(ResilienceConfig.COMMAND_RETRY, config);
        this.maxAttempts = config.getMaxAttempts();
        this.metrics = metrics;
    }

    @Override
    public CommandResult execute(Command command) {
        Instant start = Instant.now();
        AtomicInteger attempts = new AtomicInteger();

        try {
            CommandResult result = retry.executeSupplier(() -> attempt(command, attempts.getAndIncrement()));

            if (result.success()) {
                audit(command, AuditAction.SUCCESS, attempts.get() - 1, Duration.between(start, Instant.now()));
                metrics.incrementCounter("command.execution", Map.of("outcome", "success"));
            } else {
                audit(command, AuditAction.FAILED, attempts.get(), null);
                metrics.incrementCounter("command.execution", Map.of("outcome", "failed"));
                log.warn("Command {} failed after {} attempts: {}",
                    command.getCommandId(), attempts.get(), result.errorMessage());
            }
            return result;
        } catch (RuntimeException e) {
            audit(command, AuditAction.EXCEPTION, attempts.get(), null);
            metrics.incrementCounter("command.execution", Map.of("outcome", "exception"));
            log.error("Command {} gave up after {} attempts", command.getCommandId(), attempts.get(), e);
            return CommandResult.failure(e.getMessage());
        }
    }

    private CommandResult attempt(Command command, int retryCount) {
        audit(command, AuditAction.EXECUTE, retryCount, null);
        try {
            CommandResult result = command.execute();
            if (!result.success() && retryCount + 1 < maxAttempts) {
                log.warn("Command {} failed, retrying ({}/{})", command.getCommandId(), retryCount + 1, maxAttempts);
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Command {} threw exception (attempt {}/{})",
                command.getCommandId(), retryCount + 1, maxAttempts, e);
            throw e;
        }
    }

    @Override
    public void queue(Command command) {
        commandQueue.add(command);
        audit(command, AuditAction.QUEUED, 0, null);
        metrics.setGauge("command.queue.size", commandQueue.size(), Map.of());
        log.info("Command {} queued", command.getCommandId());
    }

    @Override
    public int queuedCount() {
        return commandQueue.size();
    }

    @Override
    public List<Command> queuedCommands() {
        return List.copyOf(commandQueue);
    }

    @Override
    public List<CommandAuditEntry> auditLog() {
        synchronized (auditLock) {
            return List.copyOf(auditLog);
        }
    }

    private void audit(Command command, AuditAction action, int retryCount, Duration duration) {
        synchronized (auditLock) {
            auditLog.add(new CommandAuditEntry(command.getCommandId(), action, Instant.now(), retryCount, duration));
        }
    }
}
