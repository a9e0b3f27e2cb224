package com.tradewise.patterns.controller;

import com.tradewise.common.event.EventPublisher;
import com.tradewise.common.event.PublishedMessage;
import com.tradewise.common.metrics.MetricsSink;
import com.tradewise.common.metrics.MetricsSnapshot;
import com.tradewise.patterns.command.CommandAuditEntry;
import com.tradewise.patterns.command.CommandHandler;
import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternSummary;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.exception.PatternNotFoundException;
import com.tradewise.patterns.scenario.PatternScenario;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Demo and self-test endpoints for every registered pattern scenario.
 */
@RestController
@RequestMapping("/api/patterns")
@Slf4j
@Tag(name = "Design Patterns", description = "Runnable demonstrations and self-checks of design patterns in a trading domain")
public class PatternController {

    private static final String BASE_PATH = "/api/patterns/";

    private final Map<String, PatternScenario> scenarios;
    private final CommandHandler commandHandler;
    private final MetricsSink metricsSink;
    private final EventPublisher eventPublisher;

    public PatternController(List<PatternScenario> patternScenarios,
                             CommandHandler commandHandler,
                             MetricsSink metricsSink,
                             EventPublisher eventPublisher) {
        Map<String, PatternScenario> registry = new LinkedHashMap<>();
        for (PatternScenario scenario : patternScenarios) {
            if (registry.putIfAbsent(scenario.slug(), scenario) != null) {
                throw new IllegalStateException("Duplicate pattern slug: " + scenario.slug());
            }
        }
        this.scenarios = registry;
        this.commandHandler = commandHandler;
        this.metricsSink = metricsSink;
        this.eventPublisher = eventPublisher;
        log.info("Registered {} pattern scenarios: {}", scenarios.size(), scenarios.keySet());
    }

    @GetMapping
    @Operation(summary = "List registered patterns")
    public ResponseEntity<List<PatternSummary>> listPatterns() {
        List<PatternSummary> catalog = scenarios.values().stream()
            .map(scenario -> new PatternSummary(
                scenario.slug(),
                scenario.patternName(),
                BASE_PATH + scenario.slug() + "/demo",
                BASE_PATH + scenario.slug() + "/test"))
            .toList();
        return ResponseEntity.ok(catalog);
    }

    @GetMapping("/{slug}/demo")
    @Operation(summary = "Run the demonstration of a pattern")
    public ResponseEntity<PatternDemoResponse> runDemo(@PathVariable String slug) {
        log.info("Running demo for pattern: {}", slug);
        return ResponseEntity.ok(scenario(slug).runDemo());
    }

    @GetMapping("/{slug}/test")
    @Operation(summary = "Run the self-checks of a pattern")
    public ResponseEntity<PatternTestResponse> runTest(@PathVariable String slug) {
        log.info("Running self-test for pattern: {}", slug);
        PatternTestResponse response = scenario(slug).runTest();
        if (PatternTestResponse.FAIL.equals(response.getStatus())) {
            log.warn("Self-test failed for pattern {}: {}", slug, response.getChecks());
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/command/audit")
    @Operation(summary = "Command handler audit trail")
    public ResponseEntity<List<CommandAuditEntry>> commandAudit() {
        return ResponseEntity.ok(commandHandler.auditLog());
    }

    @GetMapping("/decorator/metrics")
    @Operation(summary = "Metrics recorded so far")
    public ResponseEntity<MetricsSnapshot> decoratorMetrics() {
        return ResponseEntity.ok(metricsSink.snapshot());
    }

    @GetMapping("/observer/published")
    @Operation(summary = "Domain events forwarded to the event sink")
    public ResponseEntity<List<PublishedMessage>> publishedEvents() {
        return ResponseEntity.ok(eventPublisher.getPublishedMessages());
    }

    private PatternScenario scenario(String slug) {
        PatternScenario scenario = scenarios.get(slug);
        if (scenario == null) {
            throw new PatternNotFoundException(slug);
        }
        return scenario;
    }
}
