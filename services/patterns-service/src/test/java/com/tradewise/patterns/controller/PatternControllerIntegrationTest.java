package com.tradewise.patterns.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for the pattern catalog, demo and self-test endpoints
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Pattern Controller Integration Tests")
class PatternControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Catalog lists all sixteen patterns")
    void listsCatalog() throws Exception {
        mockMvc.perform(get("/api/patterns"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(16)))
            .andExpect(jsonPath("$[*].slug", hasItems("singleton", "strategy-advanced", "chain-of-responsibility")))
            .andExpect(jsonPath("$[?(@.slug == 'state')].testPath", contains("/api/patterns/state/test")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "singleton", "factory-method", "abstract-factory", "builder", "adapter", "decorator",
        "strategy", "strategy-advanced", "command", "observer", "facade", "repository",
        "mediator", "state", "prototype", "chain-of-responsibility"})
    @DisplayName("Every self-test passes")
    void selfTestsPass(String slug) throws Exception {
        mockMvc.perform(get("/api/patterns/{slug}/test", slug))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PASS"))
            .andExpect(jsonPath("$.checks", not(empty())));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "singleton", "factory-method", "abstract-factory", "builder", "adapter", "decorator",
        "strategy", "strategy-advanced", "command", "observer", "facade", "repository",
        "mediator", "state", "prototype", "chain-of-responsibility"})
    @DisplayName("Every demo answers with an envelope")
    void demosRespond(String slug) throws Exception {
        mockMvc.perform(get("/api/patterns/{slug}/demo", slug))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pattern").isNotEmpty())
            .andExpect(jsonPath("$.description").isNotEmpty())
            .andExpect(jsonPath("$.result").exists());
    }

    @Test
    @DisplayName("Strategy demo prices with all four strategies then selects risk adjusted")
    void strategyDemo() throws Exception {
        mockMvc.perform(get("/api/patterns/strategy/demo"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result", hasSize(5)))
            .andExpect(jsonPath("$.result[0].strategy").value("MarketPrice"))
            .andExpect(jsonPath("$.result[0].calculatedPrice").value(150.5))
            .andExpect(jsonPath("$.result[4].selectedStrategy").value("RiskAdjusted"))
            .andExpect(jsonPath("$.metadata.StrategyCount").value(4));
    }

    @Test
    @DisplayName("State demo ends with a rejected cancel")
    void stateDemo() throws Exception {
        mockMvc.perform(get("/api/patterns/state/demo"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result[*].state", contains("PENDING", "PLACED", "FILLED")))
            .andExpect(jsonPath("$.result[3].success").value(true))
            .andExpect(jsonPath("$.result[3].message").value("Cannot cancel order in Filled state (terminal)."));
    }

    @Test
    @DisplayName("Command audit reflects executed commands")
    void commandAudit() throws Exception {
        mockMvc.perform(get("/api/patterns/command/demo")).andExpect(status().isOk());

        mockMvc.perform(get("/api/patterns/command/audit"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].action", hasItems("EXECUTE", "SUCCESS", "QUEUED")));
    }

    @Test
    @DisplayName("Decorator metrics are exposed after a payment")
    void decoratorMetrics() throws Exception {
        mockMvc.perform(get("/api/patterns/decorator/demo")).andExpect(status().isOk());

        mockMvc.perform(get("/api/patterns/decorator/metrics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.counters").isNotEmpty());
    }

    @Test
    @DisplayName("Observer forwards events to the sink")
    void observerPublished() throws Exception {
        mockMvc.perform(get("/api/patterns/observer/demo")).andExpect(status().isOk());

        mockMvc.perform(get("/api/patterns/observer/published"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].topic", hasItems("domain-events.orderplaced", "domain-events.orderfilled")));
    }

    @Test
    @DisplayName("Unknown slug answers 404 with the error envelope")
    void unknownSlug() throws Exception {
        mockMvc.perform(get("/api/patterns/{slug}/demo", "visitor").header("X-Correlation-ID", "corr-123"))
            .andExpect(status().isNotFound())
            .andExpect(header().string("X-Correlation-ID", "corr-123"))
            .andExpect(jsonPath("$.errorCode").value("RESOURCE_9201"))
            .andExpect(jsonPath("$.message").value("Pattern not found: visitor"))
            .andExpect(jsonPath("$.path").value("/api/patterns/visitor/demo"))
            .andExpect(jsonPath("$.traceId").value("corr-123"));
    }
}
