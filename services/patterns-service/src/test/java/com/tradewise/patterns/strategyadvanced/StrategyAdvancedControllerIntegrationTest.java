package com.tradewise.patterns.strategyadvanced;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Payment Provider API Integration Tests")
class StrategyAdvancedControllerIntegrationTest {

    private static final String PROCESS_PAYMENT = "/api/strategy-advanced/process-payment";

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Processes a payment with a case-insensitive provider key")
    void processesPayment() throws Exception {
        mockMvc.perform(post(PROCESS_PAYMENT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"amount": 100.00, "currency": "USD", "providerKey": "STRIPE", "customerEmail": "jane@example.com"}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.providerUsed").value("stripe"))
            .andExpect(jsonPath("$.transactionId").value(startsWith("stripe_txn_")))
            .andExpect(jsonPath("$.status").value(anyOf(is("Success"), is("Failed"))));
    }

    @Test
    @DisplayName("Unknown provider answers 404 listing the registered keys")
    void unknownProvider() throws Exception {
        mockMvc.perform(post(PROCESS_PAYMENT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"amount": 100.00, "currency": "USD", "providerKey": "unknown"}
                    """))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error")
                .value("Payment provider 'unknown' not found. Available providers: crypto, paypal, stripe"))
            .andExpect(jsonPath("$.providerKey").value("unknown"))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("Amount below the provider minimum answers 400")
    void belowMinimum() throws Exception {
        mockMvc.perform(post(PROCESS_PAYMENT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"amount": 5.00, "currency": "BTC", "providerKey": "crypto"}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Payment validation failed for provider 'crypto'"))
            .andExpect(jsonPath("$.providerKey").value("crypto"));
    }

    @Test
    @DisplayName("Malformed request fails bean validation")
    void invalidRequest() throws Exception {
        mockMvc.perform(post(PROCESS_PAYMENT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"amount": -1, "currency": "", "providerKey": "stripe", "customerEmail": "not-an-email"}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VAL_7001"))
            .andExpect(jsonPath("$.fieldErrors[*].field", containsInAnyOrder("amount", "currency", "customerEmail")));
    }

    @Test
    @DisplayName("Lists providers with their limits")
    void listsProviders() throws Exception {
        mockMvc.perform(get("/api/strategy-advanced/providers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].key", contains("crypto", "paypal", "stripe")))
            .andExpect(jsonPath("$[2].supportedCurrencies", contains("USD", "EUR", "GBP")));
    }
}
