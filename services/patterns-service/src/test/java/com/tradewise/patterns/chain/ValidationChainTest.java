package com.tradewise.patterns.chain;

import com.tradewise.common.domain.Account;
import com.tradewise.common.domain.Order;
import com.tradewise.common.domain.OrderSide;
import com.tradewise.patterns.config.PatternsProperties;
import com.tradewise.patterns.factorymethod.ValidationResult;
import com.tradewise.patterns.repository.InMemoryRepository;
import com.tradewise.patterns.repository.Repository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the Basic -> Risk -> Account validation chain
 */
@DisplayName("Validation Chain Unit Tests")
class ValidationChainTest {

    private ValidationHandler chain;

    @BeforeEach
    void setUp() {
        Repository<Account, String> accounts = new InMemoryRepository<>(Account::accountId);
        accounts.add(new Account("ACC-001", "Test Account", new BigDecimal("100000"), "USD", Instant.now()));
        chain = new ValidationChainConfiguration().orderValidationChain(new PatternsProperties(), accounts);
    }

    @Test
    @DisplayName("Valid order passes every link")
    void validOrderPasses() {
        ValidationResult result = chain.handle(order("ACC-001", 100, "150"));

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.validatorType()).isEqualTo("Account");
    }

    @Test
    @DisplayName("Basic failure stops the chain before risk is checked")
    void basicStopsChain() {
        ValidationResult result = chain.handle(order("ACC-999", -5, "0"));

        assertThat(result.valid()).isFalse();
        assertThat(result.validatorType()).isEqualTo("Basic");
        assertThat(result.errors()).containsExactly(
            "Quantity must be greater than zero",
            "Price must be greater than zero");
    }

    @Test
    @DisplayName("Orders above the risk ceiling are rejected")
    void riskCeiling() {
        ValidationResult result = chain.handle(order("ACC-001", 10000, "300"));

        assertThat(result.valid()).isFalse();
        assertThat(result.validatorType()).isEqualTo("Risk");
        assertThat(result.errors()).containsExactly("Order value 3000000 exceeds maximum 1000000");
    }

    @Test
    @DisplayName("Unknown accounts are rejected last")
    void unknownAccount() {
        ValidationResult result = chain.handle(order("ACC-999", 100, "150"));

        assertThat(result.valid()).isFalse();
        assertThat(result.validatorType()).isEqualTo("Account");
        assertThat(result.errors()).containsExactly("Account ACC-999 not found");
    }

    @Test
    @DisplayName("Single link without successor returns its own verdict")
    void singleLink() {
        ValidationResult result = new RiskValidationHandler(new BigDecimal("500")).handle(order("ACC-001", 10, "10"));

        assertThat(result.valid()).isTrue();
        assertThat(result.validatorType()).isEqualTo("Risk");
    }

    private static Order order(String accountId, long quantity, String price) {
        return Order.builder()
            .orderId("ORD-CHAIN")
            .accountId(accountId)
            .symbol("AAPL")
            .side(OrderSide.BUY)
            .quantity(quantity)
            .price(new BigDecimal(price))
            .build();
    }
}
