package com.tradewise.patterns.strategyadvanced;

import com.tradewise.patterns.config.PatternsProperties;
import com.tradewise.patterns.exception.PaymentProviderNotFoundException;
import com.tradewise.patterns.exception.PaymentValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ProviderPaymentService
 *
 * Providers run with zero latency so the tests stay fast.
 */
@DisplayName("Provider Payment Service Unit Tests")
class ProviderPaymentServiceTest {

    private ProviderPaymentService service;

    @BeforeEach
    void setUp() {
        PatternsProperties properties = new PatternsProperties();
        PatternsProperties.ProvidersConfig providers = properties.getProviders();
        providers.setStripe(new PatternsProperties.Simulation(42L, Duration.ZERO));
        providers.setPaypal(new PatternsProperties.Simulation(43L, Duration.ZERO));
        providers.setCrypto(new PatternsProperties.Simulation(44L, Duration.ZERO));

        service = new ProviderPaymentService(new PaymentProviderResolver(List.of(
            new StripePaymentProvider(properties),
            new PayPalPaymentProvider(properties),
            new CryptoPaymentProvider(properties))));
    }

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("Routes to the named provider")
        void routesToProvider() {
            ProviderPaymentResult result = service.processPayment(request("100.00", "USD", "STRIPE"));

            assertThat(result.providerUsed()).isEqualTo("stripe");
            assertThat(result.transactionId()).startsWith("stripe_txn_");
            assertThat(result.status()).isIn(ProviderPaymentResult.SUCCESS, ProviderPaymentResult.FAILED);
            assertThat(result.processedAt()).isNotNull();
        }

        @Test
        @DisplayName("Success message names the provider")
        void successMessage() {
            ProviderPaymentResult result = service.processPayment(request("25.00", "CAD", "paypal"));

            if (result.successful()) {
                assertThat(result.message()).isEqualTo("Payment processed successfully via PayPal");
            } else {
                assertThat(result.message()).isEqualTo("Payment processing failed");
            }
        }

        @Test
        @DisplayName("Unknown provider lists the registered keys")
        void unknownProvider() {
            assertThatThrownBy(() -> service.processPayment(request("100.00", "USD", "unknown")))
                .isInstanceOf(PaymentProviderNotFoundException.class)
                .hasMessage("Payment provider 'unknown' not found. Available providers: crypto, paypal, stripe");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Amount below the provider minimum is rejected")
        void belowMinimum() {
            assertThatThrownBy(() -> service.processPayment(request("5.00", "BTC", "crypto")))
                .isInstanceOf(PaymentValidationException.class)
                .hasMessage("Payment validation failed for provider 'crypto'");
        }

        @Test
        @DisplayName("Unsupported currency is rejected")
        void unsupportedCurrency() {
            assertThatThrownBy(() -> service.processPayment(request("100.00", "JPY", "stripe")))
                .isInstanceOf(PaymentValidationException.class)
                .extracting("providerKey").isEqualTo("stripe");
        }

        @Test
        @DisplayName("Currency match ignores case and the minimum is inclusive")
        void inclusiveMinimum() {
            assertThatCode(() -> service.processPayment(request("0.50", "usd", "paypal")))
                .doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("Provider listing exposes limits")
    void listsProviders() {
        List<ProviderInfo> providers = service.getAvailableProviders();

        assertThat(providers).extracting(ProviderInfo::key).containsExactly("crypto", "paypal", "stripe");
        assertThat(providers.get(0).minimumAmount()).isEqualByComparingTo("10.00");
        assertThat(providers.get(0).supportedCurrencies()).containsExactly("BTC", "ETH", "USDT");
    }

    private static ProcessPaymentRequest request(String amount, String currency, String providerKey) {
        return new ProcessPaymentRequest(new BigDecimal(amount), currency, providerKey, "customer@example.com");
    }
}
