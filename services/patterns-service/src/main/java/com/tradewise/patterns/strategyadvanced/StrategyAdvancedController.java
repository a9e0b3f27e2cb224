package com.tradewise.patterns.strategyadvanced;

import com.tradewise.patterns.exception.PaymentProviderNotFoundException;
import com.tradewise.patterns.exception.PaymentValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/strategy-advanced")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Payment Providers", description = "Payment processing with runtime provider selection")
public class StrategyAdvancedController {

    private final ProviderPaymentService paymentService;

    @PostMapping("/process-payment")
    @Operation(summary = "Process a payment through the provider named in the request")
    public ResponseEntity<ProviderPaymentResult> processPayment(@Valid @RequestBody ProcessPaymentRequest request) {
        return ResponseEntity.ok(paymentService.processPayment(request));
    }

    @GetMapping("/providers")
    @Operation(summary = "List registered payment providers and their limits")
    public ResponseEntity<List<ProviderInfo>> getProviders() {
        return ResponseEntity.ok(paymentService.getAvailableProviders());
    }

    @ExceptionHandler(PaymentProviderNotFoundException.class)
    public ResponseEntity<StrategyErrorResponse> handleProviderNotFound(PaymentProviderNotFoundException ex) {
        log.warn("Payment processing failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new StrategyErrorResponse(ex.getMessage(), ex.getProviderKey(), Instant.now()));
    }

    @ExceptionHandler(PaymentValidationException.class)
    public ResponseEntity<StrategyErrorResponse> handleValidationFailure(PaymentValidationException ex) {
        log.warn("Payment processing failed: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new StrategyErrorResponse(ex.getMessage(), ex.getProviderKey(), Instant.now()));
    }
}
