package com.tradewise.common.error;

import org.springframework.http.HttpStatus;

/**
 * Error codes for the TradeWise platform.
 *
 * Format: MODULE_NUMBER
 * Categories:
 * - 3xxx: Payment
 * - 5xxx: System
 * - 7xxx: Validation
 * - 9xxx: Business logic and resources
 */
public enum ErrorCode {

    // ===== 3xxx: PAYMENT ERRORS =====
    PAYMENT_PROCESSING_FAILED("PAYMENT_3005", "Payment processing failed", HttpStatus.PAYMENT_REQUIRED),
    PAYMENT_PROVIDER_NOT_FOUND("PAYMENT_3021", "Payment provider not found", HttpStatus.NOT_FOUND),

    // ===== 5xxx: SYSTEM ERRORS =====
    SYS_INTERNAL_ERROR("SYS_5001", "Internal system error", HttpStatus.INTERNAL_SERVER_ERROR),

    // ===== 7xxx: VALIDATION ERRORS =====
    VALIDATION_FAILED("VAL_7001", "Validation failed", HttpStatus.BAD_REQUEST),

    // ===== 9xxx: BUSINESS LOGIC ERRORS =====
    BIZ_INVALID_OPERATION("BIZ_9001", "Invalid business operation", HttpStatus.BAD_REQUEST),
    BIZ_STATE_TRANSITION_INVALID("BIZ_9006", "Invalid state transition", HttpStatus.CONFLICT),

    RESOURCE_NOT_FOUND("RESOURCE_9201", "Resource not found", HttpStatus.NOT_FOUND);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus httpStatus;

    ErrorCode(String code, String defaultMessage, HttpStatus httpStatus) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public int getStatusCode() {
        return httpStatus.value();
    }
}
