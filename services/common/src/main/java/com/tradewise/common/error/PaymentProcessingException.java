package com.tradewise.common.error;

/**
 * Operational failure raised while a gateway or provider processes a payment.
 */
public class PaymentProcessingException extends BusinessException {

    private static final long serialVersionUID = 1L;

    public PaymentProcessingException(String message, Throwable cause) {
        super(ErrorCode.PAYMENT_PROCESSING_FAILED, message, cause);
    }
}
