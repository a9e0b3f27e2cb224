package com.tradewise.patterns.exception;

import com.tradewise.common.error.BusinessException;
import com.tradewise.common.error.ErrorCode;
import lombok.Getter;

@Getter
public class PaymentValidationException extends BusinessException {

    private final String providerKey;

    public PaymentValidationException(String providerKey) {
        super(ErrorCode.VALIDATION_FAILED,
            String.format("Payment validation failed for provider '%s'", providerKey));
        this.providerKey = providerKey;
        withMetadata("providerKey", providerKey);
    }
}
