package com.tradewise.patterns.exception;

import com.tradewise.common.domain.OrderStatus;
import com.tradewise.common.error.BusinessException;
import com.tradewise.common.error.ErrorCode;
import lombok.Getter;

/**
 * Raised when an order state rejects a lifecycle operation
 */
@Getter
public class InvalidStateTransitionException extends BusinessException {

    private final OrderStatus currentStatus;
    private final String operation;

    public InvalidStateTransitionException(OrderStatus currentStatus, String operation, String message) {
        super(ErrorCode.BIZ_STATE_TRANSITION_INVALID, message);
        this.currentStatus = currentStatus;
        this.operation = operation;
        withMetadata("currentState", currentStatus.name());
        withMetadata("operation", operation);
    }
}
