package com.tradewise.common.error;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * Base exception for business logic errors.
 *
 * Carries an error code, the HTTP status it maps to and free-form metadata.
 */
@Getter
public class BusinessException extends RuntimeException {

    private static final long serialVersionUID = 2L;

    private final String errorCode;
    private final int statusCode;
    private final Map<String, Object> metadata;

    public BusinessException(ErrorCode errorCode, String message) {
        super(message != null ? message : errorCode.getDefaultMessage());
        this.errorCode = errorCode.getCode();
        this.statusCode = errorCode.getStatusCode();
        this.metadata = new HashMap<>();
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message != null ? message : errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode.getCode();
        this.statusCode = errorCode.getStatusCode();
        this.metadata = new HashMap<>();
    }

    /**
     * Add metadata to the exception
     */
    public BusinessException withMetadata(String key, Object value) {
        this.metadata.put(key, value);
        return this;
    }

    // ===== Static Factory Methods =====

    /**
     * Create exception for state transition error
     */
    public static BusinessException invalidStateTransition(String currentState, String targetState) {
        return new BusinessException(
            ErrorCode.BIZ_STATE_TRANSITION_INVALID,
            String.format("Cannot transition from %s to %s", currentState, targetState)
        ).withMetadata("currentState", currentState)
         .withMetadata("targetState", targetState);
    }

    @Override
    public String toString() {
        return String.format("BusinessException[errorCode=%s, statusCode=%d, message=%s]",
            errorCode, statusCode, getMessage());
    }
}
