package com.tradewise.patterns.exception;

import com.tradewise.common.error.ErrorCode;
import com.tradewise.common.error.ResourceNotFoundException;

/**
 * Thrown when no scenario is registered under the requested slug
 */
public class PatternNotFoundException extends ResourceNotFoundException {

    public PatternNotFoundException(String slug) {
        super(ErrorCode.RESOURCE_NOT_FOUND, "Pattern", slug, "Pattern not found: " + slug);
    }
}
