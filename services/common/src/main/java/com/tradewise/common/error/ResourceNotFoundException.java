package com.tradewise.common.error;

import lombok.Getter;

/**
 * Exception thrown when a requested resource is not found.
 */
@Getter
public class ResourceNotFoundException extends BusinessException {

    private static final long serialVersionUID = 2L;

    private final String resourceType;
    private final String resourceId;

    /**
     * Resource type and id, when present, are copied into the metadata
     */
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId, String message) {
        super(errorCode, message);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        if (resourceType != null) {
            withMetadata("resourceType", resourceType);
        }
        if (resourceId != null) {
            withMetadata("resourceId", resourceId);
        }
    }

    // ===== Static Factory Methods =====

    /**
     * Create exception for an entity missing from a keyed store
     */
    public static ResourceNotFoundException entityNotFound(Object key) {
        return new ResourceNotFoundException(ErrorCode.RESOURCE_NOT_FOUND, null, String.valueOf(key),
            String.format("Entity with key %s not found", key));
    }

    @Override
    public String toString() {
        return String.format("ResourceNotFoundException[resourceType=%s, resourceId=%s, message=%s]",
            resourceType, resourceId, getMessage());
    }
}
