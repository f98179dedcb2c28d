package com.example.canarycontroller.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends CanaryException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException deployment(String id) {
        return new ResourceNotFoundException(ErrorCode.DEPLOYMENT_NOT_FOUND, "Canary deployment", id);
    }

    public static ResourceNotFoundException rollback(String id) {
        return new ResourceNotFoundException(ErrorCode.ROLLBACK_NOT_FOUND, "Rollback record", id);
    }

    public static ResourceNotFoundException template(String id) {
        return new ResourceNotFoundException(ErrorCode.TEMPLATE_NOT_FOUND, "Canary template", id);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
