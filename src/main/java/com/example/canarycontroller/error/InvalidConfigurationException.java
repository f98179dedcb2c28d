package com.example.canarycontroller.error;

/**
 * Rejected deployment or template configuration. Raised before anything is persisted.
 */
public class InvalidConfigurationException extends CanaryException {

    private final String field;
    private final Object rejectedValue;

    public InvalidConfigurationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
        this.field = null;
        this.rejectedValue = null;
    }

    public InvalidConfigurationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_CONFIGURATION,
                String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
