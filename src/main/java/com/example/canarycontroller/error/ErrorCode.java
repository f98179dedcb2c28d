package com.example.canarycontroller.error;

/**
 * Standardized error codes for the canary controller.
 *
 * Format: CC-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found, conflict)
 * - 5xx: Rollout errors (state machine, workload)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    INVALID_CONFIGURATION("CC-100", "Invalid deployment configuration", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("CC-101", "Invalid request format", ErrorCategory.RECOVERABLE),

    // ==================== Resource Errors (3xx) ====================

    RESOURCE_NOT_FOUND("CC-300", "Resource not found", ErrorCategory.RECOVERABLE),
    DEPLOYMENT_NOT_FOUND("CC-301", "Canary deployment not found", ErrorCategory.RECOVERABLE),
    ROLLBACK_NOT_FOUND("CC-302", "Rollback record not found", ErrorCategory.RECOVERABLE),
    TEMPLATE_NOT_FOUND("CC-303", "Canary template not found", ErrorCategory.RECOVERABLE),
    OPTIMISTIC_LOCK_FAILURE("CC-312", "Concurrent modification", ErrorCategory.RECOVERABLE),

    // ==================== Rollout Errors (5xx) ====================

    STATE_TRANSITION_INVALID("CC-520", "Invalid state transition", ErrorCategory.RECOVERABLE),

    // ==================== Internal Errors (9xx) ====================

    INTERNAL_ERROR("CC-900", "Internal server error", ErrorCategory.FATAL);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    public enum ErrorCategory {
        /** Client can retry or fix the request */
        RECOVERABLE,

        /** System is in a bad state, may require intervention */
        FATAL
    }
}
