package com.example.canarycontroller.error;

/**
 * Base exception for all canary controller errors.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class CanaryException extends RuntimeException {

    private final ErrorCode errorCode;

    protected CanaryException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected CanaryException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CanaryException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
