package com.example.canarycontroller.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Converts exceptions raised by the REST controllers into {@link ErrorResponse} bodies.
 * Every error is logged; no failure is answered with HTTP 200.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidConfiguration(
            InvalidConfigurationException ex, HttpServletRequest request) {
        log.warn("Invalid configuration on {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse.ErrorResponseBuilder builder = baseResponse(ex, HttpStatus.BAD_REQUEST, request);
        if (ex.getField() != null) {
            builder.fieldErrors(List.of(ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()));
        }
        return ResponseEntity.badRequest().body(builder.build());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        log.warn("{} not found: {}", ex.getResourceType(), ex.getResourceId());

        ErrorResponse response = baseResponse(ex, HttpStatus.NOT_FOUND, request)
                .metadata(Map.of(
                        "resourceType", ex.getResourceType(),
                        "resourceId", ex.getResourceId()))
                .build();
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(IllegalTransitionException.class)
    public ResponseEntity<ErrorResponse> handleIllegalTransition(
            IllegalTransitionException ex, HttpServletRequest request) {
        log.warn("Rejected {} on deployment {}: state is {}",
                ex.getOperation(), ex.getDeploymentId(), ex.getCurrentState());

        ErrorResponse response = baseResponse(ex, HttpStatus.CONFLICT, request)
                .metadata(Map.of(
                        "deploymentId", ex.getDeploymentId(),
                        "currentState", ex.getCurrentState(),
                        "operation", ex.getOperation()))
                .build();
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(CanaryException.class)
    public ResponseEntity<ErrorResponse> handleCanaryException(
            CanaryException ex, HttpServletRequest request) {
        HttpStatus status = ex.isFatal() ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.BAD_REQUEST;
        if (ex.isFatal()) {
            log.error("Canary error {} on {}: {}", ex.getErrorCode().getCode(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("Canary error {} on {}: {}", ex.getErrorCode().getCode(), request.getRequestURI(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(baseResponse(ex, status, request).build());
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLocking(
            OptimisticLockingFailureException ex, HttpServletRequest request) {
        log.warn("Optimistic locking failure on {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse response = ErrorResponse.builder()
                .code(ErrorCode.OPTIMISTIC_LOCK_FAILURE.getCode())
                .message("Deployment was modified by another request. Please retry.")
                .fatal(false)
                .status(HttpStatus.CONFLICT.value())
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Invalid request body on {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse response = ErrorResponse.builder()
                .code(ErrorCode.INVALID_REQUEST.getCode())
                .message("Invalid request body")
                .detail(ex.getMostSpecificCause().getMessage())
                .fatal(false)
                .status(HttpStatus.BAD_REQUEST.value())
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);

        ErrorResponse response = ErrorResponse.builder()
                .code(ErrorCode.INTERNAL_ERROR.getCode())
                .message(ErrorCode.INTERNAL_ERROR.getDefaultMessage())
                .detail(ex.getMessage())
                .fatal(true)
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private ErrorResponse.ErrorResponseBuilder baseResponse(CanaryException ex, HttpStatus status,
                                                            HttpServletRequest request) {
        return ErrorResponse.builder()
                .code(ex.getErrorCode().getCode())
                .message(ex.getMessage())
                .fatal(ex.isFatal())
                .status(status.value())
                .timestamp(Instant.now())
                .path(request.getRequestURI());
    }
}
