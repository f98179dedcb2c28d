package com.example.canarycontroller.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Standardized error body returned by every API error.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /** Unique error code (e.g., CC-301) */
    private String code;

    private String message;

    private String detail;

    /** Fatal errors need operator intervention; recoverable ones can be retried or fixed */
    private boolean fatal;

    private int status;

    private Instant timestamp;

    private String path;

    private List<FieldError> fieldErrors;

    private Map<String, Object> metadata;

    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
}
