package com.platform.resourcecontroller.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Standardized error response model.
 * All API errors return this structure for consistency.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Unique error code (e.g., RC-300).
     */
    private String code;
    
    private String message;
    
    /**
     * Detailed description for debugging.
     */
    private String detail;
    
    /**
     * Whether this error is fatal (requires intervention) or recoverable (can retry).
     */
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    private String path;
    
    /**
     * Trace ID for correlating with logs.
     */
    private String traceId;
    
    private List<FieldError> fieldErrors;
    
    private Map<String, Object> metadata;
    
    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
    }
}
