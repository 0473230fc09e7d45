package com.platform.resourcecontroller.error;

/**
 * Standardized error codes for the resource controller.
 *
 * Format: RC-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 2xx: Configuration errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: System errors (database, owning system)
 * - 5xx: Late-initialization errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    VALIDATION_ERROR("RC-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("RC-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("RC-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    RESERVED_ANNOTATION("RC-105", "Annotation is managed by the controller", ErrorCategory.RECOVERABLE),

    // ==================== Configuration Errors (2xx) ====================

    CONFIG_VALIDATION_FAILED("RC-200", "Late-initialization configuration is invalid", ErrorCategory.FATAL),
    INVALID_FIELD_PATH("RC-201", "Malformed field path", ErrorCategory.FATAL),

    // ==================== Resource Errors (3xx) ====================

    RESOURCE_NOT_FOUND("RC-300", "Resource not found", ErrorCategory.RECOVERABLE),
    OPTIMISTIC_LOCK_FAILURE("RC-312", "Concurrent modification", ErrorCategory.RECOVERABLE),

    // ==================== System Errors (4xx) ====================

    DATABASE_ERROR("RC-400", "Database error", ErrorCategory.FATAL),
    OWNING_SYSTEM_ERROR("RC-440", "Owning system call failed", ErrorCategory.RECOVERABLE),
    NO_RESOURCE_CLIENT("RC-441", "No client registered for resource type", ErrorCategory.FATAL),

    // ==================== Late-initialization Errors (5xx) ====================

    UNSUPPORTED_PATH_KIND("RC-500", "Field path addresses an unsupported kind", ErrorCategory.FATAL),
    TYPE_MISMATCH("RC-501", "Value does not match the declared field type", ErrorCategory.FATAL),
    MERGE_FAILED("RC-502", "Late-initialization merge failed", ErrorCategory.FATAL),
    NOT_YET_AVAILABLE("RC-503", "Late-initialized value not yet available", ErrorCategory.RECOVERABLE),
    HOOK_FAILED("RC-504", "Late-initialization hook failed", ErrorCategory.FATAL),

    // ==================== Internal Errors (9xx) ====================

    UNEXPECTED_ERROR("RC-901", "Unexpected error occurred", ErrorCategory.FATAL);

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

    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - the next reconciliation pass may succeed.
         */
        RECOVERABLE,

        /**
         * Fatal errors - configuration or data must change before a retry can help.
         */
        FATAL
    }
}
