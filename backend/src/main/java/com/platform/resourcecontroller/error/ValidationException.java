package com.platform.resourcecontroller.error;

/**
 * Exception for request validation errors.
 */
public class ValidationException extends ResourceControllerException {
    
    private final String field;
    
    public ValidationException(ErrorCode errorCode, String field, String message) {
        super(errorCode, 
            String.format("Invalid value for field '%s': %s", field, message));
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
