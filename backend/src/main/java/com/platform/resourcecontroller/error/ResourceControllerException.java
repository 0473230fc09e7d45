package com.platform.resourcecontroller.error;

/**
 * Base exception for all resource controller exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class ResourceControllerException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected ResourceControllerException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected ResourceControllerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected ResourceControllerException(ErrorCode errorCode, String message, Throwable cause) {
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
