package com.platform.resourcecontroller.error;

/**
 * Raised while loading late-initialization rulesets. Always fatal: the
 * application refuses to start with an invalid ruleset.
 */
public class ConfigValidationException extends ResourceControllerException {
    
    private final String resourceType;
    
    public ConfigValidationException(String resourceType, String message) {
        super(ErrorCode.CONFIG_VALIDATION_FAILED, format(resourceType, message));
        this.resourceType = resourceType;
    }
    
    public ConfigValidationException(String resourceType, String message, Throwable cause) {
        super(ErrorCode.CONFIG_VALIDATION_FAILED, format(resourceType, message), cause);
        this.resourceType = resourceType;
    }
    
    protected ConfigValidationException(ErrorCode errorCode, String resourceType, String message) {
        super(errorCode, format(resourceType, message));
        this.resourceType = resourceType;
    }
    
    private static String format(String resourceType, String message) {
        return resourceType == null ? message : String.format("[%s] %s", resourceType, message);
    }
    
    public String getResourceType() {
        return resourceType;
    }
}
