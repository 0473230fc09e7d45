package com.platform.resourcecontroller.error;

/**
 * Exception for failed calls into the system that owns a managed resource.
 */
public class OwningSystemException extends ResourceControllerException {
    
    private final String resourceType;
    private final String operation;
    
    public OwningSystemException(String resourceType, String operation, String message) {
        super(ErrorCode.OWNING_SYSTEM_ERROR, message);
        this.resourceType = resourceType;
        this.operation = operation;
    }
    
    public OwningSystemException(String resourceType, String operation, String message, Throwable cause) {
        super(ErrorCode.OWNING_SYSTEM_ERROR, message, cause);
        this.resourceType = resourceType;
        this.operation = operation;
    }
    
    private OwningSystemException(ErrorCode errorCode, String resourceType, String operation, String message) {
        super(errorCode, message);
        this.resourceType = resourceType;
        this.operation = operation;
    }
    
    public static OwningSystemException noClient(String resourceType) {
        return new OwningSystemException(ErrorCode.NO_RESOURCE_CLIENT, resourceType, "lookup",
            "No resource client registered for type " + resourceType);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getOperation() {
        return operation;
    }
}
