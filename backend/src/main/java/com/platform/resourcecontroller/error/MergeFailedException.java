package com.platform.resourcecontroller.error;

/**
 * Fatal failure of a late-initialization merge pass. The desired record the
 * pass worked on may be partially mutated and must not be persisted.
 */
public class MergeFailedException extends ResourceControllerException {
    
    private final String resourceType;
    private final String path;
    
    public MergeFailedException(String resourceType, String path, Throwable cause) {
        super(ErrorCode.MERGE_FAILED,
            String.format("Late-initialization of '%s' failed for %s: %s",
                path, resourceType, cause.getMessage()),
            cause);
        this.resourceType = resourceType;
        this.path = path;
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getPath() {
        return path;
    }
}
