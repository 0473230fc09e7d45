package com.platform.resourcecontroller.error;

/**
 * A field path traverses a kind the resolver does not address, such as a list.
 */
public class UnsupportedPathKindException extends ResourceControllerException {
    
    private final String path;
    
    public UnsupportedPathKindException(String path, String message) {
        super(ErrorCode.UNSUPPORTED_PATH_KIND, String.format("Path '%s': %s", path, message));
        this.path = path;
    }
    
    public String getPath() {
        return path;
    }
}
