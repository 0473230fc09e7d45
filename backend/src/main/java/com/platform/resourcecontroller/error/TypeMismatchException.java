package com.platform.resourcecontroller.error;

/**
 * A value's shape does not fit the field it is written to.
 */
public class TypeMismatchException extends ResourceControllerException {
    
    private final String path;
    private final String expected;
    private final String actual;
    
    public TypeMismatchException(String path, String expected, String actual) {
        super(ErrorCode.TYPE_MISMATCH,
            String.format("Path '%s': expected %s but found %s", path, expected, actual));
        this.path = path;
        this.expected = expected;
        this.actual = actual;
    }
    
    public String getPath() {
        return path;
    }
    
    public String getExpected() {
        return expected;
    }
    
    public String getActual() {
        return actual;
    }
}
