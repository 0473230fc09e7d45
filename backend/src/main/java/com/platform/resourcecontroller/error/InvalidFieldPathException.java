package com.platform.resourcecontroller.error;

/**
 * A field path expression could not be parsed.
 */
public class InvalidFieldPathException extends ConfigValidationException {
    
    private final String expression;
    
    public InvalidFieldPathException(String expression, String reason) {
        super(ErrorCode.INVALID_FIELD_PATH, null,
            String.format("Malformed field path '%s': %s", expression, reason));
        this.expression = expression;
    }
    
    public String getExpression() {
        return expression;
    }
}
