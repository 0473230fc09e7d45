package com.platform.resourcecontroller.fieldpath;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of reading a field path: the value and whether it is present.
 * JSON null counts as absent.
 */
public record FieldValue(JsonNode value, boolean present) {
    
    private static final FieldValue ABSENT = new FieldValue(null, false);
    
    public static FieldValue absent() {
        return ABSENT;
    }
    
    public static FieldValue of(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode() ? ABSENT : new FieldValue(value, true);
    }
}
