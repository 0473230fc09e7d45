package com.platform.resourcecontroller.fieldpath;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Declared type of a schema field.
 */
public enum FieldType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    OBJECT,
    MAP,
    LIST;
    
    /**
     * Whether a JSON value has a shape this type can hold.
     */
    public boolean accepts(JsonNode value) {
        return switch (this) {
            case STRING -> value.isTextual();
            case INTEGER -> value.isIntegralNumber();
            case NUMBER -> value.isNumber();
            case BOOLEAN -> value.isBoolean();
            case OBJECT, MAP -> value.isObject();
            case LIST -> value.isArray();
        };
    }
    
    public static FieldType fromConfig(String value) {
        return FieldType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
    
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
