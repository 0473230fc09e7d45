package com.platform.resourcecontroller.fieldpath;

import java.util.Map;

/**
 * Declaration of one schema field. {@code valueType} is set for maps only;
 * {@code members} is non-empty for declared struct members only.
 */
public record FieldDefinition(
    FieldType type,
    FieldType valueType,
    boolean required,
    Map<String, FieldDefinition> members
) {
    
    public FieldDefinition {
        members = members != null ? members : Map.of();
    }
    
    public static FieldDefinition of(FieldType type, boolean required) {
        return new FieldDefinition(type, null, required, Map.of());
    }
    
    /**
     * Definition of a single entry of this map field.
     */
    public FieldDefinition entryDefinition() {
        return new FieldDefinition(valueType, null, false, Map.of());
    }
    
    public String describe() {
        return type == FieldType.MAP && valueType != null
            ? "map<" + valueType.configName() + ">"
            : type.configName();
    }
}
