package com.platform.resourcecontroller.fieldpath;

/**
 * One step of a {@link FieldPath}: a struct member, optionally followed by a
 * single map-key selector ({@code member[key]}).
 */
public record PathSegment(String member, String mapKey) {
    
    public boolean hasMapKey() {
        return mapKey != null;
    }
    
    @Override
    public String toString() {
        return hasMapKey() ? member + "[" + mapKey + "]" : member;
    }
}
