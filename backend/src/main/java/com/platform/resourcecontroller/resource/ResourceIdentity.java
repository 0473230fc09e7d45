package com.platform.resourcecontroller.resource;

import java.util.Objects;

/**
 * Identity of one managed resource: its type and its name within that type.
 */
public record ResourceIdentity(String resourceType, String name) {
    
    public ResourceIdentity {
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(name, "name");
    }
    
    public static ResourceIdentity of(String resourceType, String name) {
        return new ResourceIdentity(resourceType, name);
    }
    
    /**
     * Parses the {@code type/name} form produced by {@link #key()}.
     */
    public static ResourceIdentity parse(String key) {
        int slash = key.indexOf('/');
        if (slash <= 0 || slash == key.length() - 1) {
            throw new IllegalArgumentException("Expected 'type/name' but got: " + key);
        }
        return new ResourceIdentity(key.substring(0, slash), key.substring(slash + 1));
    }
    
    public String key() {
        return resourceType + "/" + name;
    }
    
    @Override
    public String toString() {
        return key();
    }
}
