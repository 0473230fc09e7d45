package com.platform.resourcecontroller.resource;

import java.util.Locale;

/**
 * Owning-system operation whose output a late-initialized value is taken from.
 */
public enum SourceMethod {
    READ,
    CREATE,
    UPDATE;
    
    /**
     * Parses a configuration value such as {@code read} or {@code Create}.
     *
     * @throws IllegalArgumentException if the value names no known operation
     */
    public static SourceMethod fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Source method must not be blank");
        }
        return SourceMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
    
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
