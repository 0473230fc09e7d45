package com.platform.resourcecontroller.lateinit.hook;

import java.util.Objects;

/**
 * A hook strategy together with the bean name it was configured under.
 */
public record NamedHook<T>(String name, T hook) {
    
    public NamedHook {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(hook, "hook");
    }
}
