package com.platform.resourcecontroller.lateinit.ruleset;

import com.platform.resourcecontroller.fieldpath.FieldPath;
import com.platform.resourcecontroller.lateinit.hook.FieldMergeHook;
import com.platform.resourcecontroller.lateinit.hook.NamedHook;
import com.platform.resourcecontroller.resource.SourceMethod;

import java.util.Objects;

/**
 * One late-initialized field: where it lives, which operation's output it is
 * taken from, and an optional per-field hook replacing the absent-only copy.
 *
 * @param awaitValue when true, a pass whose source observation is present but
 *     still lacks the value reports "not yet available"
 */
public record FieldRule(
    FieldPath path,
    SourceMethod sourceMethod,
    NamedHook<FieldMergeHook> overrideHook,
    boolean awaitValue
) {
    
    public FieldRule {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(sourceMethod, "sourceMethod");
    }
    
    public static FieldRule of(String path, SourceMethod sourceMethod) {
        return new FieldRule(FieldPath.parse(path), sourceMethod, null, false);
    }
    
    public boolean hasOverrideHook() {
        return overrideHook != null;
    }
}
