package com.platform.resourcecontroller.lateinit.hook;

import com.platform.resourcecontroller.lateinit.merge.MergeResult;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ObservedRecord;
import com.platform.resourcecontroller.resource.SourceMethod;

import java.util.Map;

/**
 * Runs before any field is copied. Receives the unchanged, error-free seed
 * and returns the seed the field rules continue from. A fatal error in the
 * returned seed ends the pass before any rule runs.
 */
@FunctionalInterface
public interface PreMergeHook {
    
    MergeResult beforeMerge(DesiredRecord desired, Map<SourceMethod, ObservedRecord> observations, MergeResult seed);
}
