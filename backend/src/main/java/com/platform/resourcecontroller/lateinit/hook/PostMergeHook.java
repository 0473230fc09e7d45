package com.platform.resourcecontroller.lateinit.hook;

import com.platform.resourcecontroller.lateinit.merge.MergeResult;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ObservedRecord;
import com.platform.resourcecontroller.resource.SourceMethod;

import java.util.Map;

/**
 * Runs after the field rules, before the result is returned. The returned
 * value replaces the computed result, so a hook may raise or drop either
 * {@code changed} or the error.
 */
@FunctionalInterface
public interface PostMergeHook {
    
    MergeResult afterMerge(DesiredRecord desired, Map<SourceMethod, ObservedRecord> observations, MergeResult computed);
}
