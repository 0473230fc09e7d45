package com.platform.resourcecontroller.lateinit.hook;

import com.platform.resourcecontroller.lateinit.merge.MergeResult;
import com.platform.resourcecontroller.lateinit.ruleset.Ruleset;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ObservedRecord;
import com.platform.resourcecontroller.resource.SourceMethod;

import java.util.Map;

/**
 * Replaces the generic field-copying merge for a resource type entirely.
 * Registered as a Spring bean and referenced by bean name from
 * {@code hooks.override-all}.
 */
@FunctionalInterface
public interface MergeOverrideHook {
    
    MergeResult merge(DesiredRecord desired, Map<SourceMethod, ObservedRecord> observations, Ruleset ruleset);
}
