package com.platform.resourcecontroller.lateinit.hook;

import com.platform.resourcecontroller.fieldpath.FieldPathResolver;
import com.platform.resourcecontroller.lateinit.merge.MergeResult;
import com.platform.resourcecontroller.lateinit.ruleset.FieldRule;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ObservedRecord;

/**
 * Custom merge for a single field rule, bound through the rule's
 * {@code override-hook}. Runs instead of the absent-only copy for that field;
 * its result is OR-combined with the rest of the pass.
 */
@FunctionalInterface
public interface FieldMergeHook {
    
    MergeResult mergeField(DesiredRecord desired, ObservedRecord observation, FieldRule rule, FieldPathResolver resolver);
}
