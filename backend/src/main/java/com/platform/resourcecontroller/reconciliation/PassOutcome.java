package com.platform.resourcecontroller.reconciliation;

import com.platform.resourcecontroller.lateinit.merge.MergeResult;
import com.platform.resourcecontroller.lateinit.patch.PatchPlan;
import com.platform.resourcecontroller.lateinit.tracker.TrackerAction;
import com.platform.resourcecontroller.resource.DesiredRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * Result of one successful reconciliation pass.
 *
 * @param record the record as persisted after the pass
 */
public record PassOutcome(
    DesiredRecord record,
    MergeResult mergeResult,
    TrackerAction trackerAction,
    PatchPlan patchPlan
) {
    
    public Optional<Duration> requeueAfter() {
        return trackerAction.requiresRequeue()
            ? Optional.of(trackerAction.backoff())
            : Optional.empty();
    }
}
