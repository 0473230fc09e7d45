package com.platform.resourcecontroller.lateinit.patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.resourcecontroller.resource.DesiredRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides what to write back after a pass, so that unchanged records cause
 * no write and status-only changes do not touch the spec.
 */
@Slf4j
@Component
public class PatchDecider {
    
    /**
     * @param before the record as persisted when the pass started
     * @param after the record after operations and merge
     * @param specMutatedByOperation whether the create or update call itself
     *     populated spec fields
     */
    public PatchPlan decide(DesiredRecord before, DesiredRecord after, boolean specMutatedByOperation) {
        List<String> specChanges = changedFields(before.getSpec(), after.getSpec());
        
        if (!specChanges.isEmpty() || specMutatedByOperation) {
            log.debug("Spec of {} changed (fields {}, mutated by operation: {})",
                after.getIdentity(), specChanges, specMutatedByOperation);
            return PatchPlan.SPEC_AND_STATUS;
        }
        if (!changedFields(before.getStatus(), after.getStatus()).isEmpty()) {
            return PatchPlan.STATUS_ONLY;
        }
        return PatchPlan.NONE;
    }
    
    /**
     * Top-level members whose values differ. A JSON null and a missing member
     * are treated as equal.
     */
    public static List<String> changedFields(ObjectNode before, ObjectNode after) {
        Set<String> names = new LinkedHashSet<>();
        before.fieldNames().forEachRemaining(names::add);
        after.fieldNames().forEachRemaining(names::add);
        
        List<String> changed = new ArrayList<>();
        for (String name : names) {
            if (!sameValue(before.get(name), after.get(name))) {
                changed.add(name);
            }
        }
        return changed;
    }
    
    private static boolean sameValue(JsonNode a, JsonNode b) {
        boolean aAbsent = a == null || a.isNull();
        boolean bAbsent = b == null || b.isNull();
        if (aAbsent || bAbsent) {
            return aAbsent && bAbsent;
        }
        return a.equals(b);
    }
}
