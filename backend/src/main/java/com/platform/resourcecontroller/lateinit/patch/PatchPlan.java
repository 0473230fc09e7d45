package com.platform.resourcecontroller.lateinit.patch;

/**
 * Which parts of a desired record must be persisted after a pass.
 */
public enum PatchPlan {
    NONE,
    STATUS_ONLY,
    SPEC_AND_STATUS;
    
    public boolean writesStatus() {
        return this != NONE;
    }
    
    public boolean writesSpec() {
        return this == SPEC_AND_STATUS;
    }
}
