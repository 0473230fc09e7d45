package com.platform.resourcecontroller.lateinit.ruleset;

import com.platform.resourcecontroller.resource.SourceMethod;

import java.util.Map;
import java.util.Set;

/**
 * Read-only lookup of the loaded rulesets. Types without configuration get
 * a no-op ruleset, which makes the merge a pass-through.
 */
public class RulesetRegistry {
    
    private final Map<String, Ruleset> rulesets;
    private final SourceMethod defaultSourceMethod;
    private final BackoffSettings defaultBackoff;
    
    public RulesetRegistry(Map<String, Ruleset> rulesets, SourceMethod defaultSourceMethod, BackoffSettings defaultBackoff) {
        this.rulesets = Map.copyOf(rulesets);
        this.defaultSourceMethod = defaultSourceMethod;
        this.defaultBackoff = defaultBackoff;
    }
    
    public Ruleset forResourceType(String resourceType) {
        Ruleset ruleset = rulesets.get(resourceType);
        return ruleset != null ? ruleset : Ruleset.empty(resourceType, defaultSourceMethod, defaultBackoff);
    }
    
    public SourceMethod defaultSourceMethod() {
        return defaultSourceMethod;
    }
    
    public Set<String> configuredResourceTypes() {
        return rulesets.keySet();
    }
}
