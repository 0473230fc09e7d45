package com.platform.resourcecontroller.lateinit.ruleset;

import com.platform.resourcecontroller.fieldpath.FieldPathResolver;
import com.platform.resourcecontroller.lateinit.hook.MergeHooks;
import com.platform.resourcecontroller.resource.SourceMethod;
import lombok.Builder;
import lombok.Getter;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable late-initialization rules of one resource type. Built once at
 * startup and shared read-only by every reconciliation of that type.
 */
@Getter
public final class Ruleset {
    
    private final String resourceType;
    private final List<FieldRule> rules;
    private final Set<SourceMethod> supportedOperations;
    private final SourceMethod defaultSourceMethod;
    private final MergeHooks hooks;
    private final FieldPathResolver resolver;
    private final BackoffSettings backoff;
    
    @Builder
    private Ruleset(
            String resourceType,
            List<FieldRule> rules,
            Set<SourceMethod> supportedOperations,
            SourceMethod defaultSourceMethod,
            MergeHooks hooks,
            FieldPathResolver resolver,
            BackoffSettings backoff) {
        this.resourceType = resourceType;
        this.rules = rules != null ? List.copyOf(rules) : List.of();
        this.supportedOperations = supportedOperations != null && !supportedOperations.isEmpty()
            ? Set.copyOf(EnumSet.copyOf(supportedOperations))
            : Set.of(SourceMethod.values());
        this.defaultSourceMethod = defaultSourceMethod != null ? defaultSourceMethod : SourceMethod.READ;
        this.hooks = hooks != null ? hooks : MergeHooks.none();
        this.resolver = resolver != null ? resolver : FieldPathResolver.untyped();
        this.backoff = backoff != null ? backoff : BackoffSettings.DEFAULT;
    }
    
    /**
     * Ruleset of a type with no late-initialized fields and no hooks.
     */
    public static Ruleset empty(String resourceType, SourceMethod defaultSourceMethod, BackoffSettings backoff) {
        return Ruleset.builder()
            .resourceType(resourceType)
            .defaultSourceMethod(defaultSourceMethod)
            .backoff(backoff)
            .build();
    }
    
    public boolean isNoOp() {
        return rules.isEmpty() && hooks.isEmpty();
    }
    
    public boolean supports(SourceMethod method) {
        return supportedOperations.contains(method);
    }
    
    @Override
    public String toString() {
        return "Ruleset{" + resourceType + ", rules=" + rules.size() + ", hooks=" + !hooks.isEmpty() + "}";
    }
}
