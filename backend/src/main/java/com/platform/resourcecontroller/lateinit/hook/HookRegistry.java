package com.platform.resourcecontroller.lateinit.hook;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Lookup of hook strategies by bean name.
 */
@Slf4j
public class HookRegistry {
    
    private final Map<String, MergeOverrideHook> overrideHooks;
    private final Map<String, PreMergeHook> preHooks;
    private final Map<String, PostMergeHook> postHooks;
    private final Map<String, FieldMergeHook> fieldHooks;
    
    public HookRegistry(
            Map<String, MergeOverrideHook> overrideHooks,
            Map<String, PreMergeHook> preHooks,
            Map<String, PostMergeHook> postHooks,
            Map<String, FieldMergeHook> fieldHooks) {
        this.overrideHooks = Map.copyOf(overrideHooks);
        this.preHooks = Map.copyOf(preHooks);
        this.postHooks = Map.copyOf(postHooks);
        this.fieldHooks = Map.copyOf(fieldHooks);
        
        log.info("Hook registry initialized: {} override, {} pre, {} post, {} field hooks",
            overrideHooks.size(), preHooks.size(), postHooks.size(), fieldHooks.size());
    }
    
    public static HookRegistry empty() {
        return new HookRegistry(Map.of(), Map.of(), Map.of(), Map.of());
    }
    
    public Optional<NamedHook<MergeOverrideHook>> overrideHook(String name) {
        return named(name, overrideHooks);
    }
    
    public Optional<NamedHook<PreMergeHook>> preHook(String name) {
        return named(name, preHooks);
    }
    
    public Optional<NamedHook<PostMergeHook>> postHook(String name) {
        return named(name, postHooks);
    }
    
    public Optional<NamedHook<FieldMergeHook>> fieldHook(String name) {
        return named(name, fieldHooks);
    }
    
    private static <T> Optional<NamedHook<T>> named(String name, Map<String, T> hooks) {
        return Optional.ofNullable(hooks.get(name)).map(hook -> new NamedHook<>(name, hook));
    }
}
