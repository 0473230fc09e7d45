package com.platform.resourcecontroller.lateinit.hook;

/**
 * Resource-type level hooks. {@code overrideAll} is mutually exclusive with
 * {@code pre} and {@code post}; the ruleset loader enforces this.
 */
public record MergeHooks(
    NamedHook<MergeOverrideHook> overrideAll,
    NamedHook<PreMergeHook> pre,
    NamedHook<PostMergeHook> post
) {
    
    private static final MergeHooks NONE = new MergeHooks(null, null, null);
    
    public static MergeHooks none() {
        return NONE;
    }
    
    public boolean isEmpty() {
        return overrideAll == null && pre == null && post == null;
    }
}
