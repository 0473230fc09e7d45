package com.platform.resourcecontroller.error;

/**
 * A late-initialization hook raised an error other than {@link NotYetAvailableException}.
 */
public class HookFailedException extends ResourceControllerException {
    
    private final String hookName;
    
    public HookFailedException(String hookName, Throwable cause) {
        super(ErrorCode.HOOK_FAILED,
            String.format("Hook '%s' failed: %s", hookName, cause.getMessage()),
            cause);
        this.hookName = hookName;
    }
    
    public String getHookName() {
        return hookName;
    }
}
