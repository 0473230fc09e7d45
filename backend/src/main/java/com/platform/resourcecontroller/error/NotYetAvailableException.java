package com.platform.resourcecontroller.error;

/**
 * Signals that the owning system has not yet populated a late-initialized
 * value. Recoverable: drives the pending marker and a requeue, never a
 * user-visible failure.
 */
public class NotYetAvailableException extends ResourceControllerException {
    
    public NotYetAvailableException(String message) {
        super(ErrorCode.NOT_YET_AVAILABLE, message);
    }
    
    public static NotYetAvailableException forField(String path) {
        return new NotYetAvailableException(
            String.format("Value for '%s' has not been populated by the owning system yet", path));
    }
}
