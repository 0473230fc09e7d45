package com.platform.resourcecontroller.lateinit.tracker;

import java.time.Duration;
import java.util.Objects;

/**
 * What the orchestrator must do after a merge, as decided by the
 * {@link CompletionTracker}.
 */
public record TrackerAction(Kind kind, Duration backoff) {
    
    public enum Kind {
        NO_OP,
        MARK_PENDING_AND_REQUEUE,
        CLEAR_PENDING_AND_CONTINUE
    }
    
    private static final TrackerAction NO_OP = new TrackerAction(Kind.NO_OP, Duration.ZERO);
    private static final TrackerAction CLEAR = new TrackerAction(Kind.CLEAR_PENDING_AND_CONTINUE, Duration.ZERO);
    
    public TrackerAction {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(backoff, "backoff");
    }
    
    public static TrackerAction noOp() {
        return NO_OP;
    }
    
    public static TrackerAction markPendingAndRequeue(Duration backoff) {
        return new TrackerAction(Kind.MARK_PENDING_AND_REQUEUE, backoff);
    }
    
    public static TrackerAction clearPendingAndContinue() {
        return CLEAR;
    }
    
    public boolean requiresRequeue() {
        return kind == Kind.MARK_PENDING_AND_REQUEUE;
    }
}
