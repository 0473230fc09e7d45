package com.platform.resourcecontroller.lateinit.merge;

import com.platform.resourcecontroller.error.NotYetAvailableException;
import com.platform.resourcecontroller.error.ResourceControllerException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one merge invocation.
 * <ul>
 *   <li>{@code changed} obligates a spec patch.</li>
 *   <li>A {@link NotYetAvailableException} error obligates the pending marker and a requeue.</li>
 *   <li>Any other error is fatal for the pass.</li>
 * </ul>
 */
public final class MergeResult {
    
    private static final MergeResult UNCHANGED = new MergeResult(false, null);
    private static final MergeResult CHANGED = new MergeResult(true, null);
    
    private final boolean changed;
    private final ResourceControllerException error;
    
    private MergeResult(boolean changed, ResourceControllerException error) {
        this.changed = changed;
        this.error = error;
    }
    
    public static MergeResult unchanged() {
        return UNCHANGED;
    }
    
    public static MergeResult changed() {
        return CHANGED;
    }
    
    public static MergeResult of(boolean changed) {
        return changed ? CHANGED : UNCHANGED;
    }
    
    public static MergeResult of(boolean changed, ResourceControllerException error) {
        return error == null ? of(changed) : new MergeResult(changed, error);
    }
    
    public static MergeResult notYetAvailable(NotYetAvailableException error) {
        return new MergeResult(false, Objects.requireNonNull(error, "error"));
    }
    
    public static MergeResult failed(ResourceControllerException error) {
        return new MergeResult(false, Objects.requireNonNull(error, "error"));
    }
    
    public boolean isChanged() {
        return changed;
    }
    
    public Optional<ResourceControllerException> getError() {
        return Optional.ofNullable(error);
    }
    
    public boolean isNotYetAvailable() {
        return error instanceof NotYetAvailableException;
    }
    
    public boolean isFatal() {
        return error != null && !(error instanceof NotYetAvailableException);
    }
    
    public boolean isSuccess() {
        return error == null;
    }
    
    public MergeResult withChanged(boolean newChanged) {
        return of(newChanged, error);
    }
    
    /**
     * OR-combines {@code changed}. A fatal error outranks "not yet available";
     * otherwise the first error is kept.
     */
    public MergeResult combine(MergeResult other) {
        ResourceControllerException combinedError = error;
        if (combinedError == null || (!isFatal() && other.isFatal())) {
            combinedError = other.error != null ? other.error : error;
        }
        return of(changed || other.changed, combinedError);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MergeResult other && changed == other.changed && Objects.equals(error, other.error);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(changed, error);
    }
    
    @Override
    public String toString() {
        return "MergeResult{changed=" + changed + (error != null ? ", error=" + error.getErrorCode().getCode() : "") + "}";
    }
}
