package com.platform.resourcecontroller.lateinit.tracker;

import com.platform.resourcecontroller.lateinit.merge.MergeResult;
import com.platform.resourcecontroller.lateinit.ruleset.BackoffSettings;
import com.platform.resourcecontroller.lateinit.ruleset.RulesetRegistry;
import com.platform.resourcecontroller.observability.MetricsRegistry;
import com.platform.resourcecontroller.persistence.DesiredRecordStore;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ResourceIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

/**
 * Owns the lifecycle of the late-initialization pending marker.
 * <p>
 * The marker is an annotation on the persisted record, so it survives
 * worker and process restarts. The consecutive-pending counter that drives
 * the backoff is in memory only and restarts from the minimum backoff.
 */
@Slf4j
@Component
public class CompletionTracker {
    
    /**
     * Annotation whose presence means late-initialization is pending.
     */
    public static final String PENDING_ANNOTATION = "lateinit.resourcecontroller.io/pending";
    
    private static final String PENDING_VALUE = "true";
    
    private final DesiredRecordStore store;
    private final RulesetRegistry rulesetRegistry;
    private final MetricsRegistry metricsRegistry;
    private final DoubleSupplier jitterSource;
    private final Map<ResourceIdentity, AtomicInteger> pendingAttempts = new ConcurrentHashMap<>();
    
    @Autowired
    public CompletionTracker(DesiredRecordStore store, RulesetRegistry rulesetRegistry, MetricsRegistry metricsRegistry) {
        this(store, rulesetRegistry, metricsRegistry, () -> ThreadLocalRandom.current().nextDouble());
    }
    
    CompletionTracker(
            DesiredRecordStore store,
            RulesetRegistry rulesetRegistry,
            MetricsRegistry metricsRegistry,
            DoubleSupplier jitterSource) {
        this.store = store;
        this.rulesetRegistry = rulesetRegistry;
        this.metricsRegistry = metricsRegistry;
        this.jitterSource = jitterSource;
    }
    
    /**
     * Decides the follow-up of a merge. A pending result marks both the
     * persisted record and {@code resource} right away; a completed one only
     * unmarks {@code resource}, and the caller persists that through
     * {@link #commitCleared} after its own writes.
     */
    public TrackerAction onMergeResult(DesiredRecord resource, MergeResult result) {
        ResourceIdentity identity = resource.getIdentity();
        boolean marked = isPending(resource);
        
        if (result.isNotYetAvailable()) {
            if (!marked) {
                store.setAnnotation(identity, PENDING_ANNOTATION, PENDING_VALUE);
                resource.putAnnotation(PENDING_ANNOTATION, PENDING_VALUE);
                metricsRegistry.recordPendingMarked(identity.resourceType());
                log.info("Late-initialization pending for {}: {}",
                    identity, result.getError().map(Throwable::getMessage).orElse(""));
            }
            
            int attempt = pendingAttempts.computeIfAbsent(identity, k -> new AtomicInteger()).incrementAndGet();
            BackoffSettings backoff = rulesetRegistry.forResourceType(identity.resourceType()).getBackoff();
            Duration delay = backoff.delayFor(attempt, jitterSource.getAsDouble());
            log.debug("Requeueing {} in {}ms (pending attempt {})", identity, delay.toMillis(), attempt);
            return TrackerAction.markPendingAndRequeue(delay);
        }
        
        if (result.isSuccess() && marked) {
            resource.removeAnnotation(PENDING_ANNOTATION);
            return TrackerAction.clearPendingAndContinue();
        }
        
        if (result.isSuccess()) {
            pendingAttempts.remove(identity);
        }
        return TrackerAction.noOp();
    }
    
    /**
     * Removes the persisted marker once the values the clearing merge
     * produced have been written. Until then the marker stays, so a pass
     * that fails to persist is still reported as pending.
     */
    public DesiredRecord commitCleared(ResourceIdentity identity) {
        DesiredRecord stored = store.removeAnnotation(identity, PENDING_ANNOTATION);
        pendingAttempts.remove(identity);
        metricsRegistry.recordPendingCleared(identity.resourceType());
        log.info("Late-initialization completed for {}", identity);
        return stored;
    }
    
    public static boolean isPending(DesiredRecord resource) {
        return resource.hasAnnotation(PENDING_ANNOTATION);
    }
    
    /**
     * Forgets in-memory backoff state, e.g. when a resource is deleted.
     */
    public void forget(ResourceIdentity identity) {
        pendingAttempts.remove(identity);
    }
    
    int pendingAttempts(ResourceIdentity identity) {
        AtomicInteger attempts = pendingAttempts.get(identity);
        return attempts != null ? attempts.get() : 0;
    }
}
