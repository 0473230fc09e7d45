package com.platform.resourcecontroller.reconciliation;

import com.platform.resourcecontroller.resource.ResourceIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Work queue of resource identities.
 * <p>
 * An identity is handed to at most one worker at a time. Adding an identity
 * that is already waiting is a no-op; adding one that is being processed
 * marks it dirty, and it is queued again once the worker calls {@link #done}.
 */
@Slf4j
@Component
public class ReconcileQueue {
    
    private final TaskScheduler taskScheduler;
    private final BlockingQueue<ResourceIdentity> queue = new LinkedBlockingQueue<>();
    private final Set<ResourceIdentity> dirty = new HashSet<>();
    private final Set<ResourceIdentity> processing = new HashSet<>();
    private final Object lock = new Object();
    
    public ReconcileQueue(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }
    
    public void add(ResourceIdentity identity) {
        synchronized (lock) {
            if (!dirty.add(identity)) {
                return;
            }
            if (processing.contains(identity)) {
                log.debug("{} is in flight; it will be reconciled again when done", identity);
                return;
            }
            queue.add(identity);
        }
    }
    
    public void addAfter(ResourceIdentity identity, Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            add(identity);
            return;
        }
        taskScheduler.schedule(() -> add(identity), Instant.now().plus(delay));
    }
    
    /**
     * Waits up to the timeout for an identity and marks it as in flight.
     * Returns null on timeout.
     */
    public ResourceIdentity poll(long timeout, TimeUnit unit) throws InterruptedException {
        ResourceIdentity identity = queue.poll(timeout, unit);
        if (identity != null) {
            markProcessing(identity);
        }
        return identity;
    }
    
    /**
     * Releases an identity taken from the queue.
     */
    public void done(ResourceIdentity identity) {
        synchronized (lock) {
            processing.remove(identity);
            if (dirty.contains(identity)) {
                queue.add(identity);
            }
        }
    }
    
    public int size() {
        return queue.size();
    }
    
    public boolean isProcessing(ResourceIdentity identity) {
        synchronized (lock) {
            return processing.contains(identity);
        }
    }
    
    private void markProcessing(ResourceIdentity identity) {
        synchronized (lock) {
            processing.add(identity);
            dirty.remove(identity);
        }
    }
}
