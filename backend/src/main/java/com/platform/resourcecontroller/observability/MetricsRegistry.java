package com.platform.resourcecontroller.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for reconciliation and late-initialization metrics.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicInteger> gaugeValues;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.gaugeValues = new ConcurrentHashMap<>();
    }
    
    /**
     * Record the outcome of one merge: changed, unchanged, pending or failed.
     */
    public void recordMergeOutcome(String resourceType, String outcome) {
        incrementCounter("resourcecontroller.lateinit.merge", "type", resourceType, "outcome", outcome);
    }
    
    /**
     * Count spec members that a merge filled in.
     */
    public void recordFieldsInitialized(String resourceType, int count) {
        if (count <= 0) {
            return;
        }
        String key = "resourcecontroller.lateinit.fields.initialized:" + resourceType;
        counters.computeIfAbsent(key, k ->
            Counter.builder("resourcecontroller.lateinit.fields.initialized")
                .tag("type", resourceType)
                .register(meterRegistry))
            .increment(count);
    }
    
    /**
     * Record a resource entering the late-initialization pending state.
     */
    public void recordPendingMarked(String resourceType) {
        incrementCounter("resourcecontroller.lateinit.pending.marked", "type", resourceType);
        pendingGauge(resourceType).incrementAndGet();
    }
    
    /**
     * Record a resource leaving the late-initialization pending state.
     */
    public void recordPendingCleared(String resourceType) {
        incrementCounter("resourcecontroller.lateinit.pending.cleared", "type", resourceType);
        pendingGauge(resourceType).updateAndGet(v -> Math.max(0, v - 1));
    }
    
    /**
     * Record a requeue decision and its delay.
     */
    public void recordRequeue(String resourceType, String reason, long delayMs) {
        incrementCounter("resourcecontroller.reconcile.requeue", "type", resourceType, "reason", reason);
        recordLatency(resourceType, "requeue_delay", delayMs);
    }
    
    /**
     * Record which parts of a record were persisted after a pass.
     */
    public void recordPatchPlan(String resourceType, String plan) {
        incrementCounter("resourcecontroller.reconcile.patch", "type", resourceType, "plan", plan);
    }
    
    /**
     * Record a failed reconciliation pass.
     */
    public void recordPassFailure(String resourceType, String errorCode) {
        incrementCounter("resourcecontroller.reconcile.failure", "type", resourceType, "code", errorCode);
    }
    
    /**
     * Record latency for an operation.
     */
    public void recordLatency(String resourceType, String operation, long latencyMs) {
        String timerKey = resourceType + "." + operation;
        Timer timer = timers.computeIfAbsent(timerKey, k -> 
            Timer.builder("resourcecontroller.operation.latency")
                .tag("type", resourceType)
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        
        timer.record(Duration.ofMillis(latencyMs));
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Current number of resources this process marked pending and has not cleared.
     */
    public int getPendingCount(String resourceType) {
        AtomicInteger value = gaugeValues.get(resourceType + ".pending");
        return value != null ? value.get() : 0;
    }
    
    private AtomicInteger pendingGauge(String resourceType) {
        return gaugeValues.computeIfAbsent(resourceType + ".pending", k -> {
            AtomicInteger value = new AtomicInteger(0);
            Gauge.builder("resourcecontroller.lateinit.pending", value, AtomicInteger::get)
                .tag("type", resourceType)
                .register(meterRegistry);
            log.debug("Registered pending gauge for {}", resourceType);
            return value;
        });
    }
}
