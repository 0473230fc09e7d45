package com.platform.resourcecontroller.reconciliation;

import com.platform.resourcecontroller.resource.ResourceIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Requeue delays for failed reconciliation passes: exponential backoff with
 * jitter, bounded by a maximum number of consecutive attempts per resource.
 * Once attempts are exhausted the resource waits for the next resync.
 */
@Slf4j
@Component
public class RetryEngine {
    
    private final Map<ResourceIdentity, AtomicInteger> retryCounters = new ConcurrentHashMap<>();
    
    @Value("${resource-controller.retry.max-attempts:5}")
    private int maxAttempts;
    
    @Value("${resource-controller.retry.initial-delay-ms:1000}")
    private long initialDelayMs;
    
    @Value("${resource-controller.retry.max-delay-ms:30000}")
    private long maxDelayMs;
    
    @Value("${resource-controller.retry.multiplier:2.0}")
    private double multiplier;
    
    @Value("${resource-controller.retry.jitter-factor:0.1}")
    private double jitterFactor;
    
    /**
     * Counts a failed pass and returns the delay before the next one, or
     * empty if the resource has used up its attempts.
     */
    public Optional<Duration> nextDelay(ResourceIdentity identity) {
        int attempt = retryCounters.computeIfAbsent(identity, k -> new AtomicInteger(0)).incrementAndGet();
        if (attempt > maxAttempts) {
            log.warn("{} failed {} consecutive passes; waiting for resync", identity, attempt);
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(calculateDelay(attempt)));
    }
    
    public int getRetryCount(ResourceIdentity identity) {
        AtomicInteger counter = retryCounters.get(identity);
        return counter != null ? counter.get() : 0;
    }
    
    public void reset(ResourceIdentity identity) {
        if (retryCounters.remove(identity) != null) {
            log.debug("Reset retry count for {}", identity);
        }
    }
    
    /**
     * Calculate delay with exponential backoff and jitter.
     */
    private long calculateDelay(int attempt) {
        double exponentialDelay = initialDelayMs * Math.pow(multiplier, attempt - 1);
        long baseDelay = Math.min((long) exponentialDelay, maxDelayMs);
        
        long jitter = (long) (baseDelay * jitterFactor * ThreadLocalRandom.current().nextDouble());
        
        // Randomly add or subtract jitter
        if (ThreadLocalRandom.current().nextBoolean()) {
            return Math.min(maxDelayMs, baseDelay + jitter);
        } else {
            return Math.max(initialDelayMs, baseDelay - jitter);
        }
    }
}
