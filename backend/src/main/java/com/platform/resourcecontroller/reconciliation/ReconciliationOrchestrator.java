package com.platform.resourcecontroller.reconciliation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.resourcecontroller.error.ErrorCode;
import com.platform.resourcecontroller.error.OwningSystemException;
import com.platform.resourcecontroller.error.ResourceControllerException;
import com.platform.resourcecontroller.error.ResourceNotFoundException;
import com.platform.resourcecontroller.lateinit.merge.MergeEngine;
import com.platform.resourcecontroller.lateinit.merge.MergeResult;
import com.platform.resourcecontroller.lateinit.patch.PatchDecider;
import com.platform.resourcecontroller.lateinit.patch.PatchPlan;
import com.platform.resourcecontroller.lateinit.ruleset.Ruleset;
import com.platform.resourcecontroller.lateinit.ruleset.RulesetRegistry;
import com.platform.resourcecontroller.lateinit.tracker.CompletionTracker;
import com.platform.resourcecontroller.lateinit.tracker.TrackerAction;
import com.platform.resourcecontroller.observability.LoggingConfig;
import com.platform.resourcecontroller.observability.MetricsRegistry;
import com.platform.resourcecontroller.persistence.DesiredRecordStore;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ObservedRecord;
import com.platform.resourcecontroller.resource.ResourceIdentity;
import com.platform.resourcecontroller.resource.SourceMethod;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Drives desired records toward the owning systems' state.
 * <p>
 * One pass over a resource: read it from the owning system, create or update
 * it as needed, merge late-initialized values from the observations, track
 * completion, then persist the minimal patch. Passes of the same identity
 * never overlap; the {@link ReconcileQueue} serializes them.
 */
@Slf4j
@Component
public class ReconciliationOrchestrator {

    private static final long POLL_TIMEOUT_MS = 500;

    private final DesiredRecordStore store;
    private final ResourceClientRegistry clientRegistry;
    private final RulesetRegistry rulesetRegistry;
    private final MergeEngine mergeEngine;
    private final CompletionTracker completionTracker;
    private final PatchDecider patchDecider;
    private final ReconcileQueue queue;
    private final RetryEngine retryEngine;
    private final MetricsRegistry metricsRegistry;

    @Value("${resource-controller.reconcile.enabled:true}")
    private boolean enabled;

    @Value("${resource-controller.reconcile.workers:2}")
    private int workers;

    private ExecutorService workerPool;
    private volatile boolean running;

    public ReconciliationOrchestrator(
            DesiredRecordStore store,
            ResourceClientRegistry clientRegistry,
            RulesetRegistry rulesetRegistry,
            MergeEngine mergeEngine,
            CompletionTracker completionTracker,
            PatchDecider patchDecider,
            ReconcileQueue queue,
            RetryEngine retryEngine,
            MetricsRegistry metricsRegistry) {
        this.store = store;
        this.clientRegistry = clientRegistry;
        this.rulesetRegistry = rulesetRegistry;
        this.mergeEngine = mergeEngine;
        this.completionTracker = completionTracker;
        this.patchDecider = patchDecider;
        this.queue = queue;
        this.retryEngine = retryEngine;
        this.metricsRegistry = metricsRegistry;
    }

    @PostConstruct
    public void start() {
        for (String resourceType : rulesetRegistry.configuredResourceTypes()) {
            if (!clientRegistry.resourceTypes().contains(resourceType)) {
                log.warn("[{}] Late-initialization rules are configured but no resource client serves the type",
                    resourceType);
            }
        }
        if (!enabled) {
            log.info("Reconciliation workers disabled");
            return;
        }
        running = true;
        AtomicInteger threadIndex = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "reconcile-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 0; i < workers; i++) {
            workerPool.submit(this::runWorker);
        }
        log.info("Started {} reconciliation workers", workers);
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (workerPool == null) {
            return;
        }
        workerPool.shutdownNow();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Reconciliation workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Enqueue every stored resource.
     */
    @Scheduled(
        fixedDelayString = "${resource-controller.reconcile.resync-interval-ms:30000}",
        initialDelayString = "${resource-controller.reconcile.resync-initial-delay-ms:10000}")
    public void resync() {
        if (!enabled) {
            return;
        }
        var identities = store.findAllIdentities();
        log.debug("Resync enqueuing {} resources (queue depth {})", identities.size(), queue.size());
        identities.forEach(queue::add);
    }

    public void enqueue(ResourceIdentity identity) {
        queue.add(identity);
    }

    private void runWorker() {
        while (running && !Thread.currentThread().isInterrupted()) {
            ResourceIdentity identity;
            try {
                identity = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (identity == null) {
                continue;
            }
            try {
                process(identity);
            } finally {
                queue.done(identity);
            }
        }
        log.debug("Reconciliation worker {} exiting", Thread.currentThread().getName());
    }

    /**
     * Runs one pass and schedules the follow-up: a pending requeue, a failure
     * retry, or nothing.
     */
    void process(ResourceIdentity identity) {
        try {
            LoggingConfig.setResourceContext(identity);
            PassOutcome outcome = reconcileOnce(identity);
            retryEngine.reset(identity);
            outcome.requeueAfter().ifPresent(delay -> queue.addAfter(identity, delay));

        } catch (CancellationException e) {
            log.info("Reconciliation of {} cancelled; changes discarded", identity);

        } catch (ResourceNotFoundException e) {
            log.debug("{} no longer exists; dropping it", identity);
            completionTracker.forget(identity);
            retryEngine.reset(identity);

        } catch (ResourceControllerException e) {
            handleFailure(identity, e.getErrorCode(), e);

        } catch (ObjectOptimisticLockingFailureException e) {
            log.info("{} changed during reconciliation; requeueing against the new spec", identity);
            metricsRegistry.recordRequeue(identity.resourceType(), "conflict", 0);
            queue.add(identity);

        } catch (RuntimeException e) {
            handleFailure(identity, ErrorCode.UNEXPECTED_ERROR, e);

        } finally {
            LoggingConfig.clearResourceContext();
        }
    }

    /**
     * Reconciles one resource.
     *
     * @throws ResourceNotFoundException if no desired record exists
     * @throws ResourceControllerException if the owning system call or the
     *     merge fails; nothing is persisted in that case
     * @throws CancellationException if the worker is interrupted before the
     *     results are persisted
     * @throws ObjectOptimisticLockingFailureException if the spec was changed
     *     by someone else during the pass
     */
    public PassOutcome reconcileOnce(ResourceIdentity identity) {
        long startTime = System.currentTimeMillis();
        String resourceType = identity.resourceType();

        DesiredRecord persisted = store.find(identity)
            .orElseThrow(() -> new ResourceNotFoundException(resourceType, identity.name()));
        DesiredRecord working = persisted.deepCopy();
        Ruleset ruleset = rulesetRegistry.forResourceType(resourceType);
        ResourceClient client = clientRegistry.forType(resourceType);

        ObjectNode specBeforeOperations = working.getSpec().deepCopy();
        Map<SourceMethod, ObservedRecord> observations = new EnumMap<>(SourceMethod.class);
        ObservedRecord latest = callOwningSystem(client, ruleset, working, observations);
        boolean specMutatedByOperation = !specBeforeOperations.equals(working.getSpec());
        checkCancelled(identity);

        working.replaceStatus(latest.status());

        ObjectNode specBeforeMerge = working.getSpec().deepCopy();
        MergeResult result = mergeEngine.merge(working, observations, ruleset);
        metricsRegistry.recordMergeOutcome(resourceType, outcomeOf(result));
        if (result.isFatal()) {
            ResourceControllerException error = result.getError().orElseThrow();
            log.error("Late-initialization of {} failed: {}", identity, error.getMessage());
            throw error;
        }

        if (result.isChanged()) {
            metricsRegistry.recordFieldsInitialized(resourceType,
                PatchDecider.changedFields(specBeforeMerge, working.getSpec()).size());
        }

        TrackerAction action = completionTracker.onMergeResult(working, result);
        checkCancelled(identity);

        PatchPlan plan = patchDecider.decide(persisted, working, specMutatedByOperation);
        DesiredRecord stored = persist(persisted, working, plan).orElse(working);
        if (action.kind() == TrackerAction.Kind.CLEAR_PENDING_AND_CONTINUE) {
            stored = completionTracker.commitCleared(identity);
        }

        metricsRegistry.recordPatchPlan(resourceType, plan.name());
        metricsRegistry.recordLatency(resourceType, "reconcile", System.currentTimeMillis() - startTime);
        if (action.requiresRequeue()) {
            metricsRegistry.recordRequeue(resourceType, "pending", action.backoff().toMillis());
        }

        log.debug("Reconciled {}: merge={}, tracker={}, patch={}", identity, result, action.kind(), plan);
        return new PassOutcome(stored, result, action, plan);
    }

    /**
     * Reads the resource and creates or updates it. A type that does not
     * declare create fails for a missing resource; one that does not declare
     * update is never updated. Each call's result is
     * recorded under its source method; the return value is the most recent
     * observation.
     */
    private ObservedRecord callOwningSystem(
            ResourceClient client,
            Ruleset ruleset,
            DesiredRecord working,
            Map<SourceMethod, ObservedRecord> observations) {

        Optional<ObservedRecord> current = invoke(working, "read", () -> client.read(working));
        if (current.isEmpty()) {
            if (!ruleset.supports(SourceMethod.CREATE)) {
                throw new OwningSystemException(working.getResourceType(), "create",
                    working.getIdentity() + " does not exist and its type does not declare the create operation");
            }
            ObservedRecord created = invoke(working, "create", () -> client.create(working));
            log.info("Created {} in owning system", working.getIdentity());
            observations.put(SourceMethod.CREATE, created);
            return created;
        }

        ObservedRecord latest = current.get();
        observations.put(SourceMethod.READ, latest);
        if (!ruleset.supports(SourceMethod.UPDATE)) {
            return latest;
        }
        if (client.requiresUpdate(working, latest)) {
            ObservedRecord observed = latest;
            latest = invoke(working, "update", () -> client.update(working, observed));
            log.info("Updated {} in owning system", working.getIdentity());
            observations.put(SourceMethod.UPDATE, latest);
        }
        return latest;
    }

    private <T> T invoke(DesiredRecord working, String operation, Supplier<T> call) {
        long startTime = System.currentTimeMillis();
        try {
            T result = call.get();
            if (result == null) {
                throw new OwningSystemException(working.getResourceType(), operation, "returned no result");
            }
            return result;
        } catch (ResourceControllerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OwningSystemException(working.getResourceType(), operation, e.getMessage(), e);
        } finally {
            metricsRegistry.recordLatency(working.getResourceType(), operation, System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Writes status first, then the spec against the version the status
     * write produced. The spec is only written if the record returned by the
     * status write still carries the spec this pass started from; otherwise
     * the user changed it meanwhile and the pass is abandoned.
     *
     * @throws ObjectOptimisticLockingFailureException if the spec changed
     *     since {@code persisted} was read
     */
    private Optional<DesiredRecord> persist(DesiredRecord persisted, DesiredRecord working, PatchPlan plan) {
        if (!plan.writesStatus()) {
            return Optional.empty();
        }
        ResourceIdentity identity = working.getIdentity();
        DesiredRecord stored = store.patchStatus(identity, working.getStatus());
        if (plan.writesSpec()) {
            if (!stored.getSpec().equals(persisted.getSpec())) {
                throw new ObjectOptimisticLockingFailureException(DesiredRecord.class, identity.key());
            }
            stored = store.patchSpec(identity, working.getSpec(), stored.getVersion());
        }
        log.debug("Persisted {} for {} (version {})", plan, identity, stored.getVersion());
        return Optional.of(stored);
    }

    private void handleFailure(ResourceIdentity identity, ErrorCode errorCode, Exception e) {
        metricsRegistry.recordPassFailure(identity.resourceType(), errorCode.getCode());
        log.error("[{}] Reconciliation of {} failed: {}", errorCode.getCode(), identity, e.getMessage(), e);

        Optional<Duration> delay = retryEngine.nextDelay(identity);
        if (delay.isPresent()) {
            metricsRegistry.recordRequeue(identity.resourceType(), "failure", delay.get().toMillis());
            queue.addAfter(identity, delay.get());
        }
    }

    private static void checkCancelled(ResourceIdentity identity) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Reconciliation of " + identity + " interrupted");
        }
    }

    private static String outcomeOf(MergeResult result) {
        if (result.isFatal()) {
            return "failed";
        }
        if (result.isNotYetAvailable()) {
            return "pending";
        }
        return result.isChanged() ? "changed" : "unchanged";
    }
}
