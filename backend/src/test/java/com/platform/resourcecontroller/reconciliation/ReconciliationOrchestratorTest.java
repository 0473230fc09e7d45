package com.platform.resourcecontroller.reconciliation;

import com.platform.resourcecontroller.error.HookFailedException;
import com.platform.resourcecontroller.error.OwningSystemException;
import com.platform.resourcecontroller.error.ResourceNotFoundException;
import com.platform.resourcecontroller.fieldpath.FieldPath;
import com.platform.resourcecontroller.lateinit.hook.MergeHooks;
import com.platform.resourcecontroller.lateinit.hook.NamedHook;
import com.platform.resourcecontroller.lateinit.hook.PreMergeHook;
import com.platform.resourcecontroller.lateinit.merge.MergeEngine;
import com.platform.resourcecontroller.lateinit.merge.MergeResult;
import com.platform.resourcecontroller.lateinit.patch.PatchDecider;
import com.platform.resourcecontroller.lateinit.patch.PatchPlan;
import com.platform.resourcecontroller.lateinit.ruleset.BackoffSettings;
import com.platform.resourcecontroller.lateinit.ruleset.FieldRule;
import com.platform.resourcecontroller.lateinit.ruleset.Ruleset;
import com.platform.resourcecontroller.lateinit.ruleset.RulesetRegistry;
import com.platform.resourcecontroller.lateinit.tracker.CompletionTracker;
import com.platform.resourcecontroller.lateinit.tracker.TrackerAction;
import com.platform.resourcecontroller.observability.MetricsRegistry;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ResourceIdentity;
import com.platform.resourcecontroller.resource.SourceMethod;
import com.platform.resourcecontroller.support.FakeResourceClient;
import com.platform.resourcecontroller.support.InMemoryDesiredRecordStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.platform.resourcecontroller.support.Json.obj;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ReconciliationOrchestratorTest {
    
    private static final ResourceIdentity CHECKOUT = ResourceIdentity.of("function", "checkout");
    private static final BackoffSettings BACKOFF =
        new BackoffSettings(Duration.ofSeconds(5), Duration.ofMinutes(1), 2.0, 0.0);
    
    private InMemoryDesiredRecordStore store;
    private FakeResourceClient functions;
    private ReconcileQueue queue;
    private RetryEngine retryEngine;
    private SimpleMeterRegistry meterRegistry;
    private ReconciliationOrchestrator orchestrator;
    
    @BeforeEach
    void setUp() {
        store = new InMemoryDesiredRecordStore();
        functions = new FakeResourceClient("function")
            .withServerDefaults(obj("{'timeoutSeconds': 30, 'memoryMb': 128}"));
        queue = mock(ReconcileQueue.class);
        retryEngine = new RetryEngine();
        ReflectionTestUtils.setField(retryEngine, "maxAttempts", 2);
        ReflectionTestUtils.setField(retryEngine, "initialDelayMs", 1000L);
        ReflectionTestUtils.setField(retryEngine, "maxDelayMs", 1000L);
        ReflectionTestUtils.setField(retryEngine, "multiplier", 2.0);
        ReflectionTestUtils.setField(retryEngine, "jitterFactor", 0.0);
        meterRegistry = new SimpleMeterRegistry();
        
        Ruleset functionRules = Ruleset.builder()
            .resourceType("function")
            .rules(List.of(
                FieldRule.of("timeoutSeconds", SourceMethod.CREATE),
                FieldRule.of("memoryMb", SourceMethod.CREATE)))
            .backoff(BACKOFF)
            .build();
        build(functionRules);
        
        store.save(DesiredRecord.of(CHECKOUT, obj("{'runtime': 'java17'}")));
        store.clearWrites();
    }
    
    private void build(Ruleset functionRules) {
        MetricsRegistry metrics = new MetricsRegistry(meterRegistry);
        RulesetRegistry rulesets = new RulesetRegistry(Map.of("function", functionRules), SourceMethod.READ, BACKOFF);
        orchestrator = new ReconciliationOrchestrator(
            store,
            new ResourceClientRegistry(List.of(functions)),
            rulesets,
            new MergeEngine(),
            new CompletionTracker(store, rulesets, metrics),
            new PatchDecider(),
            queue,
            retryEngine,
            metrics);
    }
    
    private DesiredRecord stored() {
        return store.find(CHECKOUT).orElseThrow();
    }
    
    @Test
    void createPassLateInitializesServerDefaults() {
        PassOutcome outcome = orchestrator.reconcileOnce(CHECKOUT);
        
        assertThat(functions.calls()).containsExactly("read", "create");
        assertThat(outcome.mergeResult()).isEqualTo(MergeResult.changed());
        assertThat(outcome.patchPlan()).isEqualTo(PatchPlan.SPEC_AND_STATUS);
        assertThat(outcome.requeueAfter()).isEmpty();
        assertThat(stored().getSpec()).isEqualTo(obj("{'runtime': 'java17', 'timeoutSeconds': 30, 'memoryMb': 128}"));
        assertThat(store.writes()).containsExactly("status", "spec");
        assertThat(meterRegistry.get("resourcecontroller.lateinit.fields.initialized").counter().count()).isEqualTo(2.0);
    }
    
    @Test
    void secondPassWritesNothing() {
        orchestrator.reconcileOnce(CHECKOUT);
        store.clearWrites();
        
        PassOutcome outcome = orchestrator.reconcileOnce(CHECKOUT);
        
        assertThat(functions.calls()).containsExactly("read", "create", "read");
        assertThat(outcome.patchPlan()).isEqualTo(PatchPlan.NONE);
        assertThat(store.writes()).isEmpty();
    }
    
    @Test
    void userValueSurvivesAndIsNeverOverwritten() {
        store.save(DesiredRecord.of(CHECKOUT, obj("{'runtime': 'java17', 'timeoutSeconds': 5}")));
        
        orchestrator.reconcileOnce(CHECKOUT);
        
        assertThat(stored().getSpec().get("timeoutSeconds").asInt()).isEqualTo(5);
        assertThat(functions.remoteSpec("checkout").get("timeoutSeconds").asInt()).isEqualTo(5);
    }
    
    @Test
    void declaredDriftTriggersUpdate() {
        functions.setRemoteSpec("checkout", obj("{'runtime': 'java11', 'timeoutSeconds': 30}"));
        
        orchestrator.reconcileOnce(CHECKOUT);
        
        assertThat(functions.calls()).containsExactly("read", "update");
        assertThat(functions.remoteSpec("checkout").get("runtime").asText()).isEqualTo("java17");
    }
    
    @Test
    void driftIsLeftAloneWhenTypeDoesNotDeclareUpdate() {
        build(Ruleset.builder()
            .resourceType("function")
            .supportedOperations(Set.of(SourceMethod.CREATE, SourceMethod.READ))
            .build());
        functions.setRemoteSpec("checkout", obj("{'runtime': 'java11'}"));
        
        orchestrator.reconcileOnce(CHECKOUT);
        
        assertThat(functions.calls()).containsExactly("read");
        assertThat(functions.remoteSpec("checkout").get("runtime").asText()).isEqualTo("java11");
    }
    
    @Test
    void missingResourceIsNotCreatedWhenTypeDoesNotDeclareCreate() {
        build(Ruleset.builder()
            .resourceType("function")
            .supportedOperations(Set.of(SourceMethod.READ, SourceMethod.UPDATE))
            .build());
        
        assertThatThrownBy(() -> orchestrator.reconcileOnce(CHECKOUT))
            .isInstanceOfSatisfying(OwningSystemException.class,
                e -> assertThat(e.getOperation()).isEqualTo("create"));
        
        assertThat(functions.calls()).containsExactly("read");
        assertThat(store.writes()).isEmpty();
    }
    
    @Test
    void userSpecWrittenDuringPassIsKept() {
        functions.onCreate(desired -> store.save(DesiredRecord.of(CHECKOUT, obj("{'runtime': 'java21'}"))));
        store.clearWrites();
        
        assertThatThrownBy(() -> orchestrator.reconcileOnce(CHECKOUT))
            .isInstanceOf(ObjectOptimisticLockingFailureException.class);
        
        assertThat(stored().getSpec()).isEqualTo(obj("{'runtime': 'java21'}"));
        assertThat(store.writes()).doesNotContain("spec");
    }
    
    @Test
    void concurrentSpecChangeRequeuesWithoutSpendingRetries() {
        functions.onCreate(desired -> store.save(DesiredRecord.of(CHECKOUT, obj("{'runtime': 'java21'}"))));
        
        orchestrator.process(CHECKOUT);
        
        verify(queue).add(CHECKOUT);
        verify(queue, never()).addAfter(any(), any());
        assertThat(retryEngine.getRetryCount(CHECKOUT)).isZero();
        assertThat(stored().getSpec().get("runtime").asText()).isEqualTo("java21");
    }
    
    @Test
    void markerSurvivesWhenCompletedValuesCannotBePersisted() {
        build(Ruleset.builder()
            .resourceType("function")
            .rules(List.of(new FieldRule(FieldPath.parse("endpoint.url"), SourceMethod.READ, null, true)))
            .backoff(BACKOFF)
            .build());
        functions.setRemoteSpec("checkout", obj("{'runtime': 'java17'}"));
        orchestrator.reconcileOnce(CHECKOUT);
        assertThat(CompletionTracker.isPending(stored())).isTrue();
        
        functions.setRemoteSpec("checkout", obj("{'runtime': 'java17', 'endpoint': {'url': 'https://checkout.example'}}"));
        store.failStatusWritesWith(new DataAccessResourceFailureException("connection lost"));
        
        orchestrator.process(CHECKOUT);
        
        assertThat(CompletionTracker.isPending(stored())).isTrue();
        assertThat(stored().getSpec().has("endpoint")).isFalse();
        verify(queue).addAfter(eq(CHECKOUT), eq(Duration.ofSeconds(1)));
        
        store.failStatusWritesWith(null);
        orchestrator.reconcileOnce(CHECKOUT);
        
        assertThat(CompletionTracker.isPending(stored())).isFalse();
        assertThat(stored().getSpec().at("/endpoint/url").asText()).isEqualTo("https://checkout.example");
    }
    
    @Test
    void interruptedPassDiscardsItsWork() {
        build(Ruleset.builder()
            .resourceType("function")
            .rules(List.of(new FieldRule(FieldPath.parse("endpoint.url"), SourceMethod.CREATE, null, true)))
            .backoff(BACKOFF)
            .build());
        functions.onCreate(desired -> {
            desired.getSpec().put("arn", "arn:aws:lambda:checkout");
            Thread.currentThread().interrupt();
        });
        
        try {
            orchestrator.process(CHECKOUT);
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }
        
        assertThat(store.writes()).isEmpty();
        assertThat(stored().getSpec()).isEqualTo(obj("{'runtime': 'java17'}"));
        assertThat(CompletionTracker.isPending(stored())).isFalse();
        verify(queue, never()).add(any());
        verify(queue, never()).addAfter(any(), any());
    }
    
    @Test
    void statusChangeAloneLeavesSpecUntouched() {
        orchestrator.reconcileOnce(CHECKOUT);
        store.clearWrites();
        functions.setRemoteStatus("checkout", obj("{'state': 'Active'}"));
        
        PassOutcome outcome = orchestrator.reconcileOnce(CHECKOUT);
        
        assertThat(outcome.patchPlan()).isEqualTo(PatchPlan.STATUS_ONLY);
        assertThat(store.writes()).containsExactly("status");
        assertThat(stored().getStatus().get("state").asText()).isEqualTo("Active");
    }
    
    @Test
    void specWrittenByCreateIsPersisted() {
        functions.onCreate(desired -> desired.getSpec().put("arn", "arn:aws:lambda:checkout"));
        build(Ruleset.empty("function", SourceMethod.READ, BACKOFF));
        
        PassOutcome outcome = orchestrator.reconcileOnce(CHECKOUT);
        
        assertThat(outcome.patchPlan()).isEqualTo(PatchPlan.SPEC_AND_STATUS);
        assertThat(stored().getSpec().get("arn").asText()).isEqualTo("arn:aws:lambda:checkout");
    }
    
    @Test
    void awaitedValueMarksPendingUntilPopulated() {
        build(Ruleset.builder()
            .resourceType("function")
            .rules(List.of(new FieldRule(FieldPath.parse("endpoint.url"), SourceMethod.READ, null, true)))
            .backoff(BACKOFF)
            .build());
        functions.setRemoteSpec("checkout", obj("{'runtime': 'java17'}"));
        
        PassOutcome pending = orchestrator.reconcileOnce(CHECKOUT);
        
        assertThat(pending.trackerAction()).isEqualTo(TrackerAction.markPendingAndRequeue(Duration.ofSeconds(5)));
        assertThat(pending.requeueAfter()).contains(Duration.ofSeconds(5));
        assertThat(CompletionTracker.isPending(stored())).isTrue();
        
        functions.setRemoteSpec("checkout", obj("{'runtime': 'java17', 'endpoint': {'url': 'https://checkout.example'}}"));
        PassOutcome done = orchestrator.reconcileOnce(CHECKOUT);
        
        assertThat(done.trackerAction()).isEqualTo(TrackerAction.clearPendingAndContinue());
        assertThat(CompletionTracker.isPending(stored())).isFalse();
        assertThat(stored().getSpec().at("/endpoint/url").asText()).isEqualTo("https://checkout.example");
    }
    
    @Test
    void fatalMergePersistsNothing() {
        PreMergeHook failing = (desired, observations, seed) ->
            MergeResult.failed(new HookFailedException("reject", new IllegalStateException("quota exceeded")));
        build(Ruleset.builder()
            .resourceType("function")
            .rules(List.of(FieldRule.of("timeoutSeconds", SourceMethod.CREATE)))
            .hooks(new MergeHooks(null, new NamedHook<>("reject", failing), null))
            .build());
        
        assertThatThrownBy(() -> orchestrator.reconcileOnce(CHECKOUT)).isInstanceOf(HookFailedException.class);
        
        assertThat(store.writes()).isEmpty();
        assertThat(stored().getSpec().has("timeoutSeconds")).isFalse();
    }
    
    @Test
    void missingRecordIsNotFound() {
        assertThatThrownBy(() -> orchestrator.reconcileOnce(ResourceIdentity.of("function", "gone")))
            .isInstanceOf(ResourceNotFoundException.class);
    }
    
    @Test
    void typeWithoutClientFails() {
        store.save(DesiredRecord.of(ResourceIdentity.of("queue", "orders"), obj("{}")));
        
        assertThatThrownBy(() -> orchestrator.reconcileOnce(ResourceIdentity.of("queue", "orders")))
            .isInstanceOf(OwningSystemException.class);
    }
    
    @Test
    void owningSystemFailureIsWrappedAndRetried() {
        functions.failWith(new IllegalStateException("connection refused"));
        
        assertThatThrownBy(() -> orchestrator.reconcileOnce(CHECKOUT))
            .isInstanceOf(OwningSystemException.class)
            .hasMessageContaining("connection refused");
        
        orchestrator.process(CHECKOUT);
        orchestrator.process(CHECKOUT);
        
        verify(queue, times(2)).addAfter(eq(CHECKOUT), eq(Duration.ofSeconds(1)));
        assertThat(retryEngine.getRetryCount(CHECKOUT)).isEqualTo(2);
        assertThat(meterRegistry.find("resourcecontroller.reconcile.failure").counters()).isNotEmpty();
    }
    
    @Test
    void retriesStopAfterMaxAttemptsAndResetOnSuccess() {
        functions.failWith(new IllegalStateException("connection refused"));
        orchestrator.process(CHECKOUT);
        orchestrator.process(CHECKOUT);
        orchestrator.process(CHECKOUT);
        
        verify(queue, times(2)).addAfter(eq(CHECKOUT), any(Duration.class));
        
        functions.failWith(null);
        orchestrator.process(CHECKOUT);
        
        assertThat(retryEngine.getRetryCount(CHECKOUT)).isZero();
    }
    
    @Test
    void deletedRecordIsDroppedWithoutRetry() {
        orchestrator.process(ResourceIdentity.of("function", "gone"));
        
        verify(queue, never()).addAfter(any(), any());
    }
    
    @Test
    void resyncIsSkippedWhenDisabled() {
        ReflectionTestUtils.setField(orchestrator, "enabled", false);
        
        orchestrator.resync();
        
        verify(queue, never()).add(any());
    }
    
    @Test
    void resyncEnqueuesEveryRecord() {
        ReflectionTestUtils.setField(orchestrator, "enabled", true);
        
        orchestrator.resync();
        
        verify(queue).add(CHECKOUT);
    }
}
