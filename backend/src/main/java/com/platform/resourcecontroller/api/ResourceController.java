package com.platform.resourcecontroller.api;

import com.platform.resourcecontroller.error.ErrorCode;
import com.platform.resourcecontroller.error.ResourceNotFoundException;
import com.platform.resourcecontroller.error.ValidationException;
import com.platform.resourcecontroller.lateinit.tracker.CompletionTracker;
import com.platform.resourcecontroller.persistence.DesiredRecordStore;
import com.platform.resourcecontroller.reconciliation.ReconciliationOrchestrator;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ResourceIdentity;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for desired resource records.
 * <p>
 * Writes only touch the spec and user annotations; status and the
 * late-initialization marker belong to the reconciler. A PUT replaces both
 * the spec and the set of user annotations.
 */
@Slf4j
@RestController
@RequestMapping("/api/resources")
public class ResourceController {
    
    private final DesiredRecordStore store;
    private final ReconciliationOrchestrator orchestrator;
    private final CompletionTracker completionTracker;
    
    public ResourceController(
            DesiredRecordStore store,
            ReconciliationOrchestrator orchestrator,
            CompletionTracker completionTracker) {
        this.store = store;
        this.orchestrator = orchestrator;
        this.completionTracker = completionTracker;
    }
    
    @PutMapping("/{resourceType}/{name}")
    public DesiredResourceView putDesiredResource(
            @PathVariable String resourceType,
            @PathVariable String name,
            @Valid @RequestBody DesiredResourceRequest request) {
        
        Map<String, String> annotations = request.annotationsOrEmpty();
        if (annotations.containsKey(CompletionTracker.PENDING_ANNOTATION)) {
            throw new ValidationException(ErrorCode.RESERVED_ANNOTATION, "annotations",
                CompletionTracker.PENDING_ANNOTATION + " is managed by the controller");
        }
        
        ResourceIdentity identity = ResourceIdentity.of(resourceType, name);
        DesiredRecord saved = store.save(DesiredRecord.of(identity, request.spec()));
        for (String existing : List.copyOf(saved.getAnnotations().keySet())) {
            if (!existing.equals(CompletionTracker.PENDING_ANNOTATION) && !annotations.containsKey(existing)) {
                saved = store.removeAnnotation(identity, existing);
            }
        }
        for (Map.Entry<String, String> annotation : annotations.entrySet()) {
            saved = store.setAnnotation(identity, annotation.getKey(), annotation.getValue());
        }
        
        orchestrator.enqueue(identity);
        return DesiredResourceView.from(saved);
    }
    
    @GetMapping("/{resourceType}/{name}")
    public DesiredResourceView getDesiredResource(
            @PathVariable String resourceType,
            @PathVariable String name) {
        ResourceIdentity identity = ResourceIdentity.of(resourceType, name);
        return store.find(identity)
            .map(DesiredResourceView::from)
            .orElseThrow(() -> new ResourceNotFoundException(resourceType, name));
    }
    
    @DeleteMapping("/{resourceType}/{name}")
    public ResponseEntity<Void> deleteDesiredResource(
            @PathVariable String resourceType,
            @PathVariable String name) {
        ResourceIdentity identity = ResourceIdentity.of(resourceType, name);
        store.delete(identity);
        completionTracker.forget(identity);
        return ResponseEntity.noContent().build();
    }
    
    /**
     * Resources whose late initialization has not completed yet.
     */
    @GetMapping("/pending")
    public List<String> getPending() {
        return store.findByAnnotation(CompletionTracker.PENDING_ANNOTATION).stream()
            .map(ResourceIdentity::key)
            .toList();
    }
    
    @PostMapping("/{resourceType}/{name}/reconcile")
    public ResponseEntity<Map<String, String>> triggerReconciliation(
            @PathVariable String resourceType,
            @PathVariable String name) {
        ResourceIdentity identity = ResourceIdentity.of(resourceType, name);
        if (store.find(identity).isEmpty()) {
            throw new ResourceNotFoundException(resourceType, name);
        }
        orchestrator.enqueue(identity);
        log.info("Manual reconciliation requested for {}", identity);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("resource", identity.key(), "status", "queued"));
    }
}
