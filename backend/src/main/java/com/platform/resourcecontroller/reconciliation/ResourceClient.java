package com.platform.resourcecontroller.reconciliation;

import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ObservedRecord;

import java.util.Optional;

/**
 * Calls into the system that owns one resource type. Calls are blocking and
 * remote and may fail with {@link com.platform.resourcecontroller.error.OwningSystemException}.
 * <p>
 * {@code create} and {@code update} may write server-assigned fields (such as
 * identifiers) into the spec of the record they receive; the orchestrator
 * detects that and persists the spec.
 */
public interface ResourceClient {
    
    /**
     * Resource type this client serves.
     */
    String resourceType();
    
    /**
     * Current state of the resource, or empty if it does not exist.
     */
    Optional<ObservedRecord> read(DesiredRecord desired);
    
    ObservedRecord create(DesiredRecord desired);
    
    ObservedRecord update(DesiredRecord desired, ObservedRecord latest);
    
    /**
     * Whether the owning system's state differs from the user's intent.
     * By default only fields present in the desired spec are compared, so
     * server defaults the user never set are not drift.
     */
    default boolean requiresUpdate(DesiredRecord desired, ObservedRecord latest) {
        return SpecDrift.declaredFieldsDiffer(desired.getSpec(), latest.spec());
    }
}
