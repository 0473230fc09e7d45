package com.platform.resourcecontroller.persistence;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ResourceIdentity;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of desired records. Each write touches one part of the
 * record (spec, status or annotations) and returns the record as stored
 * afterwards.
 */
public interface DesiredRecordStore {
    
    Optional<DesiredRecord> find(ResourceIdentity identity);
    
    List<ResourceIdentity> findAllIdentities();
    
    /**
     * Identities whose record carries the given annotation key.
     */
    List<ResourceIdentity> findByAnnotation(String key);
    
    /**
     * Creates the record, or replaces its spec if it exists. Status and
     * annotations of an existing record are kept.
     */
    DesiredRecord save(DesiredRecord record);
    
    DesiredRecord patchStatus(ResourceIdentity identity, ObjectNode status);
    
    /**
     * Replaces the spec, failing with an optimistic locking error if the
     * stored version is no longer {@code expectedVersion}.
     */
    DesiredRecord patchSpec(ResourceIdentity identity, ObjectNode spec, Long expectedVersion);
    
    DesiredRecord setAnnotation(ResourceIdentity identity, String key, String value);
    
    DesiredRecord removeAnnotation(ResourceIdentity identity, String key);
    
    void delete(ResourceIdentity identity);
}
