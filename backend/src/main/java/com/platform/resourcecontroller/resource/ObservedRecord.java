package com.platform.resourcecontroller.resource;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Snapshot of a resource as returned by one owning-system operation.
 * Consumed by the merge engine only; never persisted.
 */
public record ObservedRecord(SourceMethod origin, ObjectNode spec, ObjectNode status) {
    
    public ObservedRecord {
        Objects.requireNonNull(origin, "origin");
        spec = spec != null ? spec.deepCopy() : JsonNodeFactory.instance.objectNode();
        status = status != null ? status.deepCopy() : JsonNodeFactory.instance.objectNode();
    }
    
    public static ObservedRecord of(SourceMethod origin, ObjectNode spec) {
        return new ObservedRecord(origin, spec, null);
    }
}
