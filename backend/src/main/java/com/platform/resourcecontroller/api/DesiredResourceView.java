package com.platform.resourcecontroller.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.resourcecontroller.lateinit.tracker.CompletionTracker;
import com.platform.resourcecontroller.resource.DesiredRecord;

import java.util.Map;

public record DesiredResourceView(
    String resourceType,
    String name,
    ObjectNode spec,
    ObjectNode status,
    Map<String, String> annotations,
    Long version,
    boolean lateInitPending
) {
    
    public static DesiredResourceView from(DesiredRecord record) {
        return new DesiredResourceView(
            record.getResourceType(),
            record.getIdentity().name(),
            record.getSpec(),
            record.getStatus(),
            record.getAnnotations(),
            record.getVersion(),
            CompletionTracker.isPending(record)
        );
    }
}
