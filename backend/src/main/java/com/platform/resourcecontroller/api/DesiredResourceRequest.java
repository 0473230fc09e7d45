package com.platform.resourcecontroller.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Body of a desired-state write.
 */
public record DesiredResourceRequest(
    @NotNull(message = "spec is required") ObjectNode spec,
    Map<String, String> annotations
) {
    
    public Map<String, String> annotationsOrEmpty() {
        return annotations != null ? annotations : Map.of();
    }
}
