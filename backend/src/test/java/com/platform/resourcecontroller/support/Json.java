package com.platform.resourcecontroller.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Test helper for writing JSON objects inline, with single quotes.
 */
public final class Json {
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    private Json() {
    }
    
    public static ObjectNode obj(String json) {
        try {
            return (ObjectNode) MAPPER.readTree(json.replace('\'', '"'));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid test JSON: " + json, e);
        }
    }
    
    public static ObjectNode empty() {
        return MAPPER.createObjectNode();
    }
}
