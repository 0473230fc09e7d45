package com.platform.resourcecontroller.reconciliation.http;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * HTTP endpoints of the systems owning each resource type.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "resource-controller.owning-systems")
public class OwningSystemProperties {
    
    /**
     * Connection timeout in milliseconds.
     */
    private int connectionTimeoutMs = 5000;
    
    /**
     * Read timeout in milliseconds.
     */
    private int readTimeoutMs = 10000;
    
    /**
     * Endpoint per resource type.
     */
    private Map<String, Endpoint> endpoints = new HashMap<>();
    
    @Data
    public static class Endpoint {
        /**
         * Collection URL, e.g. {@code http://functions:9000/api/functions}.
         */
        private String baseUrl;
        
        /**
         * Bearer token, sent when set.
         */
        private String apiKey;
    }
}
