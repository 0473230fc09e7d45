package com.platform.resourcecontroller.lateinit.ruleset;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative late-initialization configuration, bound from
 * {@code resource-controller.late-init}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "resource-controller.late-init")
public class LateInitProperties {
    
    /**
     * Source method of rules that name none, unless the resource type overrides it.
     */
    private String defaultSourceMethod = "read";
    
    /**
     * Reject duplicate rules and empty resource type entries instead of warning.
     */
    private boolean strict = true;
    
    /**
     * Pending backoff for resource types that declare none.
     */
    private BackoffProperties backoff = new BackoffProperties();
    
    /**
     * Per resource type configuration, keyed by resource type.
     */
    private Map<String, ResourceTypeProperties> resources = new LinkedHashMap<>();
    
    @Data
    public static class ResourceTypeProperties {
        
        /**
         * Operations the owning system offers for this type.
         */
        private List<String> operations = new ArrayList<>(List.of("create", "read", "update"));
        
        private String defaultSourceMethod;
        
        private List<FieldRuleProperties> fields = new ArrayList<>();
        
        /**
         * Optional typed schema, {@code path: type}. Dotted keys need the
         * bracket form in YAML, e.g. {@code "[network.subnetId]": string}.
         */
        private Map<String, String> schema = new LinkedHashMap<>();
        
        private HookProperties hooks = new HookProperties();
        
        private BackoffProperties backoff;
    }
    
    @Data
    public static class FieldRuleProperties {
        private String path;
        private String sourceMethod;
        private String overrideHook;
        private boolean awaitValue;
    }
    
    @Data
    public static class HookProperties {
        private String overrideAll;
        private String pre;
        private String post;
        
        public boolean isEmpty() {
            return overrideAll == null && pre == null && post == null;
        }
    }
    
    @Data
    public static class BackoffProperties {
        private Duration min = Duration.ofSeconds(5);
        private Duration max = Duration.ofMinutes(5);
        private double multiplier = 2.0;
        private double jitterFactor = 0.1;
    }
}
