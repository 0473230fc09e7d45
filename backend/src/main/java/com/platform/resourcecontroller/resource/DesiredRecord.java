package com.platform.resourcecontroller.resource;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The controller's record of user intent ({@code spec}) plus controller-managed
 * {@code status} and annotations.
 * <p>
 * Not thread-safe. Reconciliation of one identity is serialized by the
 * orchestrator, and each pass works on a {@link #deepCopy()}.
 */
@Getter
public class DesiredRecord {
    
    private final ResourceIdentity identity;
    private final ObjectNode spec;
    private ObjectNode status;
    @Getter(AccessLevel.NONE)
    private final Map<String, String> annotations;
    
    /**
     * Persisted version, null until first saved.
     */
    @Setter
    private Long version;
    
    public DesiredRecord(ResourceIdentity identity, ObjectNode spec, ObjectNode status,
                         Map<String, String> annotations, Long version) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.spec = spec != null ? spec : JsonNodeFactory.instance.objectNode();
        this.status = status != null ? status : JsonNodeFactory.instance.objectNode();
        this.annotations = annotations != null ? new LinkedHashMap<>(annotations) : new LinkedHashMap<>();
        this.version = version;
    }
    
    public static DesiredRecord of(ResourceIdentity identity, ObjectNode spec) {
        return new DesiredRecord(identity, spec, null, null, null);
    }
    
    public String getResourceType() {
        return identity.resourceType();
    }
    
    public void replaceStatus(ObjectNode newStatus) {
        this.status = newStatus != null ? newStatus.deepCopy() : JsonNodeFactory.instance.objectNode();
    }
    
    public boolean hasAnnotation(String key) {
        return annotations.containsKey(key);
    }
    
    public void putAnnotation(String key, String value) {
        annotations.put(key, value);
    }
    
    public void removeAnnotation(String key) {
        annotations.remove(key);
    }
    
    public Map<String, String> getAnnotations() {
        return Collections.unmodifiableMap(annotations);
    }
    
    public DesiredRecord deepCopy() {
        return new DesiredRecord(identity, spec.deepCopy(), status.deepCopy(), annotations, version);
    }
    
    @Override
    public String toString() {
        return "DesiredRecord{" + identity + ", version=" + version + ", annotations=" + annotations + "}";
    }
}
