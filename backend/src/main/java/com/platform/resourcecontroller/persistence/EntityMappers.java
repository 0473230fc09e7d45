package com.platform.resourcecontroller.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.resourcecontroller.persistence.entity.DesiredResourceEntity;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ResourceIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bidirectional mappers between desired records and JPA entities.
 */
@Slf4j
@Component
public class EntityMappers {
    
    private static final TypeReference<LinkedHashMap<String, String>> ANNOTATIONS_TYPE = new TypeReference<>() {};
    
    private final ObjectMapper objectMapper;
    
    public EntityMappers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    public DesiredResourceEntity toEntity(DesiredRecord domain) {
        return DesiredResourceEntity.builder()
            .resourceKey(domain.getIdentity().key())
            .resourceType(domain.getIdentity().resourceType())
            .name(domain.getIdentity().name())
            .specJson(writeJson(domain.getSpec()))
            .statusJson(writeJson(domain.getStatus()))
            .annotationsJson(writeJson(domain.getAnnotations()))
            .version(domain.getVersion())
            .build();
    }
    
    public DesiredRecord toDomain(DesiredResourceEntity entity) {
        return new DesiredRecord(
            ResourceIdentity.of(entity.getResourceType(), entity.getName()),
            readObject(entity.getSpecJson()),
            readObject(entity.getStatusJson()),
            readAnnotations(entity.getAnnotationsJson()),
            entity.getVersion()
        );
    }
    
    public String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("Failed to serialize desired record", e);
        }
    }
    
    public ObjectNode readObject(String json) {
        if (json == null || json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.isObject()) {
                throw new IllegalStateException("Stored record body is not a JSON object: " + node.getNodeType());
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize record body: {}", json, e);
            throw new IllegalStateException("Failed to deserialize desired record", e);
        }
    }
    
    public Map<String, String> readAnnotations(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, ANNOTATIONS_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize annotations: {}", json, e);
            throw new IllegalStateException("Failed to deserialize annotations", e);
        }
    }
}
