package com.platform.resourcecontroller.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for desired resource records.
 * Uses {@code resourceType/name} as natural primary key; record bodies are
 * stored as JSON text.
 */
@Entity
@Table(name = "desired_resources", indexes = {
    @Index(name = "idx_desired_resources_type", columnList = "resource_type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DesiredResourceEntity {
    
    /**
     * {@code resourceType/name}.
     */
    @Id
    @Column(name = "resource_key", length = 300)
    private String resourceKey;
    
    @Column(name = "resource_type", length = 100, nullable = false)
    private String resourceType;
    
    @Column(name = "name", length = 200, nullable = false)
    private String name;
    
    @Lob
    @Column(name = "spec_json", nullable = false)
    private String specJson;
    
    @Lob
    @Column(name = "status_json", nullable = false)
    private String statusJson;
    
    @Lob
    @Column(name = "annotations_json", nullable = false)
    private String annotationsJson;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    /**
     * Optimistic locking version for concurrent update safety.
     */
    @Version
    @Column(nullable = false)
    private Long version;
    
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
    
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
