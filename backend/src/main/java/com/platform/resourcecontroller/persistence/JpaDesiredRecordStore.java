package com.platform.resourcecontroller.persistence;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.resourcecontroller.error.ResourceNotFoundException;
import com.platform.resourcecontroller.persistence.entity.DesiredResourceEntity;
import com.platform.resourcecontroller.persistence.repository.DesiredResourceJpaRepository;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ResourceIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Desired record store backed by Spring Data JPA.
 */
@Slf4j
@Component
public class JpaDesiredRecordStore implements DesiredRecordStore {
    
    private final DesiredResourceJpaRepository jpaRepository;
    private final EntityMappers entityMappers;
    
    public JpaDesiredRecordStore(DesiredResourceJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<DesiredRecord> find(ResourceIdentity identity) {
        return jpaRepository.findById(identity.key())
            .map(entityMappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<ResourceIdentity> findAllIdentities() {
        return jpaRepository.findAllKeys().stream()
            .map(ResourceIdentity::parse)
            .toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<ResourceIdentity> findByAnnotation(String key) {
        return jpaRepository.findByAnnotationsJsonContaining(entityMappers.writeJson(key)).stream()
            .filter(entity -> entityMappers.readAnnotations(entity.getAnnotationsJson()).containsKey(key))
            .map(entity -> ResourceIdentity.of(entity.getResourceType(), entity.getName()))
            .toList();
    }
    
    @Override
    @Transactional
    public DesiredRecord save(DesiredRecord record) {
        DesiredResourceEntity entity = jpaRepository.findById(record.getIdentity().key())
            .map(existing -> {
                existing.setSpecJson(entityMappers.writeJson(record.getSpec()));
                return existing;
            })
            .orElseGet(() -> entityMappers.toEntity(record));
        
        DesiredRecord saved = entityMappers.toDomain(jpaRepository.saveAndFlush(entity));
        log.info("Saved desired record {} (version {})", saved.getIdentity(), saved.getVersion());
        return saved;
    }
    
    @Override
    @Transactional
    public DesiredRecord patchStatus(ResourceIdentity identity, ObjectNode status) {
        DesiredResourceEntity entity = load(identity);
        entity.setStatusJson(entityMappers.writeJson(status));
        return entityMappers.toDomain(jpaRepository.saveAndFlush(entity));
    }
    
    @Override
    @Transactional
    public DesiredRecord patchSpec(ResourceIdentity identity, ObjectNode spec, Long expectedVersion) {
        DesiredResourceEntity entity = load(identity);
        if (expectedVersion != null && !Objects.equals(entity.getVersion(), expectedVersion)) {
            throw new ObjectOptimisticLockingFailureException(DesiredResourceEntity.class, identity.key());
        }
        entity.setSpecJson(entityMappers.writeJson(spec));
        return entityMappers.toDomain(jpaRepository.saveAndFlush(entity));
    }
    
    @Override
    @Transactional
    public DesiredRecord setAnnotation(ResourceIdentity identity, String key, String value) {
        DesiredResourceEntity entity = load(identity);
        Map<String, String> annotations = entityMappers.readAnnotations(entity.getAnnotationsJson());
        if (value.equals(annotations.get(key))) {
            return entityMappers.toDomain(entity);
        }
        annotations.put(key, value);
        entity.setAnnotationsJson(entityMappers.writeJson(annotations));
        return entityMappers.toDomain(jpaRepository.saveAndFlush(entity));
    }
    
    @Override
    @Transactional
    public DesiredRecord removeAnnotation(ResourceIdentity identity, String key) {
        DesiredResourceEntity entity = load(identity);
        Map<String, String> annotations = entityMappers.readAnnotations(entity.getAnnotationsJson());
        if (annotations.remove(key) == null) {
            return entityMappers.toDomain(entity);
        }
        entity.setAnnotationsJson(entityMappers.writeJson(annotations));
        return entityMappers.toDomain(jpaRepository.saveAndFlush(entity));
    }
    
    @Override
    @Transactional
    public void delete(ResourceIdentity identity) {
        if (jpaRepository.existsById(identity.key())) {
            jpaRepository.deleteById(identity.key());
            log.info("Deleted desired record {}", identity);
        }
    }
    
    private DesiredResourceEntity load(ResourceIdentity identity) {
        return jpaRepository.findById(identity.key())
            .orElseThrow(() -> new ResourceNotFoundException("Desired record", identity.key()));
    }
}
