package com.platform.resourcecontroller.persistence.repository;

import com.platform.resourcecontroller.persistence.entity.DesiredResourceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for desired resource records.
 */
@Repository
public interface DesiredResourceJpaRepository extends JpaRepository<DesiredResourceEntity, String> {
    
    /**
     * Candidate records whose annotation JSON contains the fragment. Callers
     * re-check the parsed annotations.
     */
    List<DesiredResourceEntity> findByAnnotationsJsonContaining(String fragment);
    
    /**
     * Keys of all stored records, without loading their bodies.
     */
    @Query("SELECT d.resourceKey FROM DesiredResourceEntity d ORDER BY d.resourceKey")
    List<String> findAllKeys();
}
