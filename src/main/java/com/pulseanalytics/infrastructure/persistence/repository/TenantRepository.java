package com.pulseanalytics.infrastructure.persistence.repository;

import com.pulseanalytics.infrastructure.persistence.entity.TenantEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TenantRepository extends JpaRepository<TenantEntity, UUID> {
    
    Optional<TenantEntity> findByApiKey(String apiKey);
}
