package com.pulseanalytics.infrastructure.persistence.repository;

import com.pulseanalytics.infrastructure.persistence.entity.EventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Relational access to events.
 * 
 * Every query takes the tenant id as its first filter. Nothing here reads
 * across tenants.
 */
@Repository
public interface EventRepository extends JpaRepository<EventEntity, UUID> {
    
    /**
     * Listing query for the simplified /events path.
     * 
     * Newest first; offset/limit come from the pageable.
     */
    @Query("SELECT e FROM EventEntity e WHERE " +
           "e.tenantId = :tenantId AND " +
           "(:userId IS NULL OR e.userId = :userId) AND " +
           "(:eventType IS NULL OR e.eventType = :eventType) AND " +
           "e.timestamp BETWEEN :startTime AND :endTime " +
           "ORDER BY e.timestamp DESC")
    List<EventEntity> findTenantEvents(
            @Param("tenantId") UUID tenantId,
            @Param("userId") String userId,
            @Param("eventType") String eventType,
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime,
            Pageable pageable
    );
    
    @Query("SELECT COUNT(e) FROM EventEntity e WHERE " +
           "e.tenantId = :tenantId AND " +
           "(:userId IS NULL OR e.userId = :userId) AND " +
           "(:eventType IS NULL OR e.eventType = :eventType) AND " +
           "e.timestamp BETWEEN :startTime AND :endTime")
    long countTenantEvents(
            @Param("tenantId") UUID tenantId,
            @Param("userId") String userId,
            @Param("eventType") String eventType,
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime
    );
    
    long countByTenantId(UUID tenantId);
}
