package com.pulseanalytics.domain.service;

import com.pulseanalytics.domain.model.EventInput;
import com.pulseanalytics.domain.model.EventQueryRequest;
import com.pulseanalytics.infrastructure.persistence.entity.EventEntity;
import com.pulseanalytics.infrastructure.persistence.repository.EventRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DurableEventStore against an in-memory database.
 * 
 * Runs without a test-managed transaction so that insertAll commits or rolls
 * back on its own, exactly as it does behind the ingestion pipeline.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({DurableEventStore.class, DurableEventStoreTest.FixedClockConfig.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class DurableEventStoreTest {
    
    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final UUID TENANT_A = UUID.randomUUID();
    private static final UUID TENANT_B = UUID.randomUUID();
    
    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }
    
    @Autowired
    private DurableEventStore eventStore;
    
    @Autowired
    private EventRepository eventRepository;
    
    @AfterEach
    void cleanUp() {
        eventRepository.deleteAll();
    }
    
    @Test
    void testInsertAll_AssignsIdsAndTimestamps() {
        // Given
        EventInput withTimestamp = EventInput.builder()
                .type("signup")
                .userId("u1")
                .properties(Map.of("plan", "pro", "seats", 3))
                .timestamp("2024-03-09T08:15:00Z")
                .build();
        EventInput badTimestamp = EventInput.builder()
                .type("login")
                .timestamp("yesterday")
                .build();
        
        // When
        List<EventEntity> saved = eventStore.insertAll(TENANT_A, List.of(withTimestamp, badTimestamp));
        
        // Then
        assertEquals(2, saved.size());
        assertNotNull(saved.get(0).getId());
        assertNotEquals(saved.get(0).getId(), saved.get(1).getId());
        assertEquals(Instant.parse("2024-03-09T08:15:00Z"), saved.get(0).getTimestamp());
        assertEquals(NOW, saved.get(1).getTimestamp());
        assertEquals(NOW, saved.get(0).getCreatedAt());
        
        EventEntity reloaded = eventRepository.findById(saved.get(0).getId()).orElseThrow();
        assertEquals(TENANT_A, reloaded.getTenantId());
        assertEquals("pro", reloaded.getProperties().get("plan"));
        assertEquals(3, reloaded.getProperties().get("seats"));
    }
    
    @Test
    void testInsertAll_BatchIsAtomic() {
        // Given: the second event type exceeds the column length
        List<EventInput> batch = List.of(
                EventInput.builder().type("ok").build(),
                EventInput.builder().type("x".repeat(150)).build());
        
        // When / Then
        assertThrows(DataAccessException.class, () -> eventStore.insertAll(TENANT_A, batch));
        
        // Neither row is visible
        assertEquals(0, eventRepository.countByTenantId(TENANT_A));
    }
    
    @Test
    void testFindEvents_TenantScopedNewestFirst() {
        // Given
        eventStore.insertAll(TENANT_A, List.of(
                at("view", "u1", "2024-03-01T10:00:00Z"),
                at("click", "u2", "2024-03-02T10:00:00Z"),
                at("view", "u2", "2024-03-03T10:00:00Z")));
        eventStore.insertAll(TENANT_B, List.of(
                at("view", "u1", "2024-03-04T10:00:00Z")));
        
        // When
        EventQueryRequest all = EventQueryRequest.builder().build();
        List<EventEntity> events = eventStore.findEvents(TENANT_A, all);
        
        // Then
        assertEquals(3, events.size());
        assertTrue(events.stream().allMatch(e -> TENANT_A.equals(e.getTenantId())));
        assertEquals(Instant.parse("2024-03-03T10:00:00Z"), events.get(0).getTimestamp());
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), events.get(2).getTimestamp());
        assertEquals(3, eventStore.countEvents(TENANT_A, all));
        assertEquals(1, eventStore.countEvents(TENANT_B, all));
    }
    
    @Test
    void testFindEvents_FiltersAndPaging() {
        // Given
        eventStore.insertAll(TENANT_A, List.of(
                at("view", "u1", "2024-03-01T10:00:00Z"),
                at("click", "u2", "2024-03-02T10:00:00Z"),
                at("view", "u2", "2024-03-03T10:00:00Z"),
                at("view", "u3", "2024-03-05T10:00:00Z")));
        
        // When
        EventQueryRequest views = EventQueryRequest.builder()
                .eventType("view")
                .startTime(Instant.parse("2024-03-02T00:00:00Z"))
                .endTime(Instant.parse("2024-03-06T00:00:00Z"))
                .build();
        EventQueryRequest secondPage = EventQueryRequest.builder()
                .limit(2)
                .offset(2)
                .build();
        EventQueryRequest byUser = EventQueryRequest.builder()
                .userId("u2")
                .build();
        
        // Then
        assertEquals(List.of("u3", "u2"), users(eventStore.findEvents(TENANT_A, views)));
        assertEquals(2, eventStore.countEvents(TENANT_A, views));
        assertEquals(List.of("u2", "u1"), users(eventStore.findEvents(TENANT_A, secondPage)));
        assertEquals(2, eventStore.findEvents(TENANT_A, byUser).size());
    }
    
    @Test
    void testResolveTimestamp() {
        Instant fallback = Instant.parse("2024-01-01T00:00:00Z");
        
        assertEquals(Instant.parse("2024-02-01T10:00:00Z"),
                DurableEventStore.resolveTimestamp("2024-02-01T10:00:00Z", fallback));
        assertEquals(Instant.parse("2024-02-01T08:00:00Z"),
                DurableEventStore.resolveTimestamp("2024-02-01T10:00:00+02:00", fallback));
        assertEquals(fallback, DurableEventStore.resolveTimestamp("not a date", fallback));
        assertEquals(fallback, DurableEventStore.resolveTimestamp(null, fallback));
    }
    
    private static EventInput at(String type, String userId, String timestamp) {
        return EventInput.builder()
                .type(type)
                .userId(userId)
                .timestamp(timestamp)
                .build();
    }
    
    private static List<String> users(List<EventEntity> events) {
        return events.stream().map(EventEntity::getUserId).collect(Collectors.toList());
    }
}
