package com.pulseanalytics.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Short-lived Redis cache for dashboard aggregation results.
 * 
 * Keys always start with the tenant id, so one tenant can never be served
 * another tenant's cached result.
 * 
 * Staleness: the aggregation index is already eventually consistent, so a
 * cached dashboard lagging a few seconds behind ingestion is within the
 * contract. TTLs are kept short (app.cache.ttl.analytics).
 * 
 * Failure Handling:
 * - Redis errors propagate to the circuit breaker ("redis" instance)
 * - Fallbacks turn them into a cache miss / skipped write, so a Redis outage
 *   only costs latency
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {
    
    private static final String KEY_PREFIX = "pulse:query";
    
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    
    @Value("${app.cache.enabled:true}")
    private boolean enabled;
    
    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        if (!enabled) {
            return Optional.empty();
        }
        
        String cached = redisTemplate.opsForValue().get(key);
        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }
        
        try {
            T value = objectMapper.readValue(cached, type);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(value);
        } catch (JsonProcessingException e) {
            // Written by an older shape of the type; treat as a miss and let it expire
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }
    
    @CircuitBreaker(name = "redis", fallbackMethod = "setFallback")
    public void set(String key, Object value, long ttlSeconds) {
        if (!enabled || ttlSeconds <= 0) {
            return;
        }
        
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Result for {} is not cacheable: {}", key, e.getOriginalMessage());
            return;
        }
        redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
        log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);
    }
    
    /**
     * Tenant-scoped key: pulse:query:{tenant}:{operation}:{param}:...
     */
    public String tenantKey(UUID tenantId, String operation, Object... params) {
        StringBuilder key = new StringBuilder(KEY_PREFIX)
                .append(':').append(tenantId)
                .append(':').append(operation);
        for (Object param : params) {
            key.append(':').append(param != null ? param.toString() : "null");
        }
        return key.toString();
    }
    
    // Fallback methods (circuit breaker)
    
    private <T> Optional<T> getFallback(String key, Class<T> type, Exception e) {
        log.warn("Cache read skipped for {}: {}", key, e.getMessage());
        return Optional.empty();
    }
    
    private void setFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Cache write skipped for {}: {}", key, e.getMessage());
    }
}
