package com.pulseanalytics.domain.service;

import com.pulseanalytics.domain.exception.InvalidCredentialException;
import com.pulseanalytics.domain.exception.UnauthenticatedException;
import com.pulseanalytics.infrastructure.persistence.entity.TenantEntity;
import com.pulseanalytics.infrastructure.persistence.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Maps an opaque API key to the tenant that owns it.
 * 
 * Runs before any tenant-scoped handler. Everything downstream receives the
 * resolved id and never derives a tenant from request content.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantResolver {
    
    private final TenantRepository tenantRepository;
    
    @Transactional(readOnly = true)
    public UUID resolve(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new UnauthenticatedException();
        }
        
        return tenantRepository.findByApiKey(apiKey.trim())
                .map(TenantEntity::getId)
                .orElseThrow(() -> {
                    log.warn("Rejected request with unknown API key");
                    return new InvalidCredentialException();
                });
    }
    
    @Transactional(readOnly = true)
    public TenantEntity describe(UUID tenantId) {
        return tenantRepository.findById(tenantId)
                .orElseThrow(InvalidCredentialException::new);
    }
}
