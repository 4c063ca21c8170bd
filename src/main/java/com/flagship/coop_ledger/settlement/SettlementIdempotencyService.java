package com.flagship.coop_ledger.settlement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Settlement reference lookup for idempotent settle calls.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable or disabled)
 * 2. Fall back to the unique (tenant, settlement_ref) column, the source of truth
 * 3. Cache a database hit in Redis for the next lookup
 *
 * Keys are scoped per tenant, so two tenants may reuse the same token.
 */
@Service
@Slf4j
public class SettlementIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "settlement-ref:";

    private final TellerSettlementRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean redisEnabled;
    private final Duration ttl;

    public SettlementIdempotencyService(TellerSettlementRepository repository,
                                        Optional<StringRedisTemplate> redisTemplate,
                                        @Value("${coop-ledger.idempotency.redis-enabled:true}") boolean redisEnabled,
                                        @Value("${coop-ledger.idempotency.ttl:7d}") Duration ttl) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
        this.redisEnabled = redisEnabled;
        this.ttl = ttl;
    }

    /**
     * The settlement already recorded under {@code settlementRef}, if any.
     */
    public Optional<TellerSettlementEntity> findExisting(String tenantId, String settlementRef) {
        if (settlementRef == null || settlementRef.isBlank()) {
            throw new IllegalArgumentException("Settlement reference cannot be null or blank");
        }

        Optional<UUID> cached = readCache(tenantId, settlementRef);
        if (cached.isPresent()) {
            Optional<TellerSettlementEntity> hit = repository.findById(cached.get())
                .filter(settlement -> settlement.getTenantId().equals(tenantId));
            if (hit.isPresent()) {
                log.debug("Settlement reference found in Redis: {}", settlementRef);
                return hit;
            }
            log.warn("Stale settlement reference in Redis: ref={}, settlementId={}", settlementRef, cached.get());
        }

        Optional<TellerSettlementEntity> existing = repository.findByTenantIdAndSettlementRef(tenantId, settlementRef);
        existing.ifPresent(settlement -> {
            log.debug("Settlement reference found in database: {}", settlementRef);
            writeCache(tenantId, settlementRef, settlement.getId());
        });
        return existing;
    }

    /**
     * Caches a new reference once the settlement has committed. A rolled-back
     * settlement never reaches Redis.
     */
    public void remember(String tenantId, String settlementRef, UUID settlementId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            writeCache(tenantId, settlementRef, settlementId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                writeCache(tenantId, settlementRef, settlementId);
            }
        });
    }

    private Optional<UUID> readCache(String tenantId, String settlementRef) {
        if (!redisEnabled || redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(redisKey(tenantId, settlementRef));
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (Exception e) {
            log.warn("Redis lookup failed for settlement reference: {}. Falling back to database. Error: {}",
                settlementRef, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String tenantId, String settlementRef, UUID settlementId) {
        if (!redisEnabled || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(tenantId, settlementRef), settlementId.toString(), ttl);
        } catch (Exception e) {
            log.warn("Failed to cache settlement reference in Redis: {}. Error: {}", settlementRef, e.getMessage());
        }
    }

    private static String redisKey(String tenantId, String settlementRef) {
        return REDIS_KEY_PREFIX + tenantId + ":" + settlementRef;
    }
}
