package com.flagship.coop_ledger.settlement;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TellerSettlementRepository
        extends JpaRepository<TellerSettlementEntity, UUID>, JpaSpecificationExecutor<TellerSettlementEntity> {

    /**
     * Idempotency lookup; the database is the source of truth for used keys.
     */
    Optional<TellerSettlementEntity> findByTenantIdAndSettlementRef(String tenantId, String settlementRef);

    /**
     * Day of a settlement without loading it, so a later locking read returns fresh state.
     */
    @Query("SELECT s.dayBookId FROM TellerSettlementEntity s WHERE s.id = :id AND s.tenantId = :tenantId")
    Optional<UUID> findDayBookId(@Param("tenantId") String tenantId, @Param("id") UUID id);

    List<TellerSettlementEntity> findByDayBookIdOrderByExecutedAtAsc(UUID dayBookId);

    /**
     * Row-locks a settlement so two unsettle or approve calls cannot both act on it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM TellerSettlementEntity s WHERE s.id = :id")
    Optional<TellerSettlementEntity> findByIdForUpdate(@Param("id") UUID id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE TellerSettlementEntity s
        SET s.forceClosed = true, s.updatedAt = :now
        WHERE s.dayBookId = :dayBookId AND s.status IN :statuses
        """)
    int markForceClosed(@Param("dayBookId") UUID dayBookId,
                        @Param("statuses") Collection<SettlementStatus> statuses,
                        @Param("now") Instant now);
}
