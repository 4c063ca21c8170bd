package com.flagship.coop_ledger.daybook;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Day book persistence.
 *
 * The update methods are compare-and-swap: they match id, expected status and
 * expected version, bump the version, and return the number of rows changed.
 * Zero means another writer moved the row first. They flush pending changes
 * before running and clear the persistence context afterwards, so the next read
 * sees the row as the database holds it.
 */
@Repository
public interface DayBookRepository extends JpaRepository<DayBookEntity, UUID> {

    Optional<DayBookEntity> findByTenantIdAndBusinessDate(String tenantId, LocalDate businessDate);

    Optional<DayBookEntity> findFirstByTenantIdAndStatus(String tenantId, DayBookStatus status);

    Optional<DayBookEntity> findFirstByTenantIdAndStatusIn(String tenantId, Collection<DayBookStatus> statuses);

    Optional<DayBookEntity> findFirstByTenantIdAndBusinessDateBeforeOrderByBusinessDateDesc(
        String tenantId, LocalDate businessDate);

    Optional<DayBookEntity> findFirstByTenantIdOrderByBusinessDateDesc(String tenantId);

    long countByStatus(DayBookStatus status);

    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT d FROM DayBookEntity d WHERE d.tenantId = :tenantId AND d.status = :status")
    Optional<DayBookEntity> findByTenantIdAndStatusForShare(@Param("tenantId") String tenantId,
                                                            @Param("status") DayBookStatus status);

    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT d FROM DayBookEntity d WHERE d.id = :id")
    Optional<DayBookEntity> findByIdForShare(@Param("id") UUID id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE DayBookEntity d
        SET d.status = :target, d.version = d.version + 1, d.updatedAt = :now
        WHERE d.id = :id AND d.status = :expected AND d.version = :version
        """)
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("expected") DayBookStatus expected,
                            @Param("version") long version,
                            @Param("target") DayBookStatus target,
                            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE DayBookEntity d
        SET d.status = :target, d.closingCash = :closingCash, d.transactionsCount = :transactionsCount,
            d.dayEndBy = :actor, d.forceCloseReason = :forceCloseReason, d.closedAt = :now,
            d.updatedAt = :now, d.version = d.version + 1
        WHERE d.id = :id AND d.status = :expected AND d.version = :version
        """)
    int completeClose(@Param("id") UUID id,
                      @Param("expected") DayBookStatus expected,
                      @Param("version") long version,
                      @Param("target") DayBookStatus target,
                      @Param("closingCash") BigDecimal closingCash,
                      @Param("transactionsCount") int transactionsCount,
                      @Param("actor") String actor,
                      @Param("forceCloseReason") String forceCloseReason,
                      @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE DayBookEntity d
        SET d.status = :target, d.dayBeginBy = :dayBeginBy, d.reopenReason = :reason,
            d.closingCash = NULL, d.dayEndBy = NULL, d.closedAt = NULL,
            d.updatedAt = :now, d.version = d.version + 1
        WHERE d.id = :id AND d.status = :expected AND d.version = :version
        """)
    int reopen(@Param("id") UUID id,
               @Param("expected") DayBookStatus expected,
               @Param("version") long version,
               @Param("target") DayBookStatus target,
               @Param("dayBeginBy") String dayBeginBy,
               @Param("reason") String reason,
               @Param("now") Instant now);
}
