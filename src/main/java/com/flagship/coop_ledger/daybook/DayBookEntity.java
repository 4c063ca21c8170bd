package com.flagship.coop_ledger.daybook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA mapping of {@code day_books}.
 *
 * No setters: after insert, every change goes through a conditional update in
 * {@link DayBookRepository} that matches id, status and version in one statement.
 * {@code version} is therefore a plain column rather than a JPA {@code @Version}.
 */
@Entity
@Table(name = "day_books")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DayBookEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
    private String tenantId;

    @Column(name = "business_date", nullable = false, updatable = false)
    private LocalDate businessDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DayBookStatus status;

    @Column(name = "opening_cash", nullable = false, precision = 19, scale = 4)
    private BigDecimal openingCash;

    @Column(name = "closing_cash", precision = 19, scale = 4)
    private BigDecimal closingCash;

    @Column(name = "transactions_count", nullable = false)
    private int transactionsCount;

    @Column(name = "day_begin_by", nullable = false, length = 64)
    private String dayBeginBy;

    @Column(name = "day_end_by", length = 64)
    private String dayEndBy;

    @Column(name = "force_close_reason", columnDefinition = "TEXT")
    private String forceCloseReason;

    @Column(name = "reopen_reason", columnDefinition = "TEXT")
    private String reopenReason;

    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    /**
     * A freshly begun day at version 1.
     */
    static DayBookEntity open(String tenantId, LocalDate businessDate, BigDecimal openingCash, String actor) {
        DayBookEntity entity = new DayBookEntity();
        entity.id = UUID.randomUUID();
        entity.tenantId = tenantId;
        entity.businessDate = businessDate;
        entity.status = DayBookStatus.OPEN;
        entity.openingCash = openingCash;
        entity.transactionsCount = 0;
        entity.dayBeginBy = actor;
        entity.version = 1;
        entity.createdAt = Instant.now();
        entity.updatedAt = entity.createdAt;
        return entity;
    }

    public DayBook toDomain() {
        return new DayBook(
            id,
            tenantId,
            businessDate,
            status,
            openingCash,
            closingCash,
            transactionsCount,
            dayBeginBy,
            dayEndBy,
            forceCloseReason,
            reopenReason,
            version,
            createdAt,
            updatedAt,
            closedAt
        );
    }
}
