package com.flagship.coop_ledger.settlement;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JPA mapping of {@code teller_settlements}.
 *
 * Figures and the produced journal entries are written once and never updated.
 * Only the status fields move afterwards, through {@link #approve} and
 * {@link #revert}, which guard the transition themselves.
 */
@Entity
@Table(name = "teller_settlements")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TellerSettlementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "day_book_id", nullable = false, updatable = false)
    private UUID dayBookId;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
    private String tenantId;

    @Column(name = "teller_id", nullable = false, updatable = false, length = 64)
    private String tellerId;

    @Column(name = "physical_cash", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal physicalCash;

    @Column(name = "system_cash", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal systemCash;

    @Column(name = "difference", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal difference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SettlementStatus status;

    @Column(name = "settlement_ref", nullable = false, updatable = false, length = 200)
    private String settlementRef;

    @Column(name = "force_closed", nullable = false)
    private boolean forceClosed;

    @Column(name = "attachment_ref", updatable = false, columnDefinition = "TEXT")
    private String attachmentRef;

    @Column(name = "denominations", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Integer> denominations;

    @ElementCollection
    @CollectionTable(name = "teller_settlement_journal_entries",
        joinColumns = @JoinColumn(name = "settlement_id"))
    @OrderColumn(name = "position")
    @Column(name = "journal_entry_id", nullable = false)
    private List<UUID> journalEntryIds = new ArrayList<>();

    @Column(name = "executed_by", nullable = false, updatable = false, length = 64)
    private String executedBy;

    @Column(name = "executed_at", nullable = false, updatable = false)
    private Instant executedAt;

    @Column(name = "approved_by", length = 64)
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "reverted_by", length = 64)
    private String revertedBy;

    @Column(name = "reverted_at")
    private Instant revertedAt;

    @Column(name = "revert_reason", columnDefinition = "TEXT")
    private String revertReason;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static TellerSettlementEntity record(UUID dayBookId, String tenantId, String tellerId,
                                         SettlementFigures figures, String settlementRef,
                                         String attachmentRef, Map<String, Integer> denominations,
                                         List<UUID> journalEntryIds, String executedBy) {
        TellerSettlementEntity entity = new TellerSettlementEntity();
        entity.id = UUID.randomUUID();
        entity.dayBookId = dayBookId;
        entity.tenantId = tenantId;
        entity.tellerId = tellerId;
        entity.physicalCash = figures.getPhysicalCash();
        entity.systemCash = figures.getSystemCash();
        entity.difference = figures.getDifference();
        entity.status = figures.getStatus();
        entity.settlementRef = settlementRef;
        entity.attachmentRef = attachmentRef;
        entity.denominations = denominations;
        entity.journalEntryIds = new ArrayList<>(journalEntryIds);
        entity.executedBy = executedBy;
        entity.executedAt = Instant.now();
        entity.updatedAt = entity.executedAt;
        return entity;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    void approve(String approver) {
        requirePending(SettlementStatus.APPROVED);
        this.status = SettlementStatus.APPROVED;
        this.approvedBy = approver;
        this.approvedAt = Instant.now();
    }

    void revert(String actor, String reason) {
        requirePending(SettlementStatus.REVERTED);
        this.status = SettlementStatus.REVERTED;
        this.revertedBy = actor;
        this.revertReason = reason;
        this.revertedAt = Instant.now();
    }

    private void requirePending(SettlementStatus target) {
        if (!status.isPending()) {
            throw new IllegalStateException(
                String.format("Settlement %s cannot move from %s to %s", id, status, target));
        }
    }

    public TellerSettlement toDomain() {
        return new TellerSettlement(
            id,
            dayBookId,
            tenantId,
            tellerId,
            physicalCash,
            systemCash,
            difference,
            status,
            settlementRef,
            forceClosed,
            attachmentRef,
            denominations,
            List.copyOf(journalEntryIds),
            executedBy,
            executedAt,
            approvedBy,
            approvedAt,
            revertedBy,
            revertedAt,
            revertReason
        );
    }
}
