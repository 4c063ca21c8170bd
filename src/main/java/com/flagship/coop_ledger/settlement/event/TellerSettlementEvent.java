package com.flagship.coop_ledger.settlement.event;

import com.flagship.coop_ledger.outbox.DomainEvent;
import com.flagship.coop_ledger.settlement.SettlementStatus;
import com.flagship.coop_ledger.settlement.TellerSettlement;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Lifecycle event of a teller settlement, published to the day-book topic.
 * The approval workflow listens for {@code TellerSettlementRecorded} with
 * status REQUIRES_APPROVAL.
 */
@Value
public class TellerSettlementEvent implements DomainEvent {
    UUID eventId;
    String eventType;
    String tenantId;
    UUID settlementId;
    UUID dayBookId;
    String tellerId;
    BigDecimal systemCash;
    BigDecimal physicalCash;
    BigDecimal difference;
    SettlementStatus status;
    String settlementRef;
    List<UUID> journalEntryIds;
    String actorId;
    String reason;
    Instant occurredAt;

    public static final String RECORDED = "TellerSettlementRecorded";
    public static final String REVERTED = "TellerSettlementReverted";
    public static final String APPROVED = "TellerSettlementApproved";
    public static final String AGGREGATE_TYPE = "TellerSettlement";

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return settlementId;
    }

    public static TellerSettlementEvent recorded(TellerSettlement settlement) {
        return of(RECORDED, settlement, settlement.getExecutedBy(), null);
    }

    public static TellerSettlementEvent reverted(TellerSettlement settlement) {
        return of(REVERTED, settlement, settlement.getRevertedBy(), settlement.getRevertReason());
    }

    public static TellerSettlementEvent approved(TellerSettlement settlement) {
        return of(APPROVED, settlement, settlement.getApprovedBy(), null);
    }

    private static TellerSettlementEvent of(String eventType, TellerSettlement settlement,
                                            String actorId, String reason) {
        return new TellerSettlementEvent(
            UUID.randomUUID(),
            eventType,
            settlement.getTenantId(),
            settlement.getId(),
            settlement.getDayBookId(),
            settlement.getTellerId(),
            settlement.getSystemCash(),
            settlement.getPhysicalCash(),
            settlement.getDifference(),
            settlement.getStatus(),
            settlement.getSettlementRef(),
            settlement.getJournalEntryIds(),
            actorId,
            reason,
            Instant.now()
        );
    }
}
