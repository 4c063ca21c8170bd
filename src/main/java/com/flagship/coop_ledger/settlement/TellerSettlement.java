package com.flagship.coop_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A recorded reconciliation of one teller's drawer against the ledger.
 *
 * {@code journalEntryIds} lists the entries the settlement posted, in posting
 * order; an unsettle reverses them last to first.
 */
@Value
public class TellerSettlement {
    UUID id;
    UUID dayBookId;
    String tenantId;
    String tellerId;
    BigDecimal physicalCash;
    BigDecimal systemCash;
    BigDecimal difference;
    SettlementStatus status;
    String settlementRef;
    boolean forceClosed;
    String attachmentRef;
    Map<String, Integer> denominations;
    List<UUID> journalEntryIds;
    String executedBy;
    Instant executedAt;
    String approvedBy;
    Instant approvedAt;
    String revertedBy;
    Instant revertedAt;
    String revertReason;
}
