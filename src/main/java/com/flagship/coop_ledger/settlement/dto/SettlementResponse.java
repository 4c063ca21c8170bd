package com.flagship.coop_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coop_ledger.settlement.SettlementStatus;
import com.flagship.coop_ledger.settlement.TellerSettlement;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("day_book_id")
    UUID dayBookId;

    @JsonProperty("teller_id")
    String tellerId;

    @JsonProperty("system_cash")
    BigDecimal systemCash;

    @JsonProperty("physical_cash")
    BigDecimal physicalCash;

    @JsonProperty("difference")
    BigDecimal difference;

    @JsonProperty("status")
    SettlementStatus status;

    @JsonProperty("settlement_ref")
    String settlementRef;

    @JsonProperty("force_closed")
    boolean forceClosed;

    @JsonProperty("denominations")
    Map<String, Integer> denominations;

    @JsonProperty("attachment_ref")
    String attachmentRef;

    @JsonProperty("journal_entry_ids")
    List<UUID> journalEntryIds;

    @JsonProperty("executed_by")
    String executedBy;

    @JsonProperty("executed_at")
    Instant executedAt;

    @JsonProperty("approved_by")
    String approvedBy;

    @JsonProperty("reverted_by")
    String revertedBy;

    @JsonProperty("revert_reason")
    String revertReason;

    public static SettlementResponse from(TellerSettlement settlement) {
        return SettlementResponse.builder()
            .id(settlement.getId())
            .dayBookId(settlement.getDayBookId())
            .tellerId(settlement.getTellerId())
            .systemCash(settlement.getSystemCash())
            .physicalCash(settlement.getPhysicalCash())
            .difference(settlement.getDifference())
            .status(settlement.getStatus())
            .settlementRef(settlement.getSettlementRef())
            .forceClosed(settlement.isForceClosed())
            .denominations(settlement.getDenominations())
            .attachmentRef(settlement.getAttachmentRef())
            .journalEntryIds(settlement.getJournalEntryIds())
            .executedBy(settlement.getExecutedBy())
            .executedAt(settlement.getExecutedAt())
            .approvedBy(settlement.getApprovedBy())
            .revertedBy(settlement.getRevertedBy())
            .revertReason(settlement.getRevertReason())
            .build();
    }
}
