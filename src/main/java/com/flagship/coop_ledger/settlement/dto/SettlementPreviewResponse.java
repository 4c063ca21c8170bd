package com.flagship.coop_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coop_ledger.settlement.SettlementPlan;
import com.flagship.coop_ledger.settlement.SettlementStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class SettlementPreviewResponse {

    @JsonProperty("teller_account_id")
    UUID tellerAccountId;

    @JsonProperty("teller_account_code")
    String tellerAccountCode;

    @JsonProperty("system_cash")
    BigDecimal systemCash;

    @JsonProperty("physical_cash")
    BigDecimal physicalCash;

    @JsonProperty("difference")
    BigDecimal difference;

    @JsonProperty("requires_approval")
    boolean requiresApproval;

    @JsonProperty("status")
    SettlementStatus status;

    @JsonProperty("proposed_entries")
    List<ProposedEntry> proposedEntries;

    public static SettlementPreviewResponse from(SettlementPlan plan) {
        List<ProposedEntry> entries = plan.getEntries().stream()
            .map(entry -> new ProposedEntry(entry.getDescription(), entry.getLines().stream()
                .map(line -> new ProposedLine(line.getAccount().getId(), line.getAccount().getCode(),
                    line.getAccount().getName(), line.getDebit(), line.getCredit()))
                .toList()))
            .toList();
        return new SettlementPreviewResponse(
            plan.getTellerAccount().getId(),
            plan.getTellerAccount().getCode(),
            plan.getFigures().getSystemCash(),
            plan.getFigures().getPhysicalCash(),
            plan.getFigures().getDifference(),
            plan.getFigures().isRequiresApproval(),
            plan.getFigures().getStatus(),
            entries
        );
    }

    @Value
    public static class ProposedEntry {
        @JsonProperty("description")
        String description;

        @JsonProperty("lines")
        List<ProposedLine> lines;
    }

    @Value
    public static class ProposedLine {
        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("account_code")
        String accountCode;

        @JsonProperty("account_name")
        String accountName;

        @JsonProperty("debit")
        BigDecimal debit;

        @JsonProperty("credit")
        BigDecimal credit;
    }
}
