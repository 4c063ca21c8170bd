package com.flagship.coop_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Counted cash against ledger cash for one teller, and the status that variance earns.
 */
@Value
public class SettlementFigures {
    BigDecimal systemCash;
    BigDecimal physicalCash;
    BigDecimal difference;
    boolean requiresApproval;

    public SettlementStatus getStatus() {
        return requiresApproval ? SettlementStatus.REQUIRES_APPROVAL : SettlementStatus.AUTO_APPROVED;
    }

    public VarianceType getVarianceType() {
        return switch (difference.signum()) {
            case -1 -> VarianceType.SHORTAGE;
            case 1 -> VarianceType.OVERAGE;
            default -> VarianceType.NONE;
        };
    }

    public enum VarianceType {
        SHORTAGE,
        OVERAGE,
        NONE
    }
}
