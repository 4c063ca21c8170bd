package com.flagship.coop_ledger.settlement;

/**
 * Status of a teller settlement.
 *
 * AUTO_APPROVED and REQUIRES_APPROVAL are set at recording time from the
 * variance thresholds. Both stay reversible until the settlement is formally
 * APPROVED or the day closes. REVERTED is terminal.
 */
public enum SettlementStatus {
    AUTO_APPROVED,
    REQUIRES_APPROVAL,
    APPROVED,
    REVERTED;

    public boolean isPending() {
        return this == AUTO_APPROVED || this == REQUIRES_APPROVAL;
    }
}
