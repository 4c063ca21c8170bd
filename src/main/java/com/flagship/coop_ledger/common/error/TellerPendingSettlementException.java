package com.flagship.coop_ledger.common.error;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Raised by day close when teller drawers still hold unsettled cash.
 */
public class TellerPendingSettlementException extends CoopLedgerException {

    private final List<PendingTeller> pendingTellers;

    public TellerPendingSettlementException(List<PendingTeller> pendingTellers) {
        super(ErrorCode.TELLER_PENDING_SETTLEMENT,
            String.format("Cannot close day: %d teller account(s) still hold a balance", pendingTellers.size()),
            Map.of("pendingTellers", pendingTellers));
        this.pendingTellers = List.copyOf(pendingTellers);
    }

    public List<PendingTeller> getPendingTellers() {
        return pendingTellers;
    }

    @Value
    public static class PendingTeller {
        UUID accountId;
        String code;
        String name;
        BigDecimal balance;
    }
}
