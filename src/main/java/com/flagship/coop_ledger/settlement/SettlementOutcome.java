package com.flagship.coop_ledger.settlement;

import lombok.Value;

/**
 * A settlement and whether it was recorded by an earlier call with the same key.
 */
@Value
public class SettlementOutcome {
    TellerSettlement settlement;
    boolean replayed;

    public static SettlementOutcome created(TellerSettlement settlement) {
        return new SettlementOutcome(settlement, false);
    }

    public static SettlementOutcome replayed(TellerSettlement settlement) {
        return new SettlementOutcome(settlement, true);
    }
}
