package com.flagship.coop_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Input of a settle or preview call. {@code idempotencyKey} becomes the settlement
 * reference; without one a reference is generated and the call is not repeatable.
 */
@Value
@Builder
public class SettleCommand {
    String tenantId;
    String tellerId;
    BigDecimal physicalCash;
    String actorId;
    Map<String, Integer> denominations;
    String attachmentRef;
    String idempotencyKey;

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null && !idempotencyKey.isBlank();
    }
}
