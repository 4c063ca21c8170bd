package com.flagship.coop_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Body of settle and settle preview. {@code idempotency_key} is ignored by preview.
 */
@Value
public class SettleRequest {

    @NotBlank(message = "Teller ID is required")
    @JsonProperty("teller_id")
    String tellerId;

    @NotNull(message = "Physical cash is required")
    @DecimalMin(value = "0", message = "Physical cash must not be negative")
    @Digits(integer = 15, fraction = 4, message = "Physical cash allows at most 4 decimal places")
    @JsonProperty("physical_cash")
    BigDecimal physicalCash;

    @JsonProperty("denominations")
    Map<String, Integer> denominations;

    @JsonProperty("attachment_ref")
    String attachmentRef;

    @JsonProperty("idempotency_key")
    String idempotencyKey;
}
