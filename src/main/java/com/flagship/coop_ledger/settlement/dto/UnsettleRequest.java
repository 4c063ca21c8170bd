package com.flagship.coop_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class UnsettleRequest {

    @NotNull(message = "Settlement ID is required")
    @JsonProperty("settlement_id")
    UUID settlementId;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
