package com.flagship.coop_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class AssignRoleRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;
}
