package com.flagship.coop_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coop_ledger.ledger.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * {@code code} is optional; without it the next code under the type's root GL head is used.
 * {@code bound_operator_id} makes the account that teller's cash drawer.
 */
@Value
public class CreateAccountRequest {

    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("group")
    boolean group;

    @JsonProperty("bound_operator_id")
    String boundOperatorId;
}
