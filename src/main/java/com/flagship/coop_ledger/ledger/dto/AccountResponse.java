package com.flagship.coop_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coop_ledger.ledger.Account;
import com.flagship.coop_ledger.ledger.AccountType;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("group")
    boolean group;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("bound_operator_id")
    String boundOperatorId;

    @JsonProperty("balance")
    BigDecimal balance;

    public static AccountResponse from(Account account, BigDecimal balance) {
        return new AccountResponse(account.getId(), account.getCode(), account.getName(),
            account.getAccountType(), account.isGroup(), account.isActive(), account.getBoundOperatorId(), balance);
    }
}
