package com.flagship.coop_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class PostJournalRequest {

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @NotEmpty(message = "At least one line is required")
    @Valid
    @JsonProperty("lines")
    List<Line> lines;

    @Value
    public static class Line {

        @NotNull(message = "Account ID is required")
        @JsonProperty("account_id")
        UUID accountId;

        @DecimalMin(value = "0", message = "Debit must not be negative")
        @Digits(integer = 15, fraction = 4, message = "Debit allows at most 4 decimal places")
        @JsonProperty("debit")
        BigDecimal debit;

        @DecimalMin(value = "0", message = "Credit must not be negative")
        @Digits(integer = 15, fraction = 4, message = "Credit allows at most 4 decimal places")
        @JsonProperty("credit")
        BigDecimal credit;
    }
}
