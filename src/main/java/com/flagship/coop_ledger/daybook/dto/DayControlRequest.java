package com.flagship.coop_ledger.daybook.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.time.LocalDate;

/**
 * Body of force close and reopen. Both need a reason; the approver defaults to the caller.
 * {@code date} is only read by reopen and defaults to today.
 */
@Value
public class DayControlRequest {

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("approver_id")
    String approverId;

    @JsonProperty("date")
    LocalDate date;
}
