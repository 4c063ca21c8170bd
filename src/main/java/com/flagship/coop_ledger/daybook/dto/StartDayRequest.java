package com.flagship.coop_ledger.daybook.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.LocalDate;

/**
 * {@code date} defaults to today in the business zone.
 */
@Value
public class StartDayRequest {

    @JsonProperty("date")
    LocalDate date;
}
