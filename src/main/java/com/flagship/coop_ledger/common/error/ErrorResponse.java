package com.flagship.coop_ledger.common.error;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error body.
 */
@Value
@Builder
public class ErrorResponse {
    String error;
    String code;
    ErrorCategory category;
    String message;
    Map<String, ?> details;
    Instant timestamp;
}
