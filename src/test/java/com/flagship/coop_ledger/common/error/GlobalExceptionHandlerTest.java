package com.flagship.coop_ledger.common.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Business failures answer with their own code, category and status")
    void businessFailure() {
        ResponseEntity<ErrorResponse> response = handler.handleCoopLedgerException(
            new CoopLedgerException(ErrorCode.DAY_MODIFIED, "Day changed", Map.of("version", 3)));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("DAY_MODIFIED", response.getBody().getCode());
        assertEquals(ErrorCategory.CONTENTION, response.getBody().getCategory());
        assertEquals(3, response.getBody().getDetails().get("version"));
    }

    @Test
    @DisplayName("An unexpected illegal state still carries a reason code")
    void illegalStateHasCode() {
        ResponseEntity<ErrorResponse> response =
            handler.handleIllegalState(new IllegalStateException("Settlement refers to a missing day"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("INVALID_STATE", response.getBody().getCode());
        assertEquals(ErrorCategory.INVARIANT, response.getBody().getCategory());
        assertEquals("Settlement refers to a missing day", response.getBody().getMessage());
    }

    @Test
    @DisplayName("Any other failure answers 500 INTERNAL_ERROR without leaking the cause")
    void genericFailureHasCode() {
        ResponseEntity<ErrorResponse> response =
            handler.handleGenericException(new RuntimeException("connection reset"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_ERROR", response.getBody().getCode());
        assertEquals(ErrorCategory.INVARIANT, response.getBody().getCategory());
        assertEquals("An unexpected error occurred", response.getBody().getMessage());
    }
}
