package com.flagship.coop_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A committed, immutable journal entry. Corrections are new reversing entries.
 */
@Value
public class JournalEntry {
    UUID id;
    String tenantId;
    String entryNumber;
    String description;
    LocalDateTime effectiveDate;
    Instant createdAt;
}
