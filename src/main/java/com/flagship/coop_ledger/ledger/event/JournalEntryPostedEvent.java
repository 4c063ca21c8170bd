package com.flagship.coop_ledger.ledger.event;

import com.flagship.coop_ledger.ledger.Account;
import com.flagship.coop_ledger.ledger.JournalEntry;
import com.flagship.coop_ledger.ledger.LedgerLine;
import com.flagship.coop_ledger.outbox.DomainEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Published once per committed journal entry.
 *
 * AML and transaction monitoring consume this from the ledger topic, so it
 * carries every line with the account code and resulting balance.
 */
@Value
public class JournalEntryPostedEvent implements DomainEvent {
    UUID eventId;
    String tenantId;
    UUID journalEntryId;
    String entryNumber;
    String description;
    LocalDateTime effectiveDate;
    BigDecimal totalAmount;
    List<Line> lines;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryPosted";
    public static final String AGGREGATE_TYPE = "JournalEntry";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return journalEntryId;
    }

    public static JournalEntryPostedEvent from(JournalEntry entry, List<LedgerLine> ledgerLines,
                                               Map<UUID, Account> accounts) {
        List<Line> lines = ledgerLines.stream()
            .map(line -> new Line(
                line.getAccountId(),
                accounts.get(line.getAccountId()).getCode(),
                line.getDebit(),
                line.getCredit(),
                line.getBalance()))
            .toList();
        BigDecimal total = ledgerLines.stream()
            .map(LedgerLine::getDebit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getTenantId(),
            entry.getId(),
            entry.getEntryNumber(),
            entry.getDescription(),
            entry.getEffectiveDate(),
            total,
            lines,
            Instant.now()
        );
    }

    @Value
    public static class Line {
        UUID accountId;
        String accountCode;
        BigDecimal debit;
        BigDecimal credit;
        BigDecimal balance;
    }
}
