package com.flagship.coop_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Request to post one journal entry.
 *
 * Invariant checked by {@link LedgerService}: total debits equal total credits
 * within {@link LedgerService#EPSILON}.
 */
@Value
public class JournalRequest {
    String tenantId;
    String description;
    List<JournalLine> lines;
    LocalDateTime effectiveDate;

    public JournalRequest(String tenantId, String description, List<JournalLine> lines,
                          LocalDateTime effectiveDate) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.description = Objects.requireNonNull(description, "description");
        this.effectiveDate = Objects.requireNonNull(effectiveDate, "effectiveDate");
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("A journal entry needs at least one line");
        }
        this.lines = List.copyOf(lines);
    }

    public BigDecimal getDebitTotal() {
        return lines.stream()
            .map(JournalLine::getDebit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return lines.stream()
            .map(JournalLine::getCredit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isBalanced(BigDecimal tolerance) {
        return getDebitTotal().subtract(getCreditTotal()).abs().compareTo(tolerance) <= 0;
    }
}
