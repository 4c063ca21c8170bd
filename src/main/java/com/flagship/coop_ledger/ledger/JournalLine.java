package com.flagship.coop_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * One requested line of a journal entry. At most one side may be positive.
 * Amounts carry at most {@link #MONEY_SCALE} decimal places, the precision of the money columns.
 */
@Value
public class JournalLine {
    public static final int MONEY_SCALE = 4;

    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;

    private JournalLine(UUID accountId, BigDecimal debit, BigDecimal credit) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.debit = Objects.requireNonNull(debit, "debit");
        this.credit = Objects.requireNonNull(credit, "credit");
        if (debit.signum() < 0 || credit.signum() < 0) {
            throw new IllegalArgumentException("Debit and credit must not be negative");
        }
        if (debit.signum() > 0 && credit.signum() > 0) {
            throw new IllegalArgumentException("A line cannot carry both a debit and a credit");
        }
        if (exceedsMoneyScale(debit) || exceedsMoneyScale(credit)) {
            throw new IllegalArgumentException(
                "Amounts are limited to " + MONEY_SCALE + " decimal places: debit=" + debit + ", credit=" + credit);
        }
    }

    public static boolean exceedsMoneyScale(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() > MONEY_SCALE;
    }

    public static JournalLine of(UUID accountId, BigDecimal debit, BigDecimal credit) {
        return new JournalLine(accountId, debit, credit);
    }

    public static JournalLine debit(UUID accountId, BigDecimal amount) {
        return new JournalLine(accountId, amount, BigDecimal.ZERO);
    }

    public static JournalLine credit(UUID accountId, BigDecimal amount) {
        return new JournalLine(accountId, BigDecimal.ZERO, amount);
    }
}
