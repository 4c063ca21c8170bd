package com.flagship.coop_ledger.ledger;

import java.math.BigDecimal;

/**
 * Account classes of the chart of accounts.
 *
 * Each class has a normal side and owns one leading digit of the GL head
 * (1xxxx assets through 5xxxx expenses).
 */
public enum AccountType {
    ASSET(EntryType.DEBIT, 1),
    LIABILITY(EntryType.CREDIT, 2),
    EQUITY(EntryType.CREDIT, 3),
    REVENUE(EntryType.CREDIT, 4),
    EXPENSE(EntryType.DEBIT, 5);

    private final EntryType normalSide;
    private final int glHeadDigit;

    AccountType(EntryType normalSide, int glHeadDigit) {
        this.normalSide = normalSide;
        this.glHeadDigit = glHeadDigit;
    }

    public EntryType normalSide() {
        return normalSide;
    }

    public int glHeadDigit() {
        return glHeadDigit;
    }

    /**
     * Root GL head for this class, e.g. {@code 10000} for assets.
     */
    public String defaultGlHead() {
        return glHeadDigit + "0000";
    }

    /**
     * Change in balance caused by one line posted to an account of this type.
     */
    public BigDecimal signedDelta(BigDecimal debit, BigDecimal credit) {
        return normalSide == EntryType.DEBIT
            ? debit.subtract(credit)
            : credit.subtract(debit);
    }
}
