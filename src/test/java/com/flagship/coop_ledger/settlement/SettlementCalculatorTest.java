package com.flagship.coop_ledger.settlement;

import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import com.flagship.coop_ledger.ledger.Account;
import com.flagship.coop_ledger.ledger.AccountType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SettlementCalculatorTest {

    private final SettlementCalculator calculator =
        new SettlementCalculator(new BigDecimal("1000"), new BigDecimal("0.01"));

    private final Account teller = account("00-10200-01-00001", "Teller Cash T1", "T1");
    private final Account staffReceivable = account("00-10400-01-00001", "Staff Receivable", null);
    private final Account sundryIncome = account("00-40900-01-00001", "Sundry Income", null);
    private final Account vault = account("00-10100-01-00001", "Main Vault", null);

    @Test
    @DisplayName("Shortage of 50 on 1000 exceeds 1% and requires approval")
    void relativeThreshold() {
        SettlementFigures figures = calculator.figures(new BigDecimal("1000"), new BigDecimal("950"));

        assertEquals(0, new BigDecimal("-50").compareTo(figures.getDifference()));
        assertEquals(SettlementFigures.VarianceType.SHORTAGE, figures.getVarianceType());
        assertTrue(figures.isRequiresApproval());
        assertEquals(SettlementStatus.REQUIRES_APPROVAL, figures.getStatus());
    }

    @Test
    @DisplayName("Shortage of 50 on 10000 is within both thresholds")
    void withinThresholds() {
        SettlementFigures figures = calculator.figures(new BigDecimal("10000"), new BigDecimal("9950"));

        assertFalse(figures.isRequiresApproval());
        assertEquals(SettlementStatus.AUTO_APPROVED, figures.getStatus());
    }

    @Test
    @DisplayName("Variance above the absolute threshold requires approval whatever the percentage")
    void absoluteThreshold() {
        SettlementFigures figures = calculator.figures(new BigDecimal("500000"), new BigDecimal("498500"));

        assertTrue(figures.isRequiresApproval());
    }

    @Test
    @DisplayName("With zero system cash only the absolute threshold applies")
    void zeroSystemCash() {
        SettlementFigures small = calculator.figures(BigDecimal.ZERO, new BigDecimal("10"));
        SettlementFigures large = calculator.figures(BigDecimal.ZERO, new BigDecimal("1500"));

        assertEquals(SettlementFigures.VarianceType.OVERAGE, small.getVarianceType());
        assertFalse(small.isRequiresApproval());
        assertTrue(large.isRequiresApproval());
    }

    @Test
    @DisplayName("Denomination breakdown must add up to the counted cash")
    void denominations() {
        assertDoesNotThrow(() -> calculator.checkDenominations(Map.of("1000", 3, "500", 1), new BigDecimal("3500")));
        assertDoesNotThrow(() -> calculator.checkDenominations(null, new BigDecimal("3500")));

        CoopLedgerException mismatch = assertThrows(CoopLedgerException.class,
            () -> calculator.checkDenominations(Map.of("1000", 3), new BigDecimal("3500")));
        assertEquals(ErrorCode.DENOMINATION_MISMATCH, mismatch.getCode());

        CoopLedgerException negative = assertThrows(CoopLedgerException.class,
            () -> calculator.checkDenominations(Map.of("1000", -1), new BigDecimal("-1000")));
        assertEquals(ErrorCode.DENOMINATION_MISMATCH, negative.getCode());

        CoopLedgerException notNumber = assertThrows(CoopLedgerException.class,
            () -> calculator.checkDenominations(Map.of("coins", 1), new BigDecimal("1")));
        assertEquals(ErrorCode.DENOMINATION_MISMATCH, notNumber.getCode());
    }

    @Test
    @DisplayName("Shortage plan: staff receivable entry, then vault transfer; teller nets to minus system cash")
    void shortagePlan() {
        SettlementFigures figures = calculator.figures(new BigDecimal("50000"), new BigDecimal("49500"));

        List<SettlementPlan.PlannedEntry> entries =
            calculator.entries(teller, figures, staffReceivable, null, vault);

        assertEquals(2, entries.size());
        SettlementPlan.PlannedLine receivable = entries.get(0).getLines().get(0);
        assertEquals(staffReceivable, receivable.getAccount());
        assertEquals(0, new BigDecimal("500").compareTo(receivable.getDebit()));
        SettlementPlan.PlannedLine vaultLine = entries.get(1).getLines().get(0);
        assertEquals(vault, vaultLine.getAccount());
        assertEquals(0, new BigDecimal("49500").compareTo(vaultLine.getDebit()));
        assertEquals(0, new BigDecimal("-50000").compareTo(netOnTeller(entries)));
    }

    @Test
    @DisplayName("Overage plan credits sundry income; exact count posts only the vault transfer")
    void overageAndExactPlans() {
        SettlementFigures overage = calculator.figures(new BigDecimal("1000"), new BigDecimal("1200"));
        List<SettlementPlan.PlannedEntry> overageEntries =
            calculator.entries(teller, overage, null, sundryIncome, vault);

        assertEquals(2, overageEntries.size());
        assertEquals(sundryIncome, overageEntries.get(0).getLines().get(1).getAccount());
        assertEquals(0, new BigDecimal("-1000").compareTo(netOnTeller(overageEntries)));

        SettlementFigures exact = calculator.figures(new BigDecimal("0"), new BigDecimal("0"));
        List<SettlementPlan.PlannedEntry> exactEntries = calculator.entries(teller, exact, null, null, vault);
        assertEquals(1, exactEntries.size(), "Vault transfer is posted even for zero cash");
    }

    private BigDecimal netOnTeller(List<SettlementPlan.PlannedEntry> entries) {
        return entries.stream()
            .flatMap(entry -> entry.getLines().stream())
            .filter(line -> line.getAccount().equals(teller))
            .map(line -> line.getDebit().subtract(line.getCredit()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static Account account(String code, String name, String operator) {
        AccountType type = code.charAt(3) == '4' ? AccountType.REVENUE : AccountType.ASSET;
        return new Account(UUID.randomUUID(), "coop-unit", code, name, type, false, true, operator, Instant.now());
    }
}
