package com.flagship.coop_ledger.settlement;

import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import com.flagship.coop_ledger.ledger.Account;
import com.flagship.coop_ledger.ledger.LedgerService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Variance, approval gate and journal plan of a teller settlement. No I/O.
 *
 * Entries, in order:
 * 1. Shortage: Dr staff receivable / Cr teller, for the missing amount
 * 2. Overage: Dr teller / Cr sundry income, for the excess
 * 3. Vault transfer: Dr vault / Cr teller, for the full counted cash
 *
 * After all three the teller account holds exactly zero.
 */
@Component
public class SettlementCalculator {

    private final BigDecimal approvalThresholdAmount;
    private final BigDecimal approvalThresholdPercentage;

    public SettlementCalculator(
            @Value("${coop-ledger.settlement.approval-threshold-amount:1000}") BigDecimal approvalThresholdAmount,
            @Value("${coop-ledger.settlement.approval-threshold-percentage:0.01}") BigDecimal approvalThresholdPercentage) {
        this.approvalThresholdAmount = approvalThresholdAmount;
        this.approvalThresholdPercentage = approvalThresholdPercentage;
    }

    public SettlementFigures figures(BigDecimal systemCash, BigDecimal physicalCash) {
        BigDecimal difference = physicalCash.subtract(systemCash);
        return new SettlementFigures(systemCash, physicalCash, difference,
            requiresApproval(difference, systemCash));
    }

    /**
     * Large variance in absolute terms, or relative to a positive system balance.
     */
    boolean requiresApproval(BigDecimal difference, BigDecimal systemCash) {
        BigDecimal variance = difference.abs();
        if (variance.compareTo(approvalThresholdAmount) > 0) {
            return true;
        }
        return systemCash.signum() > 0
            && variance.divide(systemCash, 10, RoundingMode.HALF_UP).compareTo(approvalThresholdPercentage) > 0;
    }

    /**
     * Weighted sum of a {@code denomination -> count} breakdown must match the counted cash.
     *
     * @throws CoopLedgerException DENOMINATION_MISMATCH
     */
    public void checkDenominations(Map<String, Integer> denominations, BigDecimal physicalCash) {
        if (denominations == null || denominations.isEmpty()) {
            return;
        }
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<String, Integer> entry : denominations.entrySet()) {
            BigDecimal faceValue;
            try {
                faceValue = new BigDecimal(entry.getKey().trim());
            } catch (NumberFormatException e) {
                throw new CoopLedgerException(ErrorCode.DENOMINATION_MISMATCH,
                    "Denomination is not a number: " + entry.getKey(), Map.of("denomination", entry.getKey()));
            }
            Integer count = entry.getValue();
            if (faceValue.signum() <= 0 || count == null || count < 0) {
                throw new CoopLedgerException(ErrorCode.DENOMINATION_MISMATCH,
                    String.format("Invalid denomination entry %s x %s", entry.getKey(), count),
                    Map.of("denomination", entry.getKey()));
            }
            total = total.add(faceValue.multiply(BigDecimal.valueOf(count)));
        }
        if (total.subtract(physicalCash).abs().compareTo(LedgerService.EPSILON) > 0) {
            throw new CoopLedgerException(ErrorCode.DENOMINATION_MISMATCH,
                String.format("Denominations add up to %s but physical cash is %s", total, physicalCash),
                Map.of("denominationTotal", total, "physicalCash", physicalCash));
        }
    }

    /**
     * @param staffReceivable required only for a shortage
     * @param sundryIncome required only for an overage
     */
    public List<SettlementPlan.PlannedEntry> entries(Account teller, SettlementFigures figures, Account staffReceivable,
                                                     Account sundryIncome, Account vault) {
        List<SettlementPlan.PlannedEntry> entries = new ArrayList<>(3);
        BigDecimal variance = figures.getDifference().abs();

        switch (figures.getVarianceType()) {
            case SHORTAGE -> entries.add(entry(
                "Teller shortage: " + teller.getName(),
                debit(staffReceivable, variance), credit(teller, variance)));
            case OVERAGE -> entries.add(entry(
                "Teller overage: " + teller.getName(),
                debit(teller, variance), credit(sundryIncome, variance)));
            case NONE -> {
                // nothing to adjust
            }
        }

        entries.add(entry(
            "Teller cash transfer to vault: " + teller.getName(),
            debit(vault, figures.getPhysicalCash()), credit(teller, figures.getPhysicalCash())));
        return entries;
    }

    private static SettlementPlan.PlannedEntry entry(String description, SettlementPlan.PlannedLine... lines) {
        return new SettlementPlan.PlannedEntry(description, List.of(lines));
    }

    private static SettlementPlan.PlannedLine debit(Account account, BigDecimal amount) {
        return new SettlementPlan.PlannedLine(account, amount, BigDecimal.ZERO);
    }

    private static SettlementPlan.PlannedLine credit(Account account, BigDecimal amount) {
        return new SettlementPlan.PlannedLine(account, BigDecimal.ZERO, amount);
    }
}
