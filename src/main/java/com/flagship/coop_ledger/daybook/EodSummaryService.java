package com.flagship.coop_ledger.daybook;

import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import com.flagship.coop_ledger.ledger.LedgerService;
import com.flagship.coop_ledger.settlement.SettlementStatus;
import com.flagship.coop_ledger.settlement.TellerSettlement;
import com.flagship.coop_ledger.settlement.TellerSettlementService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
public class EodSummaryService {

    private final DayBookService dayBookService;
    private final TellerSettlementService settlementService;
    private final LedgerService ledgerService;

    /**
     * Summary of {@code date}, or of the tenant's current day when {@code date} is null.
     *
     * @throws CoopLedgerException NO_DAY_FOR_TODAY when there is no such day
     */
    @Transactional(readOnly = true)
    public EodSummary summarize(String tenantId, LocalDate date) {
        DayBook day;
        if (date == null) {
            day = dayBookService.getStatus(tenantId)
                .orElseThrow(() -> new CoopLedgerException(ErrorCode.NO_DAY_FOR_TODAY,
                    "No business day has been started", Map.of("tenantId", tenantId)));
        } else {
            day = dayBookService.findByDate(tenantId, date)
                .orElseThrow(() -> new CoopLedgerException(ErrorCode.NO_DAY_FOR_TODAY,
                    "No business day found for " + date, Map.of("date", date)));
        }

        List<TellerSettlement> settlements = settlementService.findByDay(day.getId());
        List<TellerSettlement> effective = settlements.stream()
            .filter(settlement -> settlement.getStatus() != SettlementStatus.REVERTED)
            .toList();

        return new EodSummary(
            day,
            effective.size(),
            sum(effective, TellerSettlement::getPhysicalCash),
            sum(effective, TellerSettlement::getSystemCash),
            sum(effective, TellerSettlement::getDifference),
            settlements,
            ledgerService.findJournalEntries(tenantId, day.getDate())
        );
    }

    private static BigDecimal sum(List<TellerSettlement> settlements, Function<TellerSettlement, BigDecimal> field) {
        return settlements.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
