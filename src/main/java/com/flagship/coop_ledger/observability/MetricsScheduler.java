package com.flagship.coop_ledger.observability;

import com.flagship.coop_ledger.daybook.DayBookRepository;
import com.flagship.coop_ledger.daybook.DayBookStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final DayBookMetrics dayBookMetrics;
    private final DayBookRepository dayBookRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            dayBookMetrics.updateOpenDays(dayBookRepository.countByStatus(DayBookStatus.OPEN));
        } catch (Exception e) {
            log.warn("Failed to refresh day book metrics: {}", e.getMessage());
        }
    }
}
