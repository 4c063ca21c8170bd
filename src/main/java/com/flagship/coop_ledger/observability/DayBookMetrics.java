package com.flagship.coop_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for day control, settlements and postings.
 *
 * Metrics exposed:
 * - daybook.transitions: day starts, closes, force closes and reopens, by outcome
 * - daybook.close.duration: time spent in close and force close
 * - settlements.recorded: settlements by resulting status
 * - settlements.variance: absolute teller variance per settlement
 * - ledger.journal.posted / ledger.lines.posted: posting volume
 * - daybook.open: tenants with an open day (refreshed by {@link MetricsScheduler})
 */
@Component
public class DayBookMetrics {

    private final MeterRegistry registry;
    private final AtomicLong openDays = new AtomicLong(0);

    public DayBookMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("daybook.open", openDays, AtomicLong::get)
            .description("Number of tenants with an open business day")
            .register(registry);
    }

    public void recordTransition(String operation, String outcome) {
        registry.counter("daybook.transitions",
            "operation", sanitizeTag(operation),
            "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordCloseDuration(String operation, long durationMs) {
        registry.timer("daybook.close.duration",
            "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordSettlement(String status, double absoluteVariance) {
        registry.counter("settlements.recorded", "status", sanitizeTag(status)).increment();
        registry.summary("settlements.variance").record(absoluteVariance);
    }

    public void recordSettlementOutcome(String operation, String outcome) {
        registry.counter("settlements.operations",
            "operation", sanitizeTag(operation),
            "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordJournalPosted(int lineCount) {
        registry.counter("ledger.journal.posted").increment();
        registry.counter("ledger.lines.posted").increment(lineCount);
    }

    void updateOpenDays(long count) {
        openDays.set(count);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
