package com.flagship.coop_ledger.daybook;

import com.flagship.coop_ledger.audit.AuditAction;
import com.flagship.coop_ledger.audit.AuditLogService;
import com.flagship.coop_ledger.common.error.ConcurrencyConflictException;
import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import com.flagship.coop_ledger.common.error.TellerPendingSettlementException;
import com.flagship.coop_ledger.common.error.TellerPendingSettlementException.PendingTeller;
import com.flagship.coop_ledger.daybook.event.DayBookTransitionedEvent;
import com.flagship.coop_ledger.ledger.Account;
import com.flagship.coop_ledger.ledger.AccountRole;
import com.flagship.coop_ledger.ledger.AccountRoleRegistry;
import com.flagship.coop_ledger.ledger.AccountService;
import com.flagship.coop_ledger.ledger.JournalLine;
import com.flagship.coop_ledger.ledger.LedgerService;
import com.flagship.coop_ledger.observability.CorrelationContext;
import com.flagship.coop_ledger.observability.DayBookMetrics;
import com.flagship.coop_ledger.outbox.OutboxService;
import com.flagship.coop_ledger.settlement.TellerSettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * End of day: close, force close and reopen.
 *
 * A close is one transaction:
 * 1. Compare-and-swap OPEN to EOD_IN_PROGRESS. The update waits for every settle or
 *    posting holding a share lock on the day, and no new one can start after it.
 * 2. Check every teller drawer is empty (force close sweeps them to suspense instead)
 * 3. Snapshot vault cash and the day's entry count, then EOD_IN_PROGRESS to CLOSED
 *
 * A failure at any step rolls the whole thing back, so a day never stays stuck in
 * EOD_IN_PROGRESS.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DayCloseService {

    private final DayBookRepository repository;
    private final BusinessCalendar calendar;
    private final AccountService accountService;
    private final AccountRoleRegistry roleRegistry;
    private final LedgerService ledgerService;
    private final TellerSettlementService settlementService;
    private final OutboxService outboxService;
    private final AuditLogService auditLogService;
    private final DayBookMetrics metrics;

    /**
     * Closes the OPEN day once every teller is settled.
     *
     * @throws TellerPendingSettlementException listing the drawers that still hold cash
     * @throws ConcurrencyConflictException CONCURRENT_CLOSE_IN_PROGRESS or DAY_MODIFIED
     * @throws CoopLedgerException NO_ACTIVE_DAY or ALREADY_CLOSED
     */
    @Transactional
    public DayBook closeDay(String tenantId, String actor) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);

        try {
            DayBook day = lockForClose(tenantId);
            log.info("Closing business day: date={}, actor={}", day.getDate(), actor);

            List<PendingTeller> pending = pendingTellers(tenantId);
            if (!pending.isEmpty()) {
                log.warn("Day close refused, {} teller(s) not settled: {}", pending.size(),
                    pending.stream().map(PendingTeller::getCode).toList());
                throw new TellerPendingSettlementException(pending);
            }

            DayBook closed = complete(day, actor, null);
            auditLogService.record(tenantId, actor, AuditAction.DAY_CLOSED, "DayBook", closed.getId(),
                Map.of("date", closed.getDate().toString(),
                    "closingCash", closed.getClosingCash(),
                    "transactionsCount", closed.getTransactionsCount()));
            outboxService.saveEvent(DayBookTransitionedEvent.of(closed, DayBookStatus.OPEN, actor, false, null));

            metrics.recordTransition("close", "success");
            metrics.recordCloseDuration("close", System.currentTimeMillis() - startTime);
            log.info("Business day closed: date={}, closingCash={}, transactions={}",
                closed.getDate(), closed.getClosingCash(), closed.getTransactionsCount());
            return closed;

        } catch (CoopLedgerException e) {
            metrics.recordTransition("close", e.getCode().name());
            throw e;
        }
    }

    /**
     * Closes the OPEN day regardless of unsettled drawers.
     *
     * Each non-zero drawer balance moves to the suspense account (created on first use),
     * which the manager then owns. Still-reversible settlements of the day are flagged
     * force-closed.
     */
    @Transactional
    public DayBook forceCloseDay(String tenantId, String actor, String reason, String approverId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
        requireReason(reason, "Force close");
        String approver = approverId != null && !approverId.isBlank() ? approverId : actor;

        try {
            DayBook day = lockForClose(tenantId);
            log.warn("Force closing business day: date={}, actor={}, approver={}, reason={}",
                day.getDate(), actor, approver, reason);

            List<Map<String, Object>> adjustments = sweepToSuspense(tenantId, day);
            int flagged = settlementService.flagForceClosed(day.getId());

            DayBook closed = complete(day, actor, reason);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("date", closed.getDate().toString());
            details.put("reason", reason);
            details.put("approverId", approver);
            details.put("closingCash", closed.getClosingCash());
            details.put("suspenseAdjustments", adjustments);
            details.put("settlementsFlagged", flagged);
            auditLogService.record(tenantId, actor, AuditAction.DAY_FORCE_CLOSED, "DayBook", closed.getId(), details);
            outboxService.saveEvent(DayBookTransitionedEvent.of(closed, DayBookStatus.OPEN, actor, true, reason));

            metrics.recordTransition("force_close", "success");
            metrics.recordCloseDuration("force_close", System.currentTimeMillis() - startTime);
            log.warn("Business day force closed: date={}, suspenseAdjustments={}, settlementsFlagged={}",
                closed.getDate(), adjustments.size(), flagged);
            return closed;

        } catch (CoopLedgerException e) {
            metrics.recordTransition("force_close", e.getCode().name());
            throw e;
        }
    }

    /**
     * Reopens today's closed day.
     */
    @Transactional
    public DayBook reopenDay(String tenantId, String actor, String reason, String approverId) {
        return reopenDay(tenantId, calendar.today(), actor, reason, approverId);
    }

    /**
     * Reopens the closed day {@code date}. Only today's day can be reopened; past days are final.
     *
     * @throws CoopLedgerException CANNOT_REOPEN_PAST_DAY, NO_DAY_FOR_TODAY, NOT_CLOSED or DAY_ALREADY_OPEN
     */
    @Transactional
    public DayBook reopenDay(String tenantId, LocalDate date, String actor, String reason, String approverId) {
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
        requireReason(reason, "Reopen");
        String approver = approverId != null && !approverId.isBlank() ? approverId : actor;

        try {
            LocalDate today = calendar.today();
            if (!date.equals(today)) {
                throw new CoopLedgerException(ErrorCode.CANNOT_REOPEN_PAST_DAY,
                    String.format("Day %s cannot be reopened; only today (%s) can", date, today),
                    Map.of("date", date, "today", today));
            }

            DayBookEntity day = repository.findByTenantIdAndBusinessDate(tenantId, date)
                .orElseThrow(() -> new CoopLedgerException(ErrorCode.NO_DAY_FOR_TODAY,
                    "No business day exists for today: " + date, Map.of("date", date)));
            MDC.put(CorrelationContext.DAY_BOOK_ID_MDC_KEY, day.getId().toString());
            if (day.getStatus() != DayBookStatus.CLOSED) {
                throw notClosed(day.toDomain());
            }

            Optional<DayBookEntity> active = repository.findFirstByTenantIdAndStatusIn(
                tenantId, DayBookService.ACTIVE_STATUSES);
            if (active.isPresent()) {
                throw new CoopLedgerException(ErrorCode.DAY_ALREADY_OPEN,
                    String.format("Day %s is %s; only one day can be active", active.get().getBusinessDate(),
                        active.get().getStatus()),
                    Map.of("activeDate", active.get().getBusinessDate()));
            }

            int updated;
            try {
                updated = repository.reopen(day.getId(), DayBookStatus.CLOSED, day.getVersion(),
                    DayBookStatus.OPEN, actor, reason, Instant.now());
            } catch (DataIntegrityViolationException e) {
                throw new CoopLedgerException(ErrorCode.DAY_ALREADY_OPEN,
                    "Another day became active while reopening " + date, Map.of("date", date));
            }
            if (updated == 0) {
                DayBook current = reload(day.getId());
                if (current.getStatus() != DayBookStatus.CLOSED) {
                    throw notClosed(current);
                }
                throw new ConcurrencyConflictException(ErrorCode.DAY_MODIFIED,
                    "Day " + date + " changed while it was being reopened",
                    Map.of("dayBookId", day.getId(), "observedVersion", day.getVersion(),
                        "currentVersion", current.getVersion()));
            }

            DayBook reopened = reload(day.getId());
            auditLogService.record(tenantId, actor, AuditAction.DAY_REOPENED, "DayBook", reopened.getId(),
                Map.of("date", date.toString(), "reason", reason, "approverId", approver,
                    "version", reopened.getVersion()));
            outboxService.saveEvent(DayBookTransitionedEvent.of(reopened, DayBookStatus.CLOSED, actor, false, reason));

            metrics.recordTransition("reopen", "success");
            log.warn("Business day reopened: date={}, actor={}, approver={}, reason={}",
                date, actor, approver, reason);
            return reopened;

        } catch (CoopLedgerException e) {
            metrics.recordTransition("reopen", e.getCode().name());
            throw e;
        }
    }

    /**
     * Moves the tenant's OPEN day to EOD_IN_PROGRESS and returns it at its new version.
     * A miss is explained by re-reading the row.
     */
    private DayBook lockForClose(String tenantId) {
        Optional<DayBookEntity> open = repository.findFirstByTenantIdAndStatus(tenantId, DayBookStatus.OPEN);
        if (open.isEmpty()) {
            Optional<DayBookEntity> closing =
                repository.findFirstByTenantIdAndStatus(tenantId, DayBookStatus.EOD_IN_PROGRESS);
            if (closing.isPresent()) {
                throw concurrentClose(closing.get().toDomain());
            }
            Optional<DayBookEntity> latest = repository.findFirstByTenantIdOrderByBusinessDateDesc(tenantId);
            if (latest.isPresent() && latest.get().getStatus() == DayBookStatus.CLOSED) {
                throw alreadyClosed(latest.get().toDomain());
            }
            throw new CoopLedgerException(ErrorCode.NO_ACTIVE_DAY,
                "No business day is open to close", Map.of("tenantId", tenantId));
        }

        DayBookEntity day = open.get();
        MDC.put(CorrelationContext.DAY_BOOK_ID_MDC_KEY, day.getId().toString());
        int updated = repository.compareAndSetStatus(day.getId(), DayBookStatus.OPEN, day.getVersion(),
            DayBookStatus.EOD_IN_PROGRESS, Instant.now());
        if (updated == 0) {
            DayBook current = reload(day.getId());
            switch (current.getStatus()) {
                case EOD_IN_PROGRESS -> throw concurrentClose(current);
                case CLOSED -> throw alreadyClosed(current);
                default -> throw new ConcurrencyConflictException(ErrorCode.DAY_MODIFIED,
                    "Day " + current.getDate() + " changed while it was being closed",
                    Map.of("dayBookId", current.getId(), "observedVersion", day.getVersion(),
                        "currentVersion", current.getVersion()));
            }
        }
        return reload(day.getId());
    }

    private DayBook complete(DayBook day, String actor, String forceCloseReason) {
        BigDecimal closingCash = vaultBalance(day.getTenantId());
        int transactionsCount = ledgerService.countJournalEntries(day.getTenantId(), day.getDate());

        int updated = repository.completeClose(day.getId(), DayBookStatus.EOD_IN_PROGRESS, day.getVersion(),
            DayBookStatus.CLOSED, closingCash, transactionsCount, actor, forceCloseReason, Instant.now());
        if (updated == 0) {
            // We hold the row lock from the first swap, so nobody else can have moved it
            throw new IllegalStateException("Day " + day.getId() + " left EOD_IN_PROGRESS during its own close");
        }
        return reload(day.getId());
    }

    private List<PendingTeller> pendingTellers(String tenantId) {
        List<PendingTeller> pending = new ArrayList<>();
        for (Account teller : accountService.findTellerCashAccounts(tenantId)) {
            BigDecimal balance = ledgerService.getAccountBalance(teller.getId());
            if (balance.abs().compareTo(LedgerService.EPSILON) > 0) {
                pending.add(new PendingTeller(teller.getId(), teller.getCode(), teller.getName(), balance));
            }
        }
        return pending;
    }

    private List<Map<String, Object>> sweepToSuspense(String tenantId, DayBook day) {
        List<Map<String, Object>> adjustments = new ArrayList<>();
        Account suspense = null;
        LocalDateTime postedAt = calendar.postingTimestamp(day.getDate());

        for (Account teller : accountService.findTellerCashAccounts(tenantId)) {
            BigDecimal balance = ledgerService.getAccountBalance(teller.getId());
            if (balance.signum() == 0) {
                continue;
            }
            if (suspense == null) {
                suspense = roleRegistry.resolveOrCreateSuspense(tenantId);
            }
            BigDecimal amount = balance.abs();
            List<JournalLine> lines = balance.signum() > 0
                ? List.of(JournalLine.debit(suspense.getId(), amount), JournalLine.credit(teller.getId(), amount))
                : List.of(JournalLine.debit(teller.getId(), amount), JournalLine.credit(suspense.getId(), amount));
            ledgerService.post(tenantId, "Force close: teller balance to suspense: " + teller.getName(),
                lines, postedAt);

            adjustments.add(Map.of("accountId", teller.getId(), "code", teller.getCode(), "amount", balance));
            log.info("Teller balance moved to suspense: account={}, amount={}", teller.getCode(), balance);
        }
        return adjustments;
    }

    private BigDecimal vaultBalance(String tenantId) {
        Optional<Account> vault = roleRegistry.find(tenantId, AccountRole.VAULT_CASH);
        if (vault.isEmpty()) {
            log.warn("No vault cash account configured; recording closing cash as zero");
            return BigDecimal.ZERO;
        }
        return ledgerService.getAccountBalance(vault.get().getId());
    }

    private DayBook reload(UUID dayBookId) {
        return repository.findById(dayBookId)
            .orElseThrow(() -> new IllegalStateException("Day book disappeared: " + dayBookId))
            .toDomain();
    }

    private static void requireReason(String reason, String operation) {
        if (reason == null || reason.isBlank()) {
            throw new CoopLedgerException(ErrorCode.INVALID_REQUEST, operation + " requires a reason",
                Map.of("field", "reason"));
        }
    }

    private static CoopLedgerException concurrentClose(DayBook day) {
        return new ConcurrencyConflictException(ErrorCode.CONCURRENT_CLOSE_IN_PROGRESS,
            "Day " + day.getDate() + " is already being closed",
            Map.of("dayBookId", day.getId(), "date", day.getDate()));
    }

    private static CoopLedgerException alreadyClosed(DayBook day) {
        return new CoopLedgerException(ErrorCode.ALREADY_CLOSED,
            "Day " + day.getDate() + " is already closed",
            Map.of("dayBookId", day.getId(), "date", day.getDate()));
    }

    private static CoopLedgerException notClosed(DayBook day) {
        return new CoopLedgerException(ErrorCode.NOT_CLOSED,
            String.format("Day %s is %s, not CLOSED", day.getDate(), day.getStatus()),
            Map.of("dayBookId", day.getId(), "status", day.getStatus()));
    }
}
