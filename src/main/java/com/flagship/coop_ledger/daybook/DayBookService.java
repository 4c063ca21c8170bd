package com.flagship.coop_ledger.daybook;

import com.flagship.coop_ledger.audit.AuditAction;
import com.flagship.coop_ledger.audit.AuditLogService;
import com.flagship.coop_ledger.common.error.ConcurrencyConflictException;
import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import com.flagship.coop_ledger.daybook.event.DayBookTransitionedEvent;
import com.flagship.coop_ledger.observability.CorrelationContext;
import com.flagship.coop_ledger.observability.DayBookMetrics;
import com.flagship.coop_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Day begin and day lookups.
 *
 * Key rules:
 * - A day cannot begin while the most recent earlier day is still open or closing
 * - At most one day per tenant is active (also enforced by a partial unique index)
 * - A closed day can be begun again only when it is today; past days stay closed
 * - A new day's opening cash is the previous day's closing cash
 *
 * Closing and reopening live in {@link DayCloseService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DayBookService {

    static final Set<DayBookStatus> ACTIVE_STATUSES = EnumSet.allOf(DayBookStatus.class).stream()
        .filter(DayBookStatus::isActive)
        .collect(Collectors.toCollection(() -> EnumSet.noneOf(DayBookStatus.class)));

    private final DayBookRepository repository;
    private final BusinessCalendar calendar;
    private final OutboxService outboxService;
    private final AuditLogService auditLogService;
    private final DayBookMetrics metrics;

    /**
     * Begins the business day {@code date}, or reopens it in place if it is today and closed.
     *
     * @throws CoopLedgerException PREVIOUS_DAY_NOT_CLOSED, DAY_ALREADY_OPEN or CANNOT_START_PAST_DAY
     */
    @Transactional
    public DayBook startDay(String tenantId, LocalDate date, String actor) {
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
        log.info("Starting business day: date={}, actor={}", date, actor);

        try {
            Optional<DayBookEntity> previous =
                repository.findFirstByTenantIdAndBusinessDateBeforeOrderByBusinessDateDesc(tenantId, date);
            if (previous.isPresent() && previous.get().getStatus() != DayBookStatus.CLOSED) {
                throw new CoopLedgerException(ErrorCode.PREVIOUS_DAY_NOT_CLOSED,
                    String.format("Previous day %s is %s; close it before starting %s",
                        previous.get().getBusinessDate(), previous.get().getStatus(), date),
                    Map.of("previousDate", previous.get().getBusinessDate(),
                        "previousStatus", previous.get().getStatus()));
            }

            Optional<DayBookEntity> active = repository.findFirstByTenantIdAndStatusIn(tenantId, ACTIVE_STATUSES);
            if (active.isPresent()) {
                throw dayAlreadyOpen(active.get());
            }

            Optional<DayBookEntity> existing = repository.findByTenantIdAndBusinessDate(tenantId, date);
            DayBook started = existing.isPresent()
                ? reopenClosedToday(existing.get(), actor)
                : create(tenantId, date, actor, previous);

            metrics.recordTransition("start", "success");
            return started;

        } catch (CoopLedgerException e) {
            metrics.recordTransition("start", e.getCode().name());
            throw e;
        }
    }

    /**
     * The day the tenant is working in: the active day if there is one, otherwise the latest day.
     * Empty when the tenant never began a day.
     */
    @Transactional(readOnly = true)
    public Optional<DayBook> getStatus(String tenantId) {
        return repository.findFirstByTenantIdAndStatusIn(tenantId, ACTIVE_STATUSES)
            .or(() -> repository.findFirstByTenantIdOrderByBusinessDateDesc(tenantId))
            .map(DayBookEntity::toDomain);
    }

    /**
     * The OPEN day, which is the only state that accepts postings.
     */
    @Transactional(readOnly = true)
    public Optional<DayBook> getActiveDay(String tenantId) {
        return repository.findFirstByTenantIdAndStatus(tenantId, DayBookStatus.OPEN)
            .map(DayBookEntity::toDomain);
    }

    /**
     * @throws CoopLedgerException NO_ACTIVE_DAY
     */
    @Transactional(readOnly = true)
    public DayBook requireActiveDay(String tenantId) {
        return getActiveDay(tenantId)
            .orElseThrow(() -> new CoopLedgerException(ErrorCode.NO_ACTIVE_DAY,
                "No business day is open for posting", Map.of("tenantId", tenantId)));
    }

    /**
     * The OPEN day, share-locked until the caller's transaction ends. A concurrent close
     * waits for the lock, so it sees every posting made under it.
     *
     * @throws CoopLedgerException NO_ACTIVE_DAY
     */
    @Transactional
    public DayBook lockActiveDay(String tenantId) {
        return repository.findByTenantIdAndStatusForShare(tenantId, DayBookStatus.OPEN)
            .map(DayBookEntity::toDomain)
            .orElseThrow(() -> new CoopLedgerException(ErrorCode.NO_ACTIVE_DAY,
                "No business day is open for posting", Map.of("tenantId", tenantId)));
    }

    /**
     * Share-locks a day by id, whatever its status.
     */
    @Transactional
    public Optional<DayBook> lockDay(UUID dayBookId) {
        return repository.findByIdForShare(dayBookId).map(DayBookEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<DayBook> findByDate(String tenantId, LocalDate date) {
        return repository.findByTenantIdAndBusinessDate(tenantId, date).map(DayBookEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<DayBook> findById(UUID dayBookId) {
        return repository.findById(dayBookId).map(DayBookEntity::toDomain);
    }

    private DayBook create(String tenantId, LocalDate date, String actor, Optional<DayBookEntity> previous) {
        BigDecimal openingCash = previous
            .map(DayBookEntity::getClosingCash)
            .orElse(BigDecimal.ZERO);
        if (openingCash == null) {
            openingCash = BigDecimal.ZERO;
        }

        DayBookEntity saved;
        try {
            saved = repository.saveAndFlush(DayBookEntity.open(tenantId, date, openingCash, actor));
        } catch (DataIntegrityViolationException e) {
            throw new CoopLedgerException(ErrorCode.DAY_ALREADY_OPEN,
                "Another day was started concurrently for this tenant", Map.of("date", date));
        }

        DayBook day = saved.toDomain();
        MDC.put(CorrelationContext.DAY_BOOK_ID_MDC_KEY, day.getId().toString());
        outboxService.saveEvent(DayBookTransitionedEvent.of(day, null, actor, false, null));
        auditLogService.record(tenantId, actor, AuditAction.DAY_STARTED, "DayBook", day.getId(),
            Map.of("date", date.toString(), "openingCash", openingCash));

        log.info("Business day started: date={}, openingCash={}", date, openingCash);
        return day;
    }

    private DayBook reopenClosedToday(DayBookEntity existing, String actor) {
        LocalDate date = existing.getBusinessDate();
        if (existing.getStatus() != DayBookStatus.CLOSED) {
            throw dayAlreadyOpen(existing);
        }
        if (!date.equals(calendar.today())) {
            throw new CoopLedgerException(ErrorCode.CANNOT_START_PAST_DAY,
                String.format("Day %s is already closed; only today's day can be started again", date),
                Map.of("date", date, "today", calendar.today()));
        }

        int updated = repository.reopen(existing.getId(), DayBookStatus.CLOSED, existing.getVersion(),
            DayBookStatus.OPEN, actor, existing.getReopenReason(), Instant.now());
        if (updated == 0) {
            throw new ConcurrencyConflictException(ErrorCode.DAY_MODIFIED,
                "Day " + date + " changed while it was being started again",
                Map.of("dayBookId", existing.getId(), "observedVersion", existing.getVersion()));
        }

        DayBook day = repository.findById(existing.getId()).orElseThrow().toDomain();
        MDC.put(CorrelationContext.DAY_BOOK_ID_MDC_KEY, day.getId().toString());
        outboxService.saveEvent(DayBookTransitionedEvent.of(day, DayBookStatus.CLOSED, actor, false, null));
        auditLogService.record(day.getTenantId(), actor, AuditAction.DAY_STARTED, "DayBook", day.getId(),
            Map.of("date", date.toString(), "reopenedInPlace", true, "version", day.getVersion()));

        log.info("Closed day {} started again in place: version={}", date, day.getVersion());
        return day;
    }

    private CoopLedgerException dayAlreadyOpen(DayBookEntity active) {
        return new CoopLedgerException(ErrorCode.DAY_ALREADY_OPEN,
            String.format("Day %s is already %s", active.getBusinessDate(), active.getStatus()),
            Map.of("activeDate", active.getBusinessDate(), "status", active.getStatus()));
    }
}
