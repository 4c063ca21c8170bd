package com.flagship.coop_ledger.settlement;

import com.flagship.coop_ledger.audit.AuditAction;
import com.flagship.coop_ledger.audit.AuditLogService;
import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import com.flagship.coop_ledger.daybook.BusinessCalendar;
import com.flagship.coop_ledger.daybook.DayBook;
import com.flagship.coop_ledger.daybook.DayBookService;
import com.flagship.coop_ledger.daybook.DayBookStatus;
import com.flagship.coop_ledger.ledger.Account;
import com.flagship.coop_ledger.ledger.AccountRole;
import com.flagship.coop_ledger.ledger.AccountRoleRegistry;
import com.flagship.coop_ledger.ledger.AccountService;
import com.flagship.coop_ledger.ledger.JournalLine;
import com.flagship.coop_ledger.ledger.LedgerService;
import com.flagship.coop_ledger.ledger.PostingResult;
import com.flagship.coop_ledger.observability.CorrelationContext;
import com.flagship.coop_ledger.observability.DayBookMetrics;
import com.flagship.coop_ledger.outbox.OutboxService;
import com.flagship.coop_ledger.settlement.event.TellerSettlementEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Teller end-of-shift cash settlement.
 *
 * A settlement compares the counted drawer with the teller account balance, books
 * any variance, and sweeps the counted cash into the vault. Everything it posts
 * commits together with the settlement row, or not at all.
 *
 * Lock order is day row (share) before drawer balance before settlement row,
 * the same order day close uses, so settle, unsettle and close never deadlock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TellerSettlementService {

    private final TellerSettlementRepository repository;
    private final SettlementCalculator calculator;
    private final SettlementIdempotencyService idempotencyService;
    private final DayBookService dayBookService;
    private final BusinessCalendar calendar;
    private final AccountService accountService;
    private final AccountRoleRegistry roleRegistry;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final AuditLogService auditLogService;
    private final DayBookMetrics metrics;

    /**
     * Computes what {@link #settle} would post, without writing anything.
     *
     * @throws CoopLedgerException NO_ACTIVE_DAY, TELLER_ACCOUNT_NOT_MAPPED, DENOMINATION_MISMATCH
     *                             or ACCOUNT_ROLE_NOT_CONFIGURED
     */
    @Transactional(readOnly = true)
    public SettlementPlan preview(SettleCommand command) {
        validate(command);
        dayBookService.requireActiveDay(command.getTenantId());
        Account teller = accountService.findTellerCashAccount(command.getTenantId(), command.getTellerId());
        calculator.checkDenominations(command.getDenominations(), command.getPhysicalCash());
        return plan(command.getTenantId(), teller, ledgerService.getAccountBalance(teller.getId()),
            command.getPhysicalCash());
    }

    /**
     * Records a settlement, or returns the one already recorded under the same idempotency key.
     *
     * This method:
     * 1. Share-locks the OPEN day so a close cannot slip in between
     * 2. Locks the drawer balance and reads it as the system cash
     * 3. Posts the shortage or overage entry, then the vault transfer
     * 4. Saves the settlement with the journal entry ids in posting order
     *
     * A concurrent call with the same key that loses the unique-reference race fails
     * with a DataIntegrityViolationException once this transaction has rolled back;
     * callers resolve it through {@link #findByReference}.
     */
    @Transactional
    public SettlementOutcome settle(SettleCommand command) {
        validate(command);
        String tenantId = command.getTenantId();
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);

        if (command.hasIdempotencyKey()) {
            Optional<TellerSettlementEntity> existing =
                idempotencyService.findExisting(tenantId, command.getIdempotencyKey());
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                MDC.put(CorrelationContext.SETTLEMENT_ID_MDC_KEY, existing.get().getId().toString());
                log.info("Settlement reference already used, returning existing settlement: ref={}",
                    command.getIdempotencyKey());
                return SettlementOutcome.replayed(existing.get().toDomain());
            }
            metrics.recordIdempotencyMiss();
        }

        try {
            DayBook day = dayBookService.lockActiveDay(tenantId);
            MDC.put(CorrelationContext.DAY_BOOK_ID_MDC_KEY, day.getId().toString());

            Account teller = accountService.findTellerCashAccount(tenantId, command.getTellerId());
            calculator.checkDenominations(command.getDenominations(), command.getPhysicalCash());

            BigDecimal systemCash = ledgerService.lockAccountBalance(teller.getId());
            SettlementPlan plan = plan(tenantId, teller, systemCash, command.getPhysicalCash());

            LocalDateTime postedAt = calendar.postingTimestamp(day.getDate());
            List<UUID> journalEntryIds = new ArrayList<>(plan.getEntries().size());
            for (SettlementPlan.PlannedEntry entry : plan.getEntries()) {
                PostingResult posted = ledgerService.post(tenantId, entry.getDescription(),
                    entry.toJournalLines(), postedAt);
                journalEntryIds.add(posted.getJournalEntry().getId());
            }

            String settlementRef = command.hasIdempotencyKey()
                ? command.getIdempotencyKey()
                : String.format("SETTLE-%s-%s-%d", day.getId(), command.getTellerId(), System.currentTimeMillis());

            TellerSettlementEntity saved = repository.saveAndFlush(TellerSettlementEntity.record(
                day.getId(), tenantId, command.getTellerId(), plan.getFigures(), settlementRef,
                command.getAttachmentRef(), command.getDenominations(), journalEntryIds, command.getActorId()));
            TellerSettlement settlement = saved.toDomain();
            MDC.put(CorrelationContext.SETTLEMENT_ID_MDC_KEY, settlement.getId().toString());

            outboxService.saveEvent(TellerSettlementEvent.recorded(settlement));
            auditLogService.record(tenantId, command.getActorId(), AuditAction.TELLER_SETTLED,
                "TellerSettlement", settlement.getId(),
                Map.of("tellerId", settlement.getTellerId(),
                    "systemCash", settlement.getSystemCash(),
                    "physicalCash", settlement.getPhysicalCash(),
                    "difference", settlement.getDifference(),
                    "status", settlement.getStatus()));
            idempotencyService.remember(tenantId, settlementRef, settlement.getId());
            metrics.recordSettlement(settlement.getStatus().name(), settlement.getDifference().abs().doubleValue());
            metrics.recordSettlementOutcome("settle", "success");

            log.info("Teller settled: teller={}, systemCash={}, physicalCash={}, difference={}, status={}",
                settlement.getTellerId(), systemCash, settlement.getPhysicalCash(),
                settlement.getDifference(), settlement.getStatus());
            return SettlementOutcome.created(settlement);

        } catch (CoopLedgerException e) {
            metrics.recordSettlementOutcome("settle", e.getCode().name());
            throw e;
        }
    }

    /**
     * Reverses every journal entry of a settlement, last first, and marks it REVERTED.
     * The teller account is back to its pre-settlement balance and can be settled again.
     *
     * @throws CoopLedgerException SETTLEMENT_NOT_FOUND, DAY_NOT_OPEN, ALREADY_REVERTED or ALREADY_APPROVED
     */
    @Transactional
    public TellerSettlement unsettle(String tenantId, UUID settlementId, String actor, String reason) {
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
        MDC.put(CorrelationContext.SETTLEMENT_ID_MDC_KEY, settlementId.toString());

        try {
            UUID dayBookId = repository.findDayBookId(tenantId, settlementId)
                .orElseThrow(() -> notFound(settlementId));
            DayBook day = dayBookService.lockDay(dayBookId)
                .orElseThrow(() -> new IllegalStateException("Settlement refers to a missing day: " + dayBookId));

            if (day.getStatus() != DayBookStatus.OPEN) {
                throw new CoopLedgerException(ErrorCode.DAY_NOT_OPEN,
                    String.format("Day %s is %s; settlements can only be reverted while it is open",
                        day.getDate(), day.getStatus()),
                    Map.of("dayBookId", day.getId(), "status", day.getStatus()));
            }

            TellerSettlementEntity entity = repository.findByIdForUpdate(settlementId)
                .orElseThrow(() -> notFound(settlementId));
            if (entity.getStatus() == SettlementStatus.REVERTED) {
                throw new CoopLedgerException(ErrorCode.ALREADY_REVERTED,
                    "Settlement is already reverted: " + settlementId, Map.of("settlementId", settlementId));
            }
            if (entity.getStatus() == SettlementStatus.APPROVED) {
                throw new CoopLedgerException(ErrorCode.ALREADY_APPROVED,
                    "Settlement is approved and can no longer be reverted: " + settlementId,
                    Map.of("settlementId", settlementId, "approvedBy", entity.getApprovedBy()));
            }

            LocalDateTime postedAt = calendar.postingTimestamp(day.getDate());
            List<UUID> journalEntryIds = entity.getJournalEntryIds();
            for (int i = journalEntryIds.size() - 1; i >= 0; i--) {
                UUID journalEntryId = journalEntryIds.get(i);
                ledgerService.reverse(tenantId, journalEntryId,
                    "Reversal of settlement " + entity.getSettlementRef() + ": " + reason, postedAt);
            }

            entity.revert(actor, reason);
            TellerSettlement settlement = repository.saveAndFlush(entity).toDomain();

            outboxService.saveEvent(TellerSettlementEvent.reverted(settlement));
            auditLogService.record(tenantId, actor, AuditAction.TELLER_UNSETTLED, "TellerSettlement",
                settlementId, Map.of("reason", reason, "reversedEntries", journalEntryIds.size()));
            metrics.recordSettlementOutcome("unsettle", "success");

            log.info("Teller settlement reverted: teller={}, entries={}, reason={}",
                settlement.getTellerId(), journalEntryIds.size(), reason);
            return settlement;

        } catch (CoopLedgerException e) {
            metrics.recordSettlementOutcome("unsettle", e.getCode().name());
            throw e;
        }
    }

    /**
     * Records the formal approval of a settlement. An approved settlement can no longer be reverted.
     *
     * @throws CoopLedgerException SETTLEMENT_NOT_FOUND, ALREADY_APPROVED or ALREADY_REVERTED
     */
    @Transactional
    public TellerSettlement approve(String tenantId, UUID settlementId, String approver) {
        MDC.put(CorrelationContext.SETTLEMENT_ID_MDC_KEY, settlementId.toString());

        TellerSettlementEntity entity = repository.findByIdForUpdate(settlementId)
            .filter(found -> found.getTenantId().equals(tenantId))
            .orElseThrow(() -> notFound(settlementId));
        switch (entity.getStatus()) {
            case APPROVED -> throw new CoopLedgerException(ErrorCode.ALREADY_APPROVED,
                "Settlement is already approved: " + settlementId, Map.of("settlementId", settlementId));
            case REVERTED -> throw new CoopLedgerException(ErrorCode.ALREADY_REVERTED,
                "Settlement was reverted and cannot be approved: " + settlementId,
                Map.of("settlementId", settlementId));
            default -> entity.approve(approver);
        }

        TellerSettlement settlement = repository.saveAndFlush(entity).toDomain();
        outboxService.saveEvent(TellerSettlementEvent.approved(settlement));
        auditLogService.record(tenantId, approver, AuditAction.SETTLEMENT_APPROVED, "TellerSettlement",
            settlementId, Map.of("difference", settlement.getDifference()));
        metrics.recordSettlementOutcome("approve", "success");

        log.info("Teller settlement approved: teller={}, approver={}", settlement.getTellerId(), approver);
        return settlement;
    }

    /**
     * Settlement history, newest first, optionally narrowed to one day, teller or status.
     */
    @Transactional(readOnly = true)
    public Page<TellerSettlement> list(String tenantId, UUID dayBookId, String tellerId,
                                       SettlementStatus status, Pageable pageable) {
        Specification<TellerSettlementEntity> spec = (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId);
        if (dayBookId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("dayBookId"), dayBookId));
        }
        if (tellerId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("tellerId"), tellerId));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        return repository.findAll(spec, pageable).map(TellerSettlementEntity::toDomain);
    }

    /**
     * Flags every still-reversible settlement of a day as closed by force. Status is left as is.
     *
     * @return number of settlements flagged
     */
    @Transactional
    public int flagForceClosed(UUID dayBookId) {
        return repository.markForceClosed(dayBookId,
            EnumSet.of(SettlementStatus.AUTO_APPROVED, SettlementStatus.REQUIRES_APPROVAL), Instant.now());
    }

    @Transactional(readOnly = true)
    public List<TellerSettlement> findByDay(UUID dayBookId) {
        return repository.findByDayBookIdOrderByExecutedAtAsc(dayBookId).stream()
            .map(TellerSettlementEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<TellerSettlement> findByReference(String tenantId, String settlementRef) {
        return repository.findByTenantIdAndSettlementRef(tenantId, settlementRef)
            .map(TellerSettlementEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public TellerSettlement getSettlement(String tenantId, UUID settlementId) {
        return findEntity(tenantId, settlementId).toDomain();
    }

    private SettlementPlan plan(String tenantId, Account teller, BigDecimal systemCash, BigDecimal physicalCash) {
        SettlementFigures figures = calculator.figures(systemCash, physicalCash);
        Account staffReceivable = figures.getVarianceType() == SettlementFigures.VarianceType.SHORTAGE
            ? roleRegistry.resolve(tenantId, AccountRole.STAFF_RECEIVABLE)
            : null;
        Account sundryIncome = figures.getVarianceType() == SettlementFigures.VarianceType.OVERAGE
            ? roleRegistry.resolve(tenantId, AccountRole.SUNDRY_INCOME)
            : null;
        Account vault = roleRegistry.resolve(tenantId, AccountRole.VAULT_CASH);
        return new SettlementPlan(teller, figures,
            calculator.entries(teller, figures, staffReceivable, sundryIncome, vault));
    }

    private TellerSettlementEntity findEntity(String tenantId, UUID settlementId) {
        return repository.findById(settlementId)
            .filter(found -> found.getTenantId().equals(tenantId))
            .orElseThrow(() -> notFound(settlementId));
    }

    private static void validate(SettleCommand command) {
        if (command.getTellerId() == null || command.getTellerId().isBlank()) {
            throw new IllegalArgumentException("Teller id is required");
        }
        if (command.getPhysicalCash() == null || command.getPhysicalCash().signum() < 0) {
            throw new IllegalArgumentException("Physical cash must be zero or positive");
        }
        if (JournalLine.exceedsMoneyScale(command.getPhysicalCash())) {
            throw new IllegalArgumentException(
                "Physical cash is limited to " + JournalLine.MONEY_SCALE + " decimal places");
        }
    }

    private static CoopLedgerException notFound(UUID settlementId) {
        return new CoopLedgerException(ErrorCode.SETTLEMENT_NOT_FOUND,
            "Settlement not found: " + settlementId, Map.of("settlementId", settlementId));
    }
}
