package com.flagship.coop_ledger.ledger;

import com.flagship.coop_ledger.audit.AuditAction;
import com.flagship.coop_ledger.audit.AuditLogService;
import com.flagship.coop_ledger.daybook.BusinessCalendar;
import com.flagship.coop_ledger.daybook.DayBook;
import com.flagship.coop_ledger.daybook.DayBookService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Operator-entered journal entries. They are only accepted while a day is OPEN
 * and are dated into that day.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManualJournalService {

    private final DayBookService dayBookService;
    private final BusinessCalendar calendar;
    private final LedgerService ledgerService;
    private final AuditLogService auditLogService;

    @Transactional
    public PostingResult post(String tenantId, String description, List<JournalLine> lines, String actor) {
        DayBook day = dayBookService.lockActiveDay(tenantId);
        PostingResult result = ledgerService.post(tenantId, description, lines,
            calendar.postingTimestamp(day.getDate()));

        auditLogService.record(tenantId, actor, AuditAction.JOURNAL_POSTED, "JournalEntry",
            result.getJournalEntry().getId(),
            Map.of("entryNumber", result.getJournalEntry().getEntryNumber(), "lines", lines.size()));
        log.info("Manual journal entry posted: number={}, actor={}", result.getJournalEntry().getEntryNumber(), actor);
        return result;
    }
}
