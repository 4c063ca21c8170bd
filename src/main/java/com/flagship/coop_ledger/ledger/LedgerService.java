package com.flagship.coop_ledger.ledger;

import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import com.flagship.coop_ledger.ledger.event.JournalEntryPostedEvent;
import com.flagship.coop_ledger.observability.DayBookMetrics;
import com.flagship.coop_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Double-entry posting engine.
 *
 * This service enforces the core invariants:
 * 1. Debits equal credits within {@link #EPSILON} (checked here and again by a deferred trigger)
 * 2. Journal entries and ledger lines are immutable once written
 * 3. Every balance change is an atomic increment of the account's accumulator row,
 *    so concurrent postings to one account never lose an update
 *
 * Posting joins the caller's transaction. A settlement or a force close composes several
 * postings with its own state change and they commit or roll back together.
 */
@Service
@Slf4j
public class LedgerService {

    public static final BigDecimal EPSILON = new BigDecimal("0.01");

    private final JdbcTemplate jdbcTemplate;
    private final AccountService accountService;
    private final OutboxService outboxService;
    private final DayBookMetrics metrics;

    public LedgerService(JdbcTemplate jdbcTemplate, AccountService accountService,
                         OutboxService outboxService, DayBookMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountService = accountService;
        this.outboxService = outboxService;
        this.metrics = metrics;
    }

    @Transactional
    public PostingResult post(String tenantId, String description, List<JournalLine> lines,
                              LocalDateTime effectiveDate) {
        return post(new JournalRequest(tenantId, description, lines, effectiveDate));
    }

    /**
     * Posts a journal entry.
     *
     * This method:
     * 1. Rejects an unbalanced request with DOUBLE_ENTRY_MISMATCH
     * 2. Checks every account exists, belongs to the tenant and is a leaf (ACCOUNT_NOT_POSTABLE)
     * 3. Allocates {@code JE-<year>-<000001>} from the tenant's yearly sequence row
     * 4. Applies each line's signed delta to the account accumulator and snapshots the result
     * 5. Writes a JournalEntryPosted event to the outbox
     *
     * @return the entry and its lines in request order
     */
    @Transactional
    public PostingResult post(JournalRequest request) {
        if (!request.isBalanced(EPSILON)) {
            throw new CoopLedgerException(ErrorCode.DOUBLE_ENTRY_MISMATCH,
                String.format("Journal entry is not balanced: debits=%s, credits=%s",
                    request.getDebitTotal(), request.getCreditTotal()),
                Map.of("debitTotal", request.getDebitTotal(), "creditTotal", request.getCreditTotal()));
        }

        Map<UUID, Account> accounts = loadPostableAccounts(request);

        UUID journalEntryId = UUID.randomUUID();
        String entryNumber = nextEntryNumber(request.getTenantId(), request.getEffectiveDate().getYear());
        Instant createdAt = Instant.now();
        jdbcTemplate.update(
            "INSERT INTO journal_entries (id, tenant_id, entry_number, description, effective_date, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            journalEntryId,
            request.getTenantId(),
            entryNumber,
            request.getDescription(),
            Timestamp.valueOf(request.getEffectiveDate()),
            Timestamp.from(createdAt)
        );
        JournalEntry entry = new JournalEntry(journalEntryId, request.getTenantId(), entryNumber,
            request.getDescription(), request.getEffectiveDate(), createdAt);

        List<LedgerLine> ledgerLines = new ArrayList<>(request.getLines().size());
        int lineNumber = 1;
        for (JournalLine line : request.getLines()) {
            Account account = accounts.get(line.getAccountId());
            BigDecimal delta = account.getAccountType().signedDelta(line.getDebit(), line.getCredit());
            BigDecimal balance = applyDelta(account, delta);
            ledgerLines.add(createLedgerLine(entry, account, lineNumber++, line, balance));
        }

        // Deferred trigger re-checks the balance at commit
        outboxService.saveEvent(JournalEntryPostedEvent.from(entry, ledgerLines, accounts));
        metrics.recordJournalPosted(ledgerLines.size());

        log.debug("Posted journal entry: number={}, lines={}, amount={}",
            entryNumber, ledgerLines.size(), request.getDebitTotal());

        return new PostingResult(entry, ledgerLines);
    }

    /**
     * Posts the equal and opposite of an existing entry.
     */
    @Transactional
    public PostingResult reverse(String tenantId, UUID journalEntryId, String description,
                                 LocalDateTime effectiveDate) {
        getJournalEntry(tenantId, journalEntryId);
        List<JournalLine> reversedLines = getLedgerLines(journalEntryId).stream()
            .map(line -> JournalLine.of(line.getAccountId(), line.getCredit(), line.getDebit()))
            .toList();
        return post(tenantId, description, reversedLines, effectiveDate);
    }

    /**
     * Current balance from the account's accumulator, in the account's normal-side sign.
     */
    public BigDecimal getAccountBalance(UUID accountId) {
        List<BigDecimal> balances = jdbcTemplate.queryForList(
            "SELECT balance FROM account_balances WHERE account_id = ?",
            BigDecimal.class,
            accountId
        );
        if (balances.isEmpty()) {
            if (accountService.findById(accountId).isEmpty()) {
                throw new CoopLedgerException(ErrorCode.ACCOUNT_NOT_FOUND,
                    "Account not found: " + accountId, Map.of("accountId", accountId));
            }
            return BigDecimal.ZERO;
        }
        return balances.get(0);
    }

    /**
     * Balance read under a row lock held until the caller's transaction ends.
     * Two settlements of the same drawer serialize here instead of both emptying it.
     */
    @Transactional
    public BigDecimal lockAccountBalance(UUID accountId) {
        List<BigDecimal> balances = jdbcTemplate.queryForList(
            "SELECT balance FROM account_balances WHERE account_id = ? FOR UPDATE",
            BigDecimal.class,
            accountId
        );
        return balances.isEmpty() ? getAccountBalance(accountId) : balances.get(0);
    }

    public JournalEntry getJournalEntry(String tenantId, UUID journalEntryId) {
        return jdbcTemplate.query(
                "SELECT id, tenant_id, entry_number, description, effective_date, created_at " +
                "FROM journal_entries WHERE id = ? AND tenant_id = ?",
                journalEntryRowMapper(), journalEntryId, tenantId)
            .stream()
            .findFirst()
            .orElseThrow(() -> new CoopLedgerException(ErrorCode.JOURNAL_ENTRY_NOT_FOUND,
                "Journal entry not found: " + journalEntryId, Map.of("journalEntryId", journalEntryId)));
    }

    public List<LedgerLine> getLedgerLines(UUID journalEntryId) {
        return jdbcTemplate.query(
            "SELECT id, journal_entry_id, account_id, line_number, debit, credit, balance, sequence_number " +
            "FROM ledger_lines WHERE journal_entry_id = ? ORDER BY line_number",
            ledgerLineRowMapper(),
            journalEntryId
        );
    }

    /**
     * Lines posted to one account, in posting order.
     */
    public List<LedgerLine> getLedgerLinesForAccount(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT id, journal_entry_id, account_id, line_number, debit, credit, balance, sequence_number " +
            "FROM ledger_lines WHERE account_id = ? ORDER BY sequence_number",
            ledgerLineRowMapper(),
            accountId
        );
    }

    public List<JournalEntry> findJournalEntries(String tenantId, LocalDate date) {
        return jdbcTemplate.query(
            "SELECT id, tenant_id, entry_number, description, effective_date, created_at " +
            "FROM journal_entries WHERE tenant_id = ? AND effective_date >= ? AND effective_date < ? " +
            "ORDER BY entry_number",
            journalEntryRowMapper(),
            tenantId,
            Timestamp.valueOf(date.atStartOfDay()),
            Timestamp.valueOf(date.plusDays(1).atStartOfDay())
        );
    }

    public int countJournalEntries(String tenantId, LocalDate date) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entries WHERE tenant_id = ? AND effective_date >= ? AND effective_date < ?",
            Integer.class,
            tenantId,
            Timestamp.valueOf(date.atStartOfDay()),
            Timestamp.valueOf(date.plusDays(1).atStartOfDay())
        );
        return count != null ? count : 0;
    }

    private Map<UUID, Account> loadPostableAccounts(JournalRequest request) {
        Map<UUID, Account> accounts = new LinkedHashMap<>();
        for (JournalLine line : request.getLines()) {
            UUID accountId = line.getAccountId();
            if (accounts.containsKey(accountId)) {
                continue;
            }
            Account account = accountService.findById(accountId)
                .filter(found -> found.getTenantId().equals(request.getTenantId()))
                .orElseThrow(() -> notPostable(accountId, "account does not exist for this tenant"));
            if (!account.isPostable()) {
                throw notPostable(accountId, "group account " + account.getCode() + " only aggregates");
            }
            accounts.put(accountId, account);
        }
        return accounts;
    }

    /**
     * Upsert-increment on the (tenant, year) row. The row lock is held until commit,
     * so numbers stay gap-free and unique under concurrent posting.
     */
    private String nextEntryNumber(String tenantId, int year) {
        Long next = jdbcTemplate.queryForObject(
            "INSERT INTO journal_sequences (tenant_id, fiscal_year, last_value) VALUES (?, ?, 1) " +
            "ON CONFLICT (tenant_id, fiscal_year) DO UPDATE SET last_value = journal_sequences.last_value + 1 " +
            "RETURNING last_value",
            Long.class,
            tenantId,
            year
        );
        return String.format("JE-%d-%06d", year, next);
    }

    private BigDecimal applyDelta(Account account, BigDecimal delta) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO account_balances (account_id, tenant_id, balance) VALUES (?, ?, ?) " +
            "ON CONFLICT (account_id) DO UPDATE SET balance = account_balances.balance + EXCLUDED.balance, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "RETURNING balance",
            BigDecimal.class,
            account.getId(),
            account.getTenantId(),
            delta
        );
    }

    private LedgerLine createLedgerLine(JournalEntry entry, Account account, int lineNumber,
                                        JournalLine line, BigDecimal balance) {
        UUID lineId = UUID.randomUUID();
        Long sequenceNumber = jdbcTemplate.queryForObject(
            "INSERT INTO ledger_lines (id, journal_entry_id, tenant_id, account_id, line_number, debit, credit, balance) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?) RETURNING sequence_number",
            Long.class,
            lineId,
            entry.getId(),
            entry.getTenantId(),
            account.getId(),
            lineNumber,
            line.getDebit(),
            line.getCredit(),
            balance
        );
        return new LedgerLine(lineId, entry.getId(), account.getId(), lineNumber,
            line.getDebit(), line.getCredit(), balance, sequenceNumber);
    }

    private CoopLedgerException notPostable(UUID accountId, String reason) {
        return new CoopLedgerException(ErrorCode.ACCOUNT_NOT_POSTABLE,
            "Account " + accountId + " cannot be posted to: " + reason,
            Map.of("accountId", accountId, "reason", reason));
    }

    private RowMapper<JournalEntry> journalEntryRowMapper() {
        return (rs, rowNum) -> new JournalEntry(
            UUID.fromString(rs.getString("id")),
            rs.getString("tenant_id"),
            rs.getString("entry_number"),
            rs.getString("description"),
            rs.getTimestamp("effective_date").toLocalDateTime(),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private RowMapper<LedgerLine> ledgerLineRowMapper() {
        return (rs, rowNum) -> new LedgerLine(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("journal_entry_id")),
            UUID.fromString(rs.getString("account_id")),
            rs.getInt("line_number"),
            rs.getBigDecimal("debit"),
            rs.getBigDecimal("credit"),
            rs.getBigDecimal("balance"),
            rs.getLong("sequence_number")
        );
    }
}
