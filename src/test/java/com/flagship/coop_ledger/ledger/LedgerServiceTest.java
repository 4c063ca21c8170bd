package com.flagship.coop_ledger.ledger;

import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCode;
import com.flagship.coop_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the posting engine: unbalanced entries, group accounts,
 * concurrent postings to one account and edits to posted rows.
 */
class LedgerServiceTest extends IntegrationTestSupport {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String tenantId;
    private Chart chart;
    private final LocalDateTime postedAt = LocalDateTime.of(2026, 3, 15, 10, 30);

    @BeforeEach
    void setUp() {
        tenantId = newTenant();
        chart = setUpChart(tenantId);
    }

    @Test
    @DisplayName("Balanced entry moves both accounts in their normal-side sign")
    void balancedEntryUpdatesBalances() {
        printTestHeader("Balanced Entry");
        BigDecimal amount = new BigDecimal("100.00");
        printInput("Lines", "Dr vault " + amount + " / Cr member savings " + amount);

        PostingResult result = ledgerService.post(tenantId, "Cash deposit", List.of(
            JournalLine.debit(chart.vault.getId(), amount),
            JournalLine.credit(chart.memberDeposits.getId(), amount)), postedAt);

        printOutput("Entry number", result.getJournalEntry().getEntryNumber());
        assertEquals(2, result.getLedgerLines().size());
        assertEquals(0, amount.compareTo(ledgerService.getAccountBalance(chart.vault.getId())));
        assertEquals(0, amount.compareTo(ledgerService.getAccountBalance(chart.memberDeposits.getId())),
            "A credit raises a liability balance");
        assertEquals(0, amount.compareTo(result.getLedgerLines().get(0).getBalance()),
            "Each line snapshots the balance after it");
        printSuccess("Balances updated");
    }

    @Test
    @DisplayName("Unbalanced entry is rejected and leaves nothing behind")
    void unbalancedEntryRejected() {
        printTestHeader("Unbalanced Entry");

        CoopLedgerException e = assertThrows(CoopLedgerException.class, () ->
            ledgerService.post(tenantId, "Broken", List.of(
                JournalLine.debit(chart.vault.getId(), new BigDecimal("100.00")),
                JournalLine.credit(chart.memberDeposits.getId(), new BigDecimal("99.00"))), postedAt));

        printExpectedException(e.getCode().name(), e.getMessage());
        assertEquals(ErrorCode.DOUBLE_ENTRY_MISMATCH, e.getCode());
        assertEquals(0, ledgerService.countJournalEntries(tenantId, postedAt.toLocalDate()));
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.getAccountBalance(chart.vault.getId())));
    }

    @Test
    @DisplayName("Differences up to 0.01 are tolerated")
    void epsilonTolerance() {
        assertDoesNotThrow(() -> ledgerService.post(tenantId, "Rounding", List.of(
            JournalLine.debit(chart.vault.getId(), new BigDecimal("100.005")),
            JournalLine.credit(chart.memberDeposits.getId(), new BigDecimal("100.00"))), postedAt));
    }

    @Test
    @DisplayName("Amounts finer than four decimal places are refused before anything is written")
    void subUnitAmountRejected() {
        ledgerService.post(tenantId, "Opening", List.of(
            JournalLine.debit(chart.vault.getId(), new BigDecimal("0.0001")),
            JournalLine.credit(chart.memberDeposits.getId(), new BigDecimal("0.0001"))), postedAt);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
            ledgerService.post(tenantId, "Sub-unit", List.of(
                JournalLine.debit(chart.memberDeposits.getId(), new BigDecimal("0.00005")),
                JournalLine.credit(chart.vault.getId(), new BigDecimal("0.00005"))), postedAt));

        printExpectedException("IllegalArgumentException", e.getMessage());
        assertEquals(1, ledgerService.countJournalEntries(tenantId, postedAt.toLocalDate()));
        assertEquals(0, new BigDecimal("0.0001").compareTo(ledgerService.getAccountBalance(chart.vault.getId())));
        assertDoesNotThrow(() -> JournalLine.debit(chart.vault.getId(), new BigDecimal("12.34560000")),
            "Trailing zeros do not count as precision");
    }

    @Test
    @DisplayName("Group accounts cannot receive postings")
    void groupAccountRejected() {
        Account group = accountService.createAccount(tenantId, "00-10000-01-00001", "Assets",
            AccountType.ASSET, true, null);

        CoopLedgerException e = assertThrows(CoopLedgerException.class, () ->
            ledgerService.post(tenantId, "To a group", List.of(
                JournalLine.debit(group.getId(), BigDecimal.TEN),
                JournalLine.credit(chart.memberDeposits.getId(), BigDecimal.TEN)), postedAt));

        assertEquals(ErrorCode.ACCOUNT_NOT_POSTABLE, e.getCode());
    }

    @Test
    @DisplayName("Another tenant's account cannot be posted to")
    void foreignAccountRejected() {
        String otherTenant = newTenant();
        Account foreign = accountService.createAccount(otherTenant, null, "Foreign cash",
            AccountType.ASSET, false, null);

        CoopLedgerException e = assertThrows(CoopLedgerException.class, () ->
            ledgerService.post(tenantId, "Cross tenant", List.of(
                JournalLine.debit(foreign.getId(), BigDecimal.TEN),
                JournalLine.credit(chart.memberDeposits.getId(), BigDecimal.TEN)), postedAt));

        assertEquals(ErrorCode.ACCOUNT_NOT_POSTABLE, e.getCode());
    }

    @Test
    @DisplayName("Entry numbers run JE-<year>-000001, 000002, ... per tenant")
    void entryNumbering() {
        PostingResult first = post(BigDecimal.ONE);
        PostingResult second = post(BigDecimal.ONE);

        assertEquals("JE-2026-000001", first.getJournalEntry().getEntryNumber());
        assertEquals("JE-2026-000002", second.getJournalEntry().getEntryNumber());
        assertTrue(second.getLedgerLines().get(0).getSequenceNumber()
            > first.getLedgerLines().get(1).getSequenceNumber());
    }

    @Test
    @DisplayName("Reversal restores the balances and keeps the original entry")
    void reversal() {
        PostingResult original = post(new BigDecimal("250.00"));

        PostingResult reversal = ledgerService.reverse(tenantId, original.getJournalEntry().getId(),
            "Reversal", postedAt);

        assertNotEquals(original.getJournalEntry().getId(), reversal.getJournalEntry().getId());
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.getAccountBalance(chart.vault.getId())));
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.getAccountBalance(chart.memberDeposits.getId())));
        assertEquals(2, ledgerService.findJournalEntries(tenantId, postedAt.toLocalDate()).size());
    }

    @Test
    @DisplayName("Account balance equals the sum of its ledger lines")
    void balanceMatchesLines() {
        post(new BigDecimal("100.00"));
        post(new BigDecimal("40.50"));
        ledgerService.post(tenantId, "Withdrawal", List.of(
            JournalLine.debit(chart.memberDeposits.getId(), new BigDecimal("30.25")),
            JournalLine.credit(chart.vault.getId(), new BigDecimal("30.25"))), postedAt);

        BigDecimal fromLines = ledgerService.getLedgerLinesForAccount(chart.vault.getId()).stream()
            .map(line -> line.getDebit().subtract(line.getCredit()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal balance = ledgerService.getAccountBalance(chart.vault.getId());

        printOutput("Balance", balance);
        printOutput("Sum of lines", fromLines);
        assertEquals(0, new BigDecimal("110.25").compareTo(balance));
        assertEquals(0, fromLines.compareTo(balance));
    }

    @Test
    @DisplayName("Concurrent postings to one account never lose an update")
    void concurrentPostings() throws Exception {
        printTestHeader("Concurrent Postings");
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PostingResult>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return post(new BigDecimal("10.00"));
            }));
        }
        start.countDown();
        for (Future<PostingResult> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        BigDecimal balance = ledgerService.getAccountBalance(chart.vault.getId());
        printOutput("Final balance", balance);
        assertEquals(0, new BigDecimal("100.00").compareTo(balance));
        assertEquals(threads, ledgerService.countJournalEntries(tenantId, postedAt.toLocalDate()));
        printSuccess("No lost updates");
    }

    @Test
    @DisplayName("Posted journal entries and lines cannot be edited or deleted")
    void postedRowsAreImmutable() {
        PostingResult result = post(BigDecimal.TEN);

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "UPDATE journal_entries SET description = 'edited' WHERE id = ?", result.getJournalEntry().getId()));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "DELETE FROM ledger_lines WHERE journal_entry_id = ?", result.getJournalEntry().getId()));
    }

    private PostingResult post(BigDecimal amount) {
        return ledgerService.post(tenantId, "Deposit", List.of(
            JournalLine.debit(chart.vault.getId(), amount),
            JournalLine.credit(chart.memberDeposits.getId(), amount)), postedAt);
    }
}
