package com.flagship.coop_ledger.daybook;

import com.flagship.coop_ledger.common.error.CoopLedgerException;
import com.flagship.coop_ledger.common.error.ErrorCategory;
import com.flagship.coop_ledger.common.error.ErrorCode;
import com.flagship.coop_ledger.common.error.TellerPendingSettlementException;
import com.flagship.coop_ledger.ledger.Account;
import com.flagship.coop_ledger.ledger.AccountRole;
import com.flagship.coop_ledger.ledger.JournalLine;
import com.flagship.coop_ledger.ledger.LedgerService;
import com.flagship.coop_ledger.settlement.SettleCommand;
import com.flagship.coop_ledger.settlement.TellerSettlement;
import com.flagship.coop_ledger.settlement.TellerSettlementService;
import com.flagship.coop_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Day close, force close and reopen, including the close race.
 */
class DayCloseServiceTest extends IntegrationTestSupport {

    private static final String MANAGER = "manager-1";
    private static final String TELLER = "teller-1";

    @Autowired
    private DayBookService dayBookService;

    @Autowired
    private DayCloseService dayCloseService;

    @Autowired
    private TellerSettlementService settlementService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private BusinessCalendar calendar;

    private String tenantId;
    private Chart chart;
    private Account tellerAccount;
    private LocalDate today;

    @BeforeEach
    void setUp() {
        tenantId = newTenant();
        chart = setUpChart(tenantId);
        tellerAccount = createTellerAccount(tenantId, TELLER, 1);
        today = calendar.today();
    }

    @Test
    @DisplayName("Close with every teller settled snapshots vault cash and entry count")
    void closeWithAllTellersSettled() {
        printTestHeader("Normal Close");
        DayBook day = dayBookService.startDay(tenantId, today, MANAGER);
        fundVault(new BigDecimal("10000.00"));

        DayBook closed = dayCloseService.closeDay(tenantId, MANAGER);

        printOutput("Closed day", closed);
        assertEquals(DayBookStatus.CLOSED, closed.getStatus());
        assertEquals(0, new BigDecimal("10000.00").compareTo(closed.getClosingCash()));
        assertEquals(1, closed.getTransactionsCount());
        assertEquals(MANAGER, closed.getDayEndBy());
        assertNotNull(closed.getClosedAt());
        assertEquals(day.getVersion() + 2, closed.getVersion(), "OPEN -> EOD_IN_PROGRESS -> CLOSED");
        printSuccess("Day closed");
    }

    @Test
    @DisplayName("Close fails listing the teller that still holds 50, and the day stays OPEN")
    void closeRefusedWhileTellerHoldsCash() {
        printTestHeader("Pending Teller Settlement");
        DayBook day = dayBookService.startDay(tenantId, today, MANAGER);
        fundVault(new BigDecimal("1000.00"));
        issueToTeller(new BigDecimal("50.00"));

        TellerPendingSettlementException e = assertThrows(TellerPendingSettlementException.class,
            () -> dayCloseService.closeDay(tenantId, MANAGER));

        printExpectedException(e.getCode().name(), e.getMessage());
        assertEquals(ErrorCode.TELLER_PENDING_SETTLEMENT, e.getCode());
        assertEquals(1, e.getPendingTellers().size());
        TellerPendingSettlementException.PendingTeller pending = e.getPendingTellers().get(0);
        assertEquals(tellerAccount.getId(), pending.getAccountId());
        assertEquals(tellerAccount.getCode(), pending.getCode());
        assertEquals(0, new BigDecimal("50.00").compareTo(pending.getBalance()));

        DayBook after = dayBookService.findById(day.getId()).orElseThrow();
        assertEquals(DayBookStatus.OPEN, after.getStatus(), "The close lock must roll back");
        assertEquals(day.getVersion(), after.getVersion());
    }

    @Test
    @DisplayName("Force close sweeps a positive teller balance to suspense and closes")
    void forceCloseSweepsToSuspense() {
        printTestHeader("Force Close");
        dayBookService.startDay(tenantId, today, MANAGER);
        fundVault(new BigDecimal("1000.00"));
        issueToTeller(new BigDecimal("50.00"));
        printInput("Reason", "EOM override");

        DayBook closed = dayCloseService.forceCloseDay(tenantId, MANAGER, "EOM override", "director-1");

        Account suspense = roleRegistry.resolve(tenantId, AccountRole.SUSPENSE);
        printOutput("Suspense balance", ledgerService.getAccountBalance(suspense.getId()));
        assertEquals(DayBookStatus.CLOSED, closed.getStatus());
        assertEquals("EOM override", closed.getForceCloseReason());
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.getAccountBalance(tellerAccount.getId())));
        assertEquals(0, new BigDecimal("50.00").compareTo(ledgerService.getAccountBalance(suspense.getId())));
        assertEquals(0, new BigDecimal("950.00").compareTo(closed.getClosingCash()));
        printSuccess("Teller zeroed, day closed");
    }

    @Test
    @DisplayName("Force close zeroes negative teller balances too, and flags open settlements")
    void forceCloseNegativeBalanceAndFlagsSettlements() {
        dayBookService.startDay(tenantId, today, MANAGER);
        fundVault(new BigDecimal("1000.00"));
        issueToTeller(new BigDecimal("400.00"));
        TellerSettlement settlement = settlementService.settle(SettleCommand.builder()
            .tenantId(tenantId).tellerId(TELLER).physicalCash(new BigDecimal("400.00")).actorId(TELLER)
            .build()).getSettlement();

        Account secondTeller = createTellerAccount(tenantId, "teller-2", 2);
        ledgerService.post(tenantId, "Teller paid out more than held", List.of(
            JournalLine.debit(chart.memberDeposits.getId(), new BigDecimal("30.00")),
            JournalLine.credit(secondTeller.getId(), new BigDecimal("30.00"))), calendar.postingTimestamp(today));
        assertEquals(0, new BigDecimal("-30.00").compareTo(ledgerService.getAccountBalance(secondTeller.getId())));

        dayCloseService.forceCloseDay(tenantId, MANAGER, "Teller unavailable", null);

        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.getAccountBalance(secondTeller.getId())));
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.getAccountBalance(tellerAccount.getId())));
        Account suspense = roleRegistry.resolve(tenantId, AccountRole.SUSPENSE);
        assertEquals(0, new BigDecimal("-30.00").compareTo(ledgerService.getAccountBalance(suspense.getId())));
        assertTrue(settlementService.getSettlement(tenantId, settlement.getId()).isForceClosed());
    }

    @Test
    @DisplayName("Force close and reopen require a reason")
    void reasonRequired() {
        dayBookService.startDay(tenantId, today, MANAGER);

        CoopLedgerException force = assertThrows(CoopLedgerException.class,
            () -> dayCloseService.forceCloseDay(tenantId, MANAGER, " ", null));
        assertEquals(ErrorCode.INVALID_REQUEST, force.getCode());

        dayCloseService.closeDay(tenantId, MANAGER);
        CoopLedgerException reopen = assertThrows(CoopLedgerException.class,
            () -> dayCloseService.reopenDay(tenantId, MANAGER, null, null));
        assertEquals(ErrorCode.INVALID_REQUEST, reopen.getCode());
    }

    @Test
    @DisplayName("Closing twice reports ALREADY_CLOSED; closing nothing reports NO_ACTIVE_DAY")
    void closeWithoutOpenDay() {
        CoopLedgerException none = assertThrows(CoopLedgerException.class,
            () -> dayCloseService.closeDay(tenantId, MANAGER));
        assertEquals(ErrorCode.NO_ACTIVE_DAY, none.getCode());

        dayBookService.startDay(tenantId, today, MANAGER);
        dayCloseService.closeDay(tenantId, MANAGER);

        CoopLedgerException again = assertThrows(CoopLedgerException.class,
            () -> dayCloseService.closeDay(tenantId, MANAGER));
        assertEquals(ErrorCode.ALREADY_CLOSED, again.getCode());
    }

    @Test
    @DisplayName("Today's closed day reopens with a higher version")
    void reopenToday() {
        printTestHeader("Reopen Today");
        dayBookService.startDay(tenantId, today, MANAGER);
        DayBook closed = dayCloseService.closeDay(tenantId, MANAGER);

        DayBook reopened = dayCloseService.reopenDay(tenantId, MANAGER, "Late deposit", "director-1");

        printOutput("Version", closed.getVersion() + " -> " + reopened.getVersion());
        assertEquals(DayBookStatus.OPEN, reopened.getStatus());
        assertEquals(closed.getVersion() + 1, reopened.getVersion());
        assertEquals("Late deposit", reopened.getReopenReason());
        assertNull(reopened.getClosingCash());
    }

    @Test
    @DisplayName("Yesterday's closed day can never be reopened")
    void reopenPastDayRejected() {
        LocalDate yesterday = today.minusDays(1);
        dayBookService.startDay(tenantId, yesterday, MANAGER);
        dayCloseService.closeDay(tenantId, MANAGER);

        CoopLedgerException byDate = assertThrows(CoopLedgerException.class,
            () -> dayCloseService.reopenDay(tenantId, yesterday, MANAGER, "Correction", null));
        assertEquals(ErrorCode.CANNOT_REOPEN_PAST_DAY, byDate.getCode());

        CoopLedgerException noToday = assertThrows(CoopLedgerException.class,
            () -> dayCloseService.reopenDay(tenantId, MANAGER, "Correction", null));
        assertEquals(ErrorCode.NO_DAY_FOR_TODAY, noToday.getCode());
    }

    @Test
    @DisplayName("Reopen fails for an open day and while a later day is active")
    void reopenPreconditions() {
        dayBookService.startDay(tenantId, today, MANAGER);
        CoopLedgerException open = assertThrows(CoopLedgerException.class,
            () -> dayCloseService.reopenDay(tenantId, MANAGER, "Why", null));
        assertEquals(ErrorCode.NOT_CLOSED, open.getCode());

        dayCloseService.closeDay(tenantId, MANAGER);
        dayBookService.startDay(tenantId, today.plusDays(1), MANAGER);
        CoopLedgerException laterActive = assertThrows(CoopLedgerException.class,
            () -> dayCloseService.reopenDay(tenantId, MANAGER, "Why", null));
        assertEquals(ErrorCode.DAY_ALREADY_OPEN, laterActive.getCode());
    }

    @Test
    @DisplayName("Two simultaneous closes: exactly one wins, the other gets a distinct error")
    void concurrentCloses() throws Exception {
        printTestHeader("Concurrent Close");
        dayBookService.startDay(tenantId, today, MANAGER);
        fundVault(new BigDecimal("100.00"));

        int callers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<DayBook>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            String actor = "manager-" + i;
            Callable<DayBook> close = () -> {
                start.await();
                return dayCloseService.closeDay(tenantId, actor);
            };
            futures.add(executor.submit(close));
        }
        start.countDown();

        int successes = 0;
        List<ErrorCode> failures = new ArrayList<>();
        for (Future<DayBook> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
                successes++;
            } catch (ExecutionException e) {
                CoopLedgerException cause = assertInstanceOf(CoopLedgerException.class, e.getCause());
                failures.add(cause.getCode());
            }
        }
        executor.shutdown();

        printOutput("Successes", successes);
        printOutput("Failures", failures);
        assertEquals(1, successes);
        for (ErrorCode code : failures) {
            assertTrue(code == ErrorCode.ALREADY_CLOSED || code.getCategory() == ErrorCategory.CONTENTION,
                "Unexpected failure " + code);
        }
        assertEquals(DayBookStatus.CLOSED, dayBookService.findByDate(tenantId, today).orElseThrow().getStatus());
        printSuccess("Exactly one close won");
    }

    private void fundVault(BigDecimal amount) {
        ledgerService.post(tenantId, "Member deposit", List.of(
            JournalLine.debit(chart.vault.getId(), amount),
            JournalLine.credit(chart.memberDeposits.getId(), amount)), calendar.postingTimestamp(today));
    }

    private void issueToTeller(BigDecimal amount) {
        ledgerService.post(tenantId, "Cash issued to teller", List.of(
            JournalLine.debit(tellerAccount.getId(), amount),
            JournalLine.credit(chart.vault.getId(), amount)), calendar.postingTimestamp(today));
    }
}
