package com.flagship.budget_engine.period;

import com.flagship.budget_engine.exception.ConflictException;
import com.flagship.budget_engine.exception.NotFoundException;
import com.flagship.budget_engine.observability.EngineMetrics;
import com.flagship.budget_engine.port.InMemoryBudgetDataPort;
import com.flagship.budget_engine.transaction.TransactionAggregator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.flagship.budget_engine.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for closing a period and chaining the next one.
 *
 * These tests verify that:
 * - Closing persists the totals and starts the next period the day after
 * - A failed chained start does not undo the close
 * - A repeated close is idempotent and does not re-aggregate
 */
class BudgetPeriodServiceTest {

    private static final LocalDate MARCH_31 = LocalDate.of(2025, 3, 31);

    private InMemoryBudgetDataPort dataPort;
    private SimpleMeterRegistry registry;
    private BudgetPeriodService service;

    @BeforeEach
    void setUp() {
        dataPort = new InMemoryBudgetDataPort();
        registry = new SimpleMeterRegistry();
        BudgetPeriodManager manager = new BudgetPeriodManager(new TransactionAggregator(properties()), properties());
        service = new BudgetPeriodService(dataPort, manager, new EngineMetrics(registry),
            clockAt("2025-04-01T08:00:00"));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Close persists totals and chains the next period on the following day")
    void testCloseChainsNextPeriod() {
        printTestHeader("Close And Chain");

        BudgetPeriod active = activePeriod("2025-03-01");
        dataPort.addPeriod(active)
            .addBudget(budget("500.00", "groceries"))
            .addTransaction(expense("groceries", "450.00", "2025-03-10"))
            .addTransaction(income("groceries", "20.00", "2025-03-11"));

        PeriodClosure closure = service.closePeriod(USER_ID, MARCH_31);

        printOutput("Closed", closure.getClosedPeriod());
        printOutput("Next", closure.getNextPeriod());

        BudgetPeriod persisted = dataPort.period(active.getId());
        assertFalse(persisted.isActive());
        assertEquals(MARCH_31, persisted.getEndDate());
        assertEquals(new BigDecimal("430.00"), persisted.getTotalSpent());
        assertEquals(new BigDecimal("70.00"), persisted.getTotalSaved());

        assertTrue(closure.hasNextPeriod());
        assertFalse(closure.isAlreadyClosed());
        assertEquals(LocalDate.of(2025, 4, 1), closure.getNextPeriod().getStartDate());
        assertEquals(PeriodState.ACTIVE, closure.getNextPeriod().getState());
        assertEquals(2, dataPort.periods().size());
        assertEquals(1.0, registry.counter("budget.periods.closed").count());
        assertEquals(1.0, registry.counter("budget.periods.started").count());
        printSuccess("Period closed with saved 70.00 and next period started on 2025-04-01");
    }

    @Test
    @DisplayName("Failure to start the next period keeps the close and reports the error")
    void testChainFailureKeepsClose() {
        BudgetPeriod active = activePeriod("2025-03-01");
        dataPort.addPeriod(active);
        dataPort.failPeriodCreation();

        PeriodClosure closure = assertDoesNotThrow(() -> service.closePeriod(USER_ID, MARCH_31));

        assertFalse(closure.hasNextPeriod());
        assertNotNull(closure.getNextPeriodError());
        assertEquals(MARCH_31, dataPort.period(active.getId()).getEndDate());
        assertEquals(1, dataPort.periods().size());
        assertEquals(PeriodState.CLOSED, service.getState(USER_ID));
        assertEquals(1.0, registry.counter("budget.periods.chain.failures").count());
    }

    @Test
    @DisplayName("Repeating a close on the same date returns the closed period without re-aggregating")
    void testRepeatedCloseIsIdempotent() {
        dataPort.addPeriod(activePeriod("2025-03-01"))
            .addBudget(budget("200.00", "fuel"))
            .addTransaction(expense("fuel", "60.00", "2025-03-15"));

        PeriodClosure first = service.closePeriod(USER_ID, MARCH_31);
        int loadsAfterFirst = dataPort.transactionLoads();
        int updatesAfterFirst = dataPort.periodUpdates();

        PeriodClosure second = service.closePeriod(USER_ID, MARCH_31);

        assertTrue(second.isAlreadyClosed());
        assertEquals(first.getClosedPeriod().getId(), second.getClosedPeriod().getId());
        assertEquals(new BigDecimal("60.00"), second.getClosedPeriod().getTotalSpent());
        assertEquals(loadsAfterFirst, dataPort.transactionLoads());
        assertEquals(updatesAfterFirst, dataPort.periodUpdates());
        assertEquals(2, dataPort.periods().size());
    }

    @Test
    @DisplayName("Active period starting on the previous end date is closed on that date, not reported as already closed")
    void testActivePeriodStartingOnPreviousEndDateIsClosed() {
        BudgetPeriod march = activePeriod("2025-03-01");
        dataPort.addPeriod(march);
        dataPort.failPeriodCreation();
        service.closePeriod(USER_ID, MARCH_31);

        BudgetPeriod restarted = activePeriod("2025-03-31");
        dataPort.addPeriod(restarted)
            .addBudget(budget("100.00", "dining"))
            .addTransaction(expense("dining", "30.00", "2025-03-31"));

        PeriodClosure closure = service.closePeriod(USER_ID, MARCH_31);

        assertFalse(closure.isAlreadyClosed());
        assertEquals(restarted.getId(), closure.getClosedPeriod().getId());
        BudgetPeriod persisted = dataPort.period(restarted.getId());
        assertFalse(persisted.isActive());
        assertEquals(MARCH_31, persisted.getEndDate());
        assertEquals(new BigDecimal("30.00"), persisted.getTotalSpent());
        assertEquals(2.0, registry.counter("budget.periods.closed").count());
    }

    @Test
    @DisplayName("Closing without an active period is not found")
    void testCloseWithoutActivePeriod() {
        NotFoundException exception = assertThrows(NotFoundException.class,
            () -> service.closePeriod(USER_ID, MARCH_31));

        assertTrue(exception.getMessage().contains(USER_ID));
    }

    @Test
    @DisplayName("Blank user or missing end date is rejected")
    void testArgumentsValidated() {
        assertThrows(IllegalArgumentException.class, () -> service.closePeriod(" ", MARCH_31));
        assertThrows(IllegalArgumentException.class, () -> service.closePeriod(USER_ID, null));
    }

    @Test
    @DisplayName("User without periods is in NO_PERIOD until the first start")
    void testNoPeriodState() {
        assertEquals(PeriodState.NO_PERIOD, service.getState(USER_ID));

        service.startPeriod(USER_ID, LocalDate.of(2025, 3, 1));

        assertEquals(PeriodState.ACTIVE, service.getState(USER_ID));
    }

    @Test
    @DisplayName("Starting while a period is active is a conflict")
    void testStartConflict() {
        dataPort.addPeriod(activePeriod("2025-03-01"));

        assertThrows(ConflictException.class, () -> service.startPeriod(USER_ID, LocalDate.of(2025, 3, 15)));
        assertEquals(0.0, registry.counter("budget.periods.started").count());
    }

    @Test
    @DisplayName("Periods are listed newest first and the active one is found")
    void testGetPeriods() {
        dataPort.addPeriod(activePeriod("2025-01-01"));
        service.closePeriod(USER_ID, LocalDate.of(2025, 1, 31));
        service.closePeriod(USER_ID, LocalDate.of(2025, 2, 28));

        List<BudgetPeriod> periods = service.getPeriods(USER_ID);

        assertEquals(3, periods.size());
        assertEquals(LocalDate.of(2025, 3, 1), periods.get(0).getStartDate());
        assertEquals(LocalDate.of(2025, 1, 1), periods.get(2).getStartDate());
        assertEquals(LocalDate.of(2025, 3, 1), service.getActivePeriod(USER_ID).orElseThrow().getStartDate());
    }
}
