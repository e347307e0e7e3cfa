package com.flagship.budget_engine.recurring;

import com.flagship.budget_engine.exception.PersistenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecurringExecutionSchedulerTest {

    private final RecurringExecutionService executionService = mock(RecurringExecutionService.class);
    private final RecurringExecutionScheduler scheduler = new RecurringExecutionScheduler(executionService);

    @Test
    @DisplayName("Scheduled run executes due series with default options")
    void testRunsBatch() {
        ExecutionResult result = new ExecutionResult("run-1", false, List.of(),
            List.of(new ExecutionFailure(UUID.randomUUID(), "Gym", ExecutionFailure.INACTIVE)),
            new ExecutionSummary(1, 0, 1, BigDecimal.ZERO));
        when(executionService.runDueRecurring(any(ExecutionOptions.class))).thenReturn(result);

        scheduler.runDueSeries();

        verify(executionService).runDueRecurring(ExecutionOptions.defaults());
    }

    @Test
    @DisplayName("Aborted batch does not propagate out of the scheduler thread")
    void testAbortedBatchLogged() {
        when(executionService.runDueRecurring(any(ExecutionOptions.class)))
            .thenThrow(new PersistenceException("Data port operation failed: loadActiveSeries",
                new IllegalStateException("down")));

        assertDoesNotThrow(scheduler::runDueSeries);
    }
}
