package com.flagship.budget_engine.port;

import com.flagship.budget_engine.exception.ErrorCode;
import com.flagship.budget_engine.exception.NotFoundException;
import com.flagship.budget_engine.exception.PersistenceException;
import com.flagship.budget_engine.recurring.SeriesUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GuardedDataPortTest {

    private BudgetDataPort delegate;
    private BudgetDataPort guarded;

    @BeforeEach
    void setUp() {
        delegate = mock(BudgetDataPort.class);
        guarded = GuardedDataPort.wrap(delegate);
    }

    @Test
    @DisplayName("Host failures are translated into persistence errors")
    void testFailureTranslated() {
        UUID seriesId = UUID.randomUUID();
        RuntimeException cause = new RuntimeException("deadlock detected");
        doThrow(cause).when(delegate).updateSeries(eq(seriesId), any(SeriesUpdate.class));

        PersistenceException exception = assertThrows(PersistenceException.class,
            () -> guarded.updateSeries(seriesId, SeriesUpdate.builder().failedExecutions(1).build()));

        assertEquals(ErrorCode.PERSISTENCE, exception.getErrorCode());
        assertSame(cause, exception.getCause());
        assertTrue(exception.getMessage().contains("updateSeries"));
    }

    @Test
    @DisplayName("Engine errors raised by the host pass through unchanged")
    void testEngineErrorsPassThrough() {
        NotFoundException notFound = new NotFoundException("no such user");
        when(delegate.loadBudgetsByUser("user-1")).thenThrow(notFound);

        NotFoundException exception = assertThrows(NotFoundException.class,
            () -> guarded.loadBudgetsByUser("user-1"));

        assertSame(notFound, exception);
    }

    @Test
    @DisplayName("Null results are treated as empty")
    void testNullResultsAreEmpty() {
        UUID seriesId = UUID.randomUUID();
        when(delegate.loadActiveSeries()).thenReturn(null);
        when(delegate.loadSeries(seriesId)).thenReturn(null);
        when(delegate.loadPeriodsByUser("user-1")).thenReturn(null);

        assertTrue(guarded.loadActiveSeries().isEmpty());
        assertTrue(guarded.loadSeries(seriesId).isEmpty());
        assertTrue(guarded.loadPeriodsByUser("user-1").isEmpty());
    }

    @Test
    @DisplayName("Wrapping is idempotent and requires a port")
    void testWrap() {
        assertSame(guarded, GuardedDataPort.wrap(guarded));
        assertThrows(IllegalArgumentException.class, () -> GuardedDataPort.wrap(null));
    }
}
