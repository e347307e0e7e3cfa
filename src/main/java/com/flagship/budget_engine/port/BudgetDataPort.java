package com.flagship.budget_engine.port;

import com.flagship.budget_engine.budget.Budget;
import com.flagship.budget_engine.common.DateRange;
import com.flagship.budget_engine.period.BudgetPeriod;
import com.flagship.budget_engine.period.PeriodUpdate;
import com.flagship.budget_engine.recurring.RecurringTransactionSeries;
import com.flagship.budget_engine.recurring.SeriesUpdate;
import com.flagship.budget_engine.transaction.NewTransaction;
import com.flagship.budget_engine.transaction.Transaction;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage seam supplied by the host application.
 *
 * The engine never owns persistent storage: it reads already-authorized snapshots through
 * this interface and writes back mutation commands. Implementations may throw any runtime
 * exception; the engine surfaces those as
 * {@link com.flagship.budget_engine.exception.PersistenceException}.
 */
public interface BudgetDataPort {

    List<RecurringTransactionSeries> loadActiveSeries();

    Optional<RecurringTransactionSeries> loadSeries(UUID seriesId);

    /**
     * @param range optional window; null loads every transaction of the user
     */
    List<Transaction> loadTransactionsByUser(String userId, DateRange range);

    /**
     * Transactions tagged with {@code recurringSeriesId == seriesId}.
     */
    List<Transaction> loadTransactionsBySeries(UUID seriesId);

    List<Budget> loadBudgetsByUser(String userId);

    List<BudgetPeriod> loadPeriodsByUser(String userId);

    /**
     * Persists a new transaction and returns it with its assigned id.
     */
    Transaction createTransaction(NewTransaction payload);

    void updateSeries(UUID seriesId, SeriesUpdate update);

    void updatePeriod(UUID periodId, PeriodUpdate update);

    BudgetPeriod createPeriod(BudgetPeriod period);
}
