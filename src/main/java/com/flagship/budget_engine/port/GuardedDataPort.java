package com.flagship.budget_engine.port;

import com.flagship.budget_engine.budget.Budget;
import com.flagship.budget_engine.common.DateRange;
import com.flagship.budget_engine.exception.BudgetEngineException;
import com.flagship.budget_engine.exception.PersistenceException;
import com.flagship.budget_engine.period.BudgetPeriod;
import com.flagship.budget_engine.period.PeriodUpdate;
import com.flagship.budget_engine.recurring.RecurringTransactionSeries;
import com.flagship.budget_engine.recurring.SeriesUpdate;
import com.flagship.budget_engine.transaction.NewTransaction;
import com.flagship.budget_engine.transaction.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Decorator translating host port failures into {@link PersistenceException}.
 *
 * Null collections returned by the host are treated as empty; a null single result is
 * treated as absent.
 */
@Slf4j
public final class GuardedDataPort implements BudgetDataPort {

    private final BudgetDataPort delegate;

    private GuardedDataPort(BudgetDataPort delegate) {
        this.delegate = delegate;
    }

    /**
     * Wraps {@code port} unless it is already guarded.
     */
    public static BudgetDataPort wrap(BudgetDataPort port) {
        if (port == null) {
            throw new IllegalArgumentException("Data port is required");
        }
        if (port instanceof GuardedDataPort) {
            return port;
        }
        return new GuardedDataPort(port);
    }

    @Override
    public List<RecurringTransactionSeries> loadActiveSeries() {
        return orEmpty(guard("loadActiveSeries", delegate::loadActiveSeries));
    }

    @Override
    public Optional<RecurringTransactionSeries> loadSeries(UUID seriesId) {
        Optional<RecurringTransactionSeries> series = guard("loadSeries", () -> delegate.loadSeries(seriesId));
        return series != null ? series : Optional.empty();
    }

    @Override
    public List<Transaction> loadTransactionsByUser(String userId, DateRange range) {
        return orEmpty(guard("loadTransactionsByUser", () -> delegate.loadTransactionsByUser(userId, range)));
    }

    @Override
    public List<Transaction> loadTransactionsBySeries(UUID seriesId) {
        return orEmpty(guard("loadTransactionsBySeries", () -> delegate.loadTransactionsBySeries(seriesId)));
    }

    @Override
    public List<Budget> loadBudgetsByUser(String userId) {
        return orEmpty(guard("loadBudgetsByUser", () -> delegate.loadBudgetsByUser(userId)));
    }

    @Override
    public List<BudgetPeriod> loadPeriodsByUser(String userId) {
        return orEmpty(guard("loadPeriodsByUser", () -> delegate.loadPeriodsByUser(userId)));
    }

    @Override
    public Transaction createTransaction(NewTransaction payload) {
        return guard("createTransaction", () -> delegate.createTransaction(payload));
    }

    @Override
    public void updateSeries(UUID seriesId, SeriesUpdate update) {
        guard("updateSeries", () -> {
            delegate.updateSeries(seriesId, update);
            return null;
        });
    }

    @Override
    public void updatePeriod(UUID periodId, PeriodUpdate update) {
        guard("updatePeriod", () -> {
            delegate.updatePeriod(periodId, update);
            return null;
        });
    }

    @Override
    public BudgetPeriod createPeriod(BudgetPeriod period) {
        return guard("createPeriod", () -> delegate.createPeriod(period));
    }

    private <T> T guard(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (BudgetEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Data port operation failed: operation={}, error={}", operation, e.getMessage());
            throw new PersistenceException("Data port operation failed: " + operation, e);
        }
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values != null ? values : List.of();
    }
}
