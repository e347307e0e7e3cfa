package com.flagship.budget_engine.budget;

import com.flagship.budget_engine.common.DateRange;
import com.flagship.budget_engine.common.Money;
import com.flagship.budget_engine.transaction.AggregationResult;
import com.flagship.budget_engine.transaction.Transaction;
import com.flagship.budget_engine.transaction.TransactionAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Computes per-budget progress for a period window.
 *
 * Unlike period closing, per-budget spend is floored at zero here: a budget refilled by
 * refunds shows as untouched, never as negative spend.
 */
@Component
@RequiredArgsConstructor
public class BudgetProgressCalculator {

    private final TransactionAggregator aggregator;

    /**
     * Progress of one budget.
     *
     * @param window period window, or null when the user has no active period (zero spend)
     */
    public BudgetProgress progress(Budget budget, Collection<Transaction> transactions, DateRange window) {
        BigDecimal amount = Money.round(budget.getAmount());
        AggregationResult aggregation = window != null
            ? aggregator.aggregate(transactions, budget.getCategories(), window)
            : AggregationResult.empty();

        BigDecimal spent = Money.round(Money.floorAtZero(aggregation.getTotalSpent()));
        return new BudgetProgress(
            budget.getId(),
            budget.getDescription(),
            amount,
            spent,
            amount.subtract(spent),
            Money.percentage(spent, amount),
            Set.copyOf(budget.getCategories()),
            aggregation.getTransactionCount()
        );
    }

    /**
     * Progress of every budget of {@code userId} with a positive amount, plus totals.
     */
    public BudgetSummary summarize(String userId, Collection<Budget> budgets,
                                   Collection<Transaction> transactions, DateRange window) {
        List<BudgetProgress> progress = budgets.stream()
            .filter(budget -> budget.belongsTo(userId))
            .filter(Budget::hasPositiveAmount)
            .map(budget -> progress(budget, transactions, window))
            .toList();

        BigDecimal totalBudget = Money.round(Money.sum(progress.stream().map(BudgetProgress::getAmount).toList()));
        BigDecimal totalSpent = Money.round(Money.sum(progress.stream().map(BudgetProgress::getSpent).toList()));

        return new BudgetSummary(
            userId,
            window,
            progress,
            totalBudget,
            totalSpent,
            totalBudget.subtract(totalSpent),
            Money.percentage(totalSpent, totalBudget)
        );
    }
}
