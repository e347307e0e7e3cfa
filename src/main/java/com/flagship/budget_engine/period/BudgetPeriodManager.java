package com.flagship.budget_engine.period;

import com.flagship.budget_engine.budget.Budget;
import com.flagship.budget_engine.common.DateRange;
import com.flagship.budget_engine.common.Money;
import com.flagship.budget_engine.config.BudgetEngineProperties;
import com.flagship.budget_engine.exception.ConflictException;
import com.flagship.budget_engine.exception.InvalidRangeException;
import com.flagship.budget_engine.transaction.AggregationResult;
import com.flagship.budget_engine.transaction.Transaction;
import com.flagship.budget_engine.transaction.TransactionAggregator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Budget period state machine over in-memory snapshots.
 *
 * This class enforces the period rules:
 * - At most one ACTIVE period per user
 * - A new period never starts before the previous one ended
 * - Closing computes spend and savings over [start day 00:00, end day 23:59:59.999]
 * - Closing an already closed period on the same date is a no-op
 *
 * It performs no I/O; {@link BudgetPeriodService} loads snapshots and persists results.
 */
@Component
public class BudgetPeriodManager {

    private final TransactionAggregator aggregator;
    private final ZoneId zone;

    public BudgetPeriodManager(TransactionAggregator aggregator, BudgetEngineProperties properties) {
        this.aggregator = aggregator;
        this.zone = properties.zoneId();
    }

    /**
     * Opens a new period for {@code userId}.
     *
     * @param existing all periods of the user
     * @throws ConflictException if the user already has an active period
     * @throws InvalidRangeException if {@code startDate} precedes the latest end date
     */
    public BudgetPeriod startPeriod(String userId, LocalDate startDate,
                                    Collection<BudgetPeriod> existing, Instant now) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
        if (startDate == null) {
            throw new IllegalArgumentException("Start date is required");
        }

        Optional<BudgetPeriod> active = findActive(existing);
        if (active.isPresent()) {
            throw new ConflictException(
                String.format("User %s already has an active budget period %s started on %s",
                    userId, active.get().getId(), active.get().getStartDate()));
        }

        Optional<LocalDate> latestEnd = latestEndDate(existing);
        if (latestEnd.isPresent() && startDate.isBefore(latestEnd.get())) {
            throw new InvalidRangeException(
                String.format("Start date %s precedes the end date %s of the previous period",
                    startDate, latestEnd.get()));
        }

        return BudgetPeriod.open(userId, startDate, now);
    }

    /**
     * Closes {@code period} on {@code endDate}.
     *
     * Total spent is the sum over the user's budgets of the net spend in each budget's
     * categories. Savings are the budgeted amount minus spend, floored at zero.
     *
     * @return the closed period; {@code period} itself when it was already closed on {@code endDate}
     * @throws ConflictException if the period was already closed on a different date
     * @throws InvalidRangeException if {@code endDate} is before the period start
     */
    public BudgetPeriod closePeriod(BudgetPeriod period, LocalDate endDate,
                                    Collection<Transaction> transactions,
                                    Collection<Budget> budgets, Instant now) {
        Objects.requireNonNull(period, "period");
        if (endDate == null) {
            throw new IllegalArgumentException("End date is required");
        }

        if (!period.isOpen()) {
            if (endDate.equals(period.getEndDate())) {
                return period;
            }
            throw new ConflictException(
                String.format("Budget period %s is already closed on %s", period.getId(), period.getEndDate()));
        }

        DateRange window = closingWindow(period, endDate);

        BigDecimal spent = BigDecimal.ZERO;
        BigDecimal budgeted = BigDecimal.ZERO;
        Map<String, BigDecimal> spending = new TreeMap<>();

        for (Budget budget : budgets) {
            if (!budget.belongsTo(period.getUserId())) {
                continue;
            }
            budgeted = budgeted.add(Money.orZero(budget.getAmount()));

            AggregationResult result = aggregator.aggregate(transactions, budget.getCategories(), window);
            spent = spent.add(result.getTotalSpent());
            result.getPerCategory().forEach((category, net) -> spending.merge(category, net, BigDecimal::add));
        }

        BigDecimal totalSpent = Money.round(spent);
        BigDecimal totalSaved = Money.round(Money.floorAtZero(Money.round(budgeted.subtract(totalSpent))));

        return period.close(endDate, totalSpent, totalSaved, spending, now);
    }

    /**
     * Window aggregated when closing {@code period} on {@code endDate}.
     */
    public DateRange closingWindow(BudgetPeriod period, LocalDate endDate) {
        return DateRange.ofDays(period.getStartDate(), endDate, zone);
    }

    /**
     * Window covered by {@code period}: open-ended while active.
     */
    public DateRange window(BudgetPeriod period) {
        return DateRange.ofDays(period.getStartDate(), period.getEndDate(), zone);
    }

    public Optional<BudgetPeriod> findActive(Collection<BudgetPeriod> periods) {
        return periods.stream()
            .filter(BudgetPeriod::isOpen)
            .findFirst();
    }

    public Optional<BudgetPeriod> findClosedOn(Collection<BudgetPeriod> periods, LocalDate endDate) {
        return periods.stream()
            .filter(period -> !period.isOpen())
            .filter(period -> endDate.equals(period.getEndDate()))
            .findFirst();
    }

    private Optional<LocalDate> latestEndDate(Collection<BudgetPeriod> periods) {
        return periods.stream()
            .map(BudgetPeriod::getEndDate)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder());
    }
}
