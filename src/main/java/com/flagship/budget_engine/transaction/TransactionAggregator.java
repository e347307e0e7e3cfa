package com.flagship.budget_engine.transaction;

import com.flagship.budget_engine.common.DateRange;
import com.flagship.budget_engine.common.Money;
import com.flagship.budget_engine.config.BudgetEngineProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Computes net spend for a set of transactions over a set of budget categories.
 *
 * Rules:
 * - Only EXPENSE and INCOME rows dated inside the window (both bounds inclusive) count
 * - Uncategorized rows never match a budget
 * - Transfer-like rows never count: type TRANSFER, the reserved transfer category, or a
 *   populated counterpart account
 * - Per category, net = sum(expense) - sum(income), so refunds tagged with a budget
 *   category offset spend
 * - The total is rounded once, on the aggregate
 *
 * Stateless and side-effect free.
 */
@Component
public class TransactionAggregator {

    private final String transferCategory;

    public TransactionAggregator(BudgetEngineProperties properties) {
        this.transferCategory = properties.getTransferCategory();
    }

    public AggregationResult aggregate(Collection<Transaction> transactions,
                                       Collection<String> categories,
                                       Instant start, Instant end) {
        return aggregate(transactions, categories, DateRange.of(start, end));
    }

    /**
     * Aggregates {@code transactions} restricted to {@code categories} inside {@code window}.
     *
     * @return total net spend and per-category nets; an empty result for empty inputs
     */
    public AggregationResult aggregate(Collection<Transaction> transactions,
                                       Collection<String> categories,
                                       DateRange window) {
        if (window == null) {
            throw new IllegalArgumentException("Aggregation window is required");
        }
        if (transactions == null || transactions.isEmpty() || categories == null || categories.isEmpty()) {
            return AggregationResult.empty();
        }

        Set<String> categorySet = new HashSet<>(categories);
        Map<String, BigDecimal> nets = new TreeMap<>();
        int counted = 0;

        for (Transaction transaction : transactions) {
            if (!window.contains(transaction.getDate())) {
                continue;
            }
            if (transaction.getCategory() == null || !isBudgetRelevant(transaction)
                    || !categorySet.contains(transaction.getCategory())) {
                continue;
            }
            nets.merge(transaction.getCategory(), signedAmount(transaction), BigDecimal::add);
            counted++;
        }

        if (nets.isEmpty()) {
            return AggregationResult.empty();
        }

        BigDecimal total = Money.round(Money.sum(nets.values()));
        Map<String, BigDecimal> perCategory = nets.entrySet().stream()
            .collect(Collectors.toMap(
                Map.Entry::getKey,
                entry -> Money.round(entry.getValue()),
                (left, right) -> left,
                TreeMap::new));

        return new AggregationResult(total, Collections.unmodifiableMap(perCategory), counted);
    }

    /**
     * True for transfers between the user's own accounts, which are excluded from budgets.
     */
    public boolean isTransferLike(Transaction transaction) {
        return transaction.getType() == TransactionType.TRANSFER
            || transferCategory.equals(transaction.getCategory())
            || transaction.hasCounterpartAccount();
    }

    private boolean isBudgetRelevant(Transaction transaction) {
        TransactionType type = transaction.getType();
        if (type != TransactionType.EXPENSE && type != TransactionType.INCOME) {
            return false;
        }
        return !isTransferLike(transaction);
    }

    private BigDecimal signedAmount(Transaction transaction) {
        BigDecimal amount = Money.orZero(transaction.getAmount());
        return transaction.getType() == TransactionType.INCOME ? amount.negate() : amount;
    }
}
