package com.flagship.budget_engine.transaction;

/**
 * Direction of a transaction.
 *
 * Only EXPENSE and INCOME take part in budget aggregation; TRANSFER moves money between
 * the user's own accounts.
 */
public enum TransactionType {
    INCOME,
    EXPENSE,
    TRANSFER
}
