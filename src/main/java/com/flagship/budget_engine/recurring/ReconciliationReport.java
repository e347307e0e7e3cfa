package com.flagship.budget_engine.recurring;

import com.flagship.budget_engine.transaction.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Expected versus persisted executions of one series.
 *
 * Expectations come from the series counter, actuals from the transaction log. A positive
 * {@code missedPayments} means the counter advanced without a persisted transaction.
 */
@Value
public class ReconciliationReport {
    RecurringTransactionSeries series;
    List<Transaction> transactions;
    int expectedExecutions;
    int actualExecutions;
    int missedPayments;
    BigDecimal expectedTotal;
    BigDecimal actualTotal;
    BigDecimal difference;
    BigDecimal successRate;

    public boolean isConsistent() {
        return missedPayments == 0 && difference.signum() == 0;
    }
}
