package com.flagship.budget_engine.transaction;

import com.flagship.budget_engine.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;

/**
 * Net spend for a window: the rounded total and the per-category nets.
 */
@Value
public class AggregationResult {
    BigDecimal totalSpent;
    Map<String, BigDecimal> perCategory;
    int transactionCount;

    public static AggregationResult empty() {
        return new AggregationResult(Money.ZERO, Collections.emptyMap(), 0);
    }
}
