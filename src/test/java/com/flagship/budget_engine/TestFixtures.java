package com.flagship.budget_engine;

import com.flagship.budget_engine.budget.Budget;
import com.flagship.budget_engine.budget.BudgetType;
import com.flagship.budget_engine.config.BudgetEngineProperties;
import com.flagship.budget_engine.period.BudgetPeriod;
import com.flagship.budget_engine.recurring.Frequency;
import com.flagship.budget_engine.recurring.RecurringTransactionSeries;
import com.flagship.budget_engine.transaction.Transaction;
import com.flagship.budget_engine.transaction.TransactionType;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.UUID;

/**
 * Builders for test data. All instants are UTC, matching the default engine zone.
 */
public final class TestFixtures {

    public static final String USER_ID = "user-1";
    public static final String ACCOUNT_ID = "acc-main";

    private TestFixtures() {
    }

    public static BudgetEngineProperties properties() {
        return new BudgetEngineProperties();
    }

    public static Clock clockAt(String isoDateTime) {
        return Clock.fixed(at(isoDateTime), ZoneOffset.UTC);
    }

    public static Instant at(String isoDateTime) {
        return LocalDateTime.parse(isoDateTime).toInstant(ZoneOffset.UTC);
    }

    public static Instant noon(String isoDate) {
        return at(isoDate + "T12:00:00");
    }

    public static Transaction expense(String category, String amount, String isoDate) {
        return transaction(TransactionType.EXPENSE, category, amount, noon(isoDate));
    }

    public static Transaction income(String category, String amount, String isoDate) {
        return transaction(TransactionType.INCOME, category, amount, noon(isoDate));
    }

    public static Transaction transaction(TransactionType type, String category, String amount, Instant date) {
        return Transaction.builder()
            .id(UUID.randomUUID())
            .userId(USER_ID)
            .accountId(ACCOUNT_ID)
            .type(type)
            .amount(new BigDecimal(amount))
            .category(category)
            .date(date)
            .build();
    }

    public static Budget budget(String amount, String... categories) {
        return Budget.builder()
            .id(UUID.randomUUID())
            .userId(USER_ID)
            .description("Budget " + String.join("+", categories))
            .amount(new BigDecimal(amount))
            .type(BudgetType.MONTHLY)
            .categories(Set.of(categories))
            .build();
    }

    public static BudgetPeriod activePeriod(String isoStartDate) {
        return BudgetPeriod.open(USER_ID, LocalDate.parse(isoStartDate), at(isoStartDate + "T00:00:00"));
    }

    public static RecurringTransactionSeries series(String description, Frequency frequency,
                                                    String isoDueDate, String amount) {
        return RecurringTransactionSeries.builder()
            .id(UUID.randomUUID())
            .userId(USER_ID)
            .accountId(ACCOUNT_ID)
            .description(description)
            .amount(new BigDecimal(amount))
            .type(TransactionType.EXPENSE)
            .category("bills")
            .frequency(frequency)
            .dueDate(LocalDate.parse(isoDueDate))
            .active(true)
            .build();
    }
}
