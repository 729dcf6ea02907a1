package com.flagship.finance_ledger.budget;

import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Budgeted amount for one category in one month.
 *
 * The category names an expense (or income) account of the chart; a budget for a
 * name with no matching account simply has no actuals.
 */
@Value
public class Budget {
    UUID id;
    String category;
    YearMonth period;
    BigDecimal amount;

    public static Budget create(String category, YearMonth period, BigDecimal amount) {
        return new Budget(UUID.randomUUID(), category.trim(), period, amount);
    }
}
