package com.flagship.finance_ledger.budget;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of the budget-vs-actual report. {@code variance} is budgeted minus actual,
 * so overspending is negative.
 */
@Value
public class BudgetVarianceRow {
    String category;
    BigDecimal budgeted;
    BigDecimal actual;
    BigDecimal variance;
    PercentOfBudget pctOfBudget;

    public boolean isOverBudget() {
        return variance.signum() < 0;
    }
}
