package com.flagship.finance_ledger.budget;

import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Income against expense for one month.
 */
@Value
public class PeriodSummary {
    YearMonth period;
    BigDecimal income;
    BigDecimal expense;

    public BigDecimal getNet() {
        return income.subtract(expense);
    }
}
