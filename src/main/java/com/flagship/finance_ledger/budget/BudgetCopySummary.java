package com.flagship.finance_ledger.budget;

import lombok.Value;

/**
 * Outcome of copying a month's budgets forward: rows copied, and rows left alone
 * because the target month already had a budget for that category.
 */
@Value
public class BudgetCopySummary {
    int copied;
    int skipped;
}
