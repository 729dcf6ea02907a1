package com.flagship.finance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Ledger-wide totals. In a sound ledger total debits equal total credits.
 */
@Value
public class LedgerTotals {
    BigDecimal totalDebits;
    BigDecimal totalCredits;
    long transactionCount;

    public boolean isBalanced() {
        return totalDebits.compareTo(totalCredits) == 0;
    }
}
