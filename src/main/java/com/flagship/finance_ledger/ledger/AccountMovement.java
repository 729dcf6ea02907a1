package com.flagship.finance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Sum of debits and sum of credits posted to one account over a date range.
 */
@Value
public class AccountMovement {
    public static final AccountMovement NONE = new AccountMovement(BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal debits;
    BigDecimal credits;
}
