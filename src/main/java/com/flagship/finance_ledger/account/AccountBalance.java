package com.flagship.finance_ledger.account;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class AccountBalance {
    Account account;
    BigDecimal balance;
}
