package com.flagship.finance_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An account of the chart of accounts.
 * The (name, category) pair is unique.
 */
@Value
public class Account {
    UUID id;
    String name;
    AccountCategory category;
    BigDecimal openingBalance;
    Instant createdAt;

    public static Account create(String name, AccountCategory category) {
        return new Account(UUID.randomUUID(), name.trim(), category, BigDecimal.ZERO, Instant.now());
    }
}
