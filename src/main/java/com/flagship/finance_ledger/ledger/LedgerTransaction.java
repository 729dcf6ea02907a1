package com.flagship.finance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * A posted double-entry transaction: one debit account, one credit account, one amount.
 *
 * Account names are resolved at read time so results can be rendered and exported
 * without further lookups.
 */
@Value
public class LedgerTransaction {
    UUID id;
    long sequenceNumber;
    LocalDate date;
    BigDecimal amount;
    UUID debitAccountId;
    String debitAccountName;
    UUID creditAccountId;
    String creditAccountName;
    String notes;
    Instant createdAt;
    Instant updatedAt;

    public YearMonth getPeriod() {
        return YearMonth.from(date);
    }

    public boolean touches(UUID accountId) {
        return debitAccountId.equals(accountId) || creditAccountId.equals(accountId);
    }
}
