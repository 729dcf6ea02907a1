package com.flagship.finance_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Search criteria for posted transactions. Every criterion is optional.
 *
 * {@code text} matches notes and the debit or credit account name, ignoring case.
 * {@code accountId} matches either side; {@code debitAccountId} and
 * {@code creditAccountId} match one side only.
 */
@Value
@Builder(toBuilder = true)
public class TransactionQuery {
    String text;
    LocalDate dateFrom;
    LocalDate dateTo;
    UUID accountId;
    UUID debitAccountId;
    UUID creditAccountId;
    Integer limit;
    Integer offset;

    public static TransactionQuery all() {
        return TransactionQuery.builder().build();
    }

    public static TransactionQuery text(String text) {
        return TransactionQuery.builder().text(text).build();
    }
}
