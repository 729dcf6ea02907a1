package com.flagship.finance_ledger.common;

import lombok.Value;

/**
 * Failure of a single item in a batch operation, referencing its source row (1-based).
 */
@Value
public class ItemError {
    int row;
    ErrorKind kind;
    String message;

    public static ItemError of(int row, ErrorKind kind, String message) {
        return new ItemError(row, kind, message);
    }
}
