package com.flagship.finance_ledger.account;

import com.flagship.finance_ledger.common.ItemError;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a chart import.
 *
 * {@code skipped} counts both invalid rows and rows that already existed;
 * {@code errors} lists only the invalid rows.
 */
@Value
public class ImportSummary {
    int added;
    int skipped;
    List<ItemError> errors;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
