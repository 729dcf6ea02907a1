package com.flagship.finance_ledger.validation;

import lombok.Value;

/**
 * Verdict of a single {@link Validation} check.
 */
@Value
public class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(true, null);

    boolean valid;
    String reason;

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, reason);
    }

    public boolean isInvalid() {
        return !valid;
    }
}
