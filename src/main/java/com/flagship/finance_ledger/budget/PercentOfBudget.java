package com.flagship.finance_ledger.budget;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Actual spending as a percentage of the budget.
 *
 * A category budgeted at zero has no meaningful percentage. That case is an explicit
 * {@link #notApplicable()} value, rendered as {@code "N/A"}, and never a number.
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class PercentOfBudget {

    public static final String NOT_APPLICABLE_LABEL = "N/A";

    private static final PercentOfBudget NOT_APPLICABLE = new PercentOfBudget(null);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal value;

    /**
     * @param percent percentage, rounded half-up to two decimals
     */
    public static PercentOfBudget of(BigDecimal percent) {
        if (percent == null) {
            throw new IllegalArgumentException("Percentage is required; use notApplicable() for a zero budget");
        }
        return new PercentOfBudget(percent.setScale(2, RoundingMode.HALF_UP));
    }

    public static PercentOfBudget notApplicable() {
        return NOT_APPLICABLE;
    }

    /**
     * {@code actual / budgeted * 100}, or not applicable when nothing was budgeted.
     */
    public static PercentOfBudget of(BigDecimal actual, BigDecimal budgeted) {
        if (budgeted.signum() == 0) {
            return NOT_APPLICABLE;
        }
        return of(actual.multiply(HUNDRED).divide(budgeted, 2, RoundingMode.HALF_UP));
    }

    public boolean isApplicable() {
        return value != null;
    }

    public Optional<BigDecimal> getValue() {
        return Optional.ofNullable(value);
    }

    @JsonValue
    public Object toJson() {
        return value != null ? value : NOT_APPLICABLE_LABEL;
    }

    @Override
    public String toString() {
        return value != null ? value.toPlainString() : NOT_APPLICABLE_LABEL;
    }
}
