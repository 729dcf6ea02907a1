package com.flagship.finance_ledger.validation;

import com.flagship.finance_ledger.account.AccountCategory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Pure checks over primitive ledger inputs.
 *
 * Every check reports failure as a {@link ValidationResult}; none of them throws for
 * malformed input, including {@code null}.
 */
public final class Validation {

    /**
     * Amounts are stored as DECIMAL(19,4).
     */
    public static final int MAX_SCALE = 4;

    public static final int MAX_INTEGER_DIGITS = 15;

    public static final int MAX_ACCOUNT_NAME_LENGTH = 100;

    public static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    public static final DateTimeFormatter PERIOD_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM").withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern DATE_SHAPE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern PERIOD_SHAPE = Pattern.compile("^\\d{4}-\\d{2}$");
    private static final Pattern UUID_SHAPE =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private Validation() {
    }

    /**
     * Checks a calendar date written as {@code yyyy-MM-dd}.
     * "2025-02-30" has the right shape but is rejected.
     */
    public static ValidationResult date(String text) {
        if (text == null || !DATE_SHAPE.matcher(text).matches()) {
            return ValidationResult.invalid("Date must use the format YYYY-MM-DD: " + text);
        }
        try {
            LocalDate.parse(text, DATE_FORMAT);
            return ValidationResult.valid();
        } catch (DateTimeParseException e) {
            return ValidationResult.invalid("Not a calendar date: " + text);
        }
    }

    /**
     * Checks a year-month period written as {@code yyyy-MM}.
     */
    public static ValidationResult period(String text) {
        if (text == null || !PERIOD_SHAPE.matcher(text).matches()) {
            return ValidationResult.invalid("Period must use the format YYYY-MM: " + text);
        }
        try {
            YearMonth.parse(text, PERIOD_FORMAT);
            return ValidationResult.valid();
        } catch (DateTimeParseException e) {
            return ValidationResult.invalid("Not a valid month: " + text);
        }
    }

    /**
     * Checks a transaction amount given as text: parseable, finite and strictly positive.
     */
    public static ValidationResult amount(String text) {
        if (text == null || text.isBlank()) {
            return ValidationResult.invalid("Amount is required");
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return ValidationResult.invalid("Amount is not a number: " + text);
        }
        return positiveAmount(parsed);
    }

    public static ValidationResult positiveAmount(BigDecimal amount) {
        if (amount == null) {
            return ValidationResult.invalid("Amount is required");
        }
        if (amount.signum() <= 0) {
            return ValidationResult.invalid("Amount must be greater than zero: " + amount.toPlainString());
        }
        return scale(amount);
    }

    /**
     * Opening balances may be negative or zero; only presence and precision are checked.
     */
    public static ValidationResult openingAmount(BigDecimal amount) {
        if (amount == null) {
            return ValidationResult.invalid("Opening balance is required");
        }
        return scale(amount);
    }

    public static ValidationResult budgetAmount(BigDecimal amount) {
        if (amount == null) {
            return ValidationResult.invalid("Budget amount is required");
        }
        if (amount.signum() < 0) {
            return ValidationResult.invalid("Budget amount must not be negative: " + amount.toPlainString());
        }
        return scale(amount);
    }

    /**
     * Checks an account category name. Matching ignores case and surrounding blanks.
     */
    public static ValidationResult category(String text) {
        if (text == null || text.isBlank()) {
            return ValidationResult.invalid("Account type is required");
        }
        if (AccountCategory.fromText(text).isEmpty()) {
            return ValidationResult.invalid(
                    "Account type must be one of asset, liability, equity, income, expense: " + text);
        }
        return ValidationResult.valid();
    }

    public static ValidationResult identifier(String text) {
        if (text == null || !UUID_SHAPE.matcher(text.trim()).matches()) {
            return ValidationResult.invalid("Malformed identifier: " + text);
        }
        return ValidationResult.valid();
    }

    public static ValidationResult accountName(String name) {
        if (name == null || name.isBlank()) {
            return ValidationResult.invalid("Account name is required");
        }
        if (name.trim().length() > MAX_ACCOUNT_NAME_LENGTH) {
            return ValidationResult.invalid("Account name is longer than " + MAX_ACCOUNT_NAME_LENGTH + " characters");
        }
        return ValidationResult.valid();
    }

    /**
     * Parses a date that already passed {@link #date(String)}.
     */
    public static LocalDate parseDate(String text) {
        return LocalDate.parse(text, DATE_FORMAT);
    }

    /**
     * Parses a period that already passed {@link #period(String)}.
     */
    public static YearMonth parsePeriod(String text) {
        return YearMonth.parse(text, PERIOD_FORMAT);
    }

    public static UUID parseIdentifier(String text) {
        return UUID.fromString(text.trim());
    }

    private static ValidationResult scale(BigDecimal amount) {
        if (amount.stripTrailingZeros().scale() > MAX_SCALE) {
            return ValidationResult.invalid("Amount has more than " + MAX_SCALE + " decimal places: "
                    + amount.toPlainString());
        }
        if (amount.precision() - amount.scale() > MAX_INTEGER_DIGITS) {
            return ValidationResult.invalid("Amount has more than " + MAX_INTEGER_DIGITS + " integer digits: "
                    + amount.toPlainString());
        }
        return ValidationResult.valid();
    }
}
