package com.flagship.finance_ledger.account;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * The five account categories of the chart of accounts.
 *
 * Asset and expense accounts are debit-normal: debits increase them.
 * Liability, equity and income accounts are credit-normal.
 */
public enum AccountCategory {
    ASSET(true),
    LIABILITY(false),
    EQUITY(false),
    INCOME(false),
    EXPENSE(true);

    private final boolean debitNormal;

    AccountCategory(boolean debitNormal) {
        this.debitNormal = debitNormal;
    }

    /**
     * Net effect of debits and credits in this category's natural sign.
     */
    public BigDecimal movement(BigDecimal debits, BigDecimal credits) {
        return debitNormal ? debits.subtract(credits) : credits.subtract(debits);
    }

    /**
     * Balance from an opening amount plus the period's debits and credits.
     */
    public BigDecimal balance(BigDecimal opening, BigDecimal debits, BigDecimal credits) {
        return opening.add(movement(debits, credits));
    }

    /**
     * Lower-case name as used in import files ("asset", "expense", ...).
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a category from text, ignoring case and surrounding blanks.
     */
    public static Optional<AccountCategory> fromText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (AccountCategory category : values()) {
            if (category.name().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
