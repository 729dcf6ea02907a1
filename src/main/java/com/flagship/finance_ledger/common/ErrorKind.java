package com.flagship.finance_ledger.common;

/**
 * Machine-checkable failure kinds carried by {@link OperationResult}.
 */
public enum ErrorKind {
    /**
     * Malformed date, period, amount, category or identifier.
     */
    INVALID_INPUT,

    /**
     * Amount rejected for an opening balance or budget.
     */
    INVALID_AMOUNT,

    /**
     * Same-account posting or a disallowed category combination.
     */
    INVALID_POSTING,

    /**
     * Unknown account or transaction id.
     */
    NOT_FOUND,

    /**
     * Mutation attempted on a locked period.
     */
    PERIOD_LOCKED,

    /**
     * Account already exists. Only reported as a skip count in batch import.
     */
    DUPLICATE_ACCOUNT,

    /**
     * Unknown field name in a modify request.
     */
    INVALID_FIELD,

    /**
     * Chart import where not a single row was valid.
     */
    NO_VALID_ACCOUNTS
}
