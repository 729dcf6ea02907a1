package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.common.ErrorKind;
import com.flagship.finance_ledger.common.OperationResult;
import com.flagship.finance_ledger.validation.Validation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Changes to apply to a posted transaction. Every slot is optional; {@code null}
 * leaves the field unchanged.
 *
 * The set of modifiable fields is closed: amount, date, debitId, creditId and notes.
 * Loose key/value input goes through {@link #fromFields(Map)}, which rejects any
 * other key.
 */
@Value
@Builder
public class TransactionUpdate {

    public static final String AMOUNT = "amount";
    public static final String DATE = "date";
    public static final String DEBIT_ID = "debitId";
    public static final String CREDIT_ID = "creditId";
    public static final String NOTES = "notes";

    public static final Set<String> FIELDS = Set.of(AMOUNT, DATE, DEBIT_ID, CREDIT_ID, NOTES);

    BigDecimal amount;

    /**
     * New date as yyyy-MM-dd text; validated when the update is applied.
     */
    String date;

    UUID debitId;
    UUID creditId;
    String notes;

    public boolean isEmpty() {
        return amount == null && date == null && debitId == null && creditId == null && notes == null;
    }

    /**
     * Builds an update from field names and values.
     *
     * Amounts may be given as {@link BigDecimal}, any {@link Number} or text; account ids
     * as {@link UUID} or canonical text; date and notes as text. {@code null} values are
     * ignored.
     */
    public static OperationResult<TransactionUpdate> fromFields(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return OperationResult.ok(TransactionUpdate.builder().build());
        }
        for (String key : fields.keySet()) {
            if (!FIELDS.contains(key)) {
                return OperationResult.failure(ErrorKind.INVALID_FIELD,
                    "Field cannot be modified: " + key + " (allowed: amount, date, debitId, creditId, notes)");
            }
        }

        TransactionUpdateBuilder builder = TransactionUpdate.builder();

        Object amount = fields.get(AMOUNT);
        if (amount != null) {
            OperationResult<BigDecimal> parsed = toAmount(amount);
            if (parsed.isFailure()) {
                return parsed.propagate();
            }
            builder.amount(parsed.getValue());
        }

        Object date = fields.get(DATE);
        if (date != null) {
            builder.date(date.toString());
        }

        Object debitId = fields.get(DEBIT_ID);
        if (debitId != null) {
            OperationResult<UUID> parsed = toIdentifier(DEBIT_ID, debitId);
            if (parsed.isFailure()) {
                return parsed.propagate();
            }
            builder.debitId(parsed.getValue());
        }

        Object creditId = fields.get(CREDIT_ID);
        if (creditId != null) {
            OperationResult<UUID> parsed = toIdentifier(CREDIT_ID, creditId);
            if (parsed.isFailure()) {
                return parsed.propagate();
            }
            builder.creditId(parsed.getValue());
        }

        Object notes = fields.get(NOTES);
        if (notes != null) {
            builder.notes(notes.toString());
        }

        return OperationResult.ok(builder.build());
    }

    private static OperationResult<BigDecimal> toAmount(Object value) {
        if (value instanceof BigDecimal) {
            return OperationResult.ok((BigDecimal) value);
        }
        String text = value.toString();
        if ((value instanceof Double || value instanceof Float) && !Double.isFinite(((Number) value).doubleValue())) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "Amount is not finite: " + text);
        }
        try {
            return OperationResult.ok(new BigDecimal(text.trim()));
        } catch (NumberFormatException e) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "Amount is not a number: " + text);
        }
    }

    private static OperationResult<UUID> toIdentifier(String field, Object value) {
        if (value instanceof UUID) {
            return OperationResult.ok((UUID) value);
        }
        String text = value.toString();
        if (Validation.identifier(text).isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "Malformed " + field + ": " + text);
        }
        return OperationResult.ok(Validation.parseIdentifier(text));
    }
}
