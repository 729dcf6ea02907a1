package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.account.AccountCategory;
import com.flagship.finance_ledger.account.AccountEntity;
import com.flagship.finance_ledger.account.AccountRepository;
import com.flagship.finance_ledger.common.ErrorKind;
import com.flagship.finance_ledger.common.OperationResult;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.validation.Validation;
import com.flagship.finance_ledger.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Posts, corrects and removes double-entry transactions.
 *
 * Every transaction moves one amount from a credited account to a debited account,
 * so the ledger is balanced by construction. Rules enforced on each posting:
 * 1. Debit and credit accounts differ and both exist
 * 2. The date is a calendar date and the amount is positive
 * 3. An expense account is never credited and an income account is never debited,
 *    except by a reversal (the swap of an existing posting of the same amount)
 * 4. Transactions dated in a locked month are frozen
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    public static final int MAX_NOTES_LENGTH = 500;

    private final TransactionStore transactionStore;
    private final AccountRepository accountRepository;
    private final PeriodLockService periodLockService;
    private final LedgerMetrics ledgerMetrics;

    @Value("${ledger.search.default-limit:200}")
    private int defaultLimit;

    @Value("${ledger.search.max-limit:1000}")
    private int maxLimit;

    /**
     * Posts a new transaction.
     *
     * @param date yyyy-MM-dd
     * @return id of the new transaction
     */
    @Transactional
    public OperationResult<UUID> addTransaction(String date, BigDecimal amount, UUID debitId, UUID creditId,
                                                String notes) {
        return record("add", post("add", date, amount, debitId, creditId, notes));
    }

    /**
     * Posts the mirror image of an existing transaction: same amount, accounts swapped.
     *
     * The original may sit in a locked month; the reversal itself must be dated in an
     * open one. When {@code notes} is null the reversal is annotated after the original.
     */
    @Transactional
    public OperationResult<UUID> reverseTransaction(UUID transactionId, String date, String notes) {
        if (transactionId == null) {
            return record("reverse", OperationResult.failure(ErrorKind.INVALID_INPUT, "Transaction id is required"));
        }
        Optional<LedgerTransaction> original = transactionStore.findById(transactionId);
        if (original.isEmpty()) {
            log.warn("Reversal rejected: transaction {} not found", transactionId);
            return record("reverse", OperationResult.failure(ErrorKind.NOT_FOUND,
                "Transaction not found: " + transactionId));
        }

        LedgerTransaction source = original.get();
        String reversalNotes = notes != null ? notes : reversalNote(source);
        OperationResult<UUID> result = post("reverse", date, source.getAmount(),
            source.getCreditAccountId(), source.getDebitAccountId(), reversalNotes);
        if (result.isSuccess()) {
            log.info("Transaction {} reversed by {}", transactionId, result.getValue());
        }
        return record("reverse", result);
    }

    /**
     * Applies loosely typed field changes; keys outside {@link TransactionUpdate#FIELDS}
     * fail with {@link ErrorKind#INVALID_FIELD} before anything is read.
     */
    @Transactional
    public OperationResult<LedgerTransaction> modifyTransaction(UUID transactionId, Map<String, ?> fields) {
        OperationResult<TransactionUpdate> update = TransactionUpdate.fromFields(fields);
        if (update.isFailure()) {
            log.warn("Modify rejected: {}", update.getMessage());
            return record("modify", update.propagate());
        }
        return modifyTransaction(transactionId, update.getValue());
    }

    /**
     * Applies a partial update. The merged transaction must satisfy every posting rule,
     * and neither its current nor its new month may be locked.
     */
    @Transactional
    public OperationResult<LedgerTransaction> modifyTransaction(UUID transactionId, TransactionUpdate update) {
        if (transactionId == null) {
            return record("modify", OperationResult.failure(ErrorKind.INVALID_INPUT, "Transaction id is required"));
        }
        MDC.put("transactionId", transactionId.toString());
        try {
            Optional<LedgerTransaction> found = transactionStore.findById(transactionId);
            if (found.isEmpty()) {
                log.warn("Modify rejected: transaction not found");
                return record("modify", OperationResult.failure(ErrorKind.NOT_FOUND,
                    "Transaction not found: " + transactionId));
            }
            LedgerTransaction current = found.get();

            if (periodLockService.isLocked(current.getDate())) {
                log.warn("Modify rejected: period {} is locked", current.getPeriod());
                return record("modify", OperationResult.failure(ErrorKind.PERIOD_LOCKED,
                    "Period " + current.getPeriod() + " is locked"));
            }

            if (update == null || update.isEmpty()) {
                log.debug("Empty update, nothing to change");
                return record("modify", OperationResult.ok(current));
            }

            String date = update.getDate() != null ? update.getDate() : current.getDate().toString();
            BigDecimal amount = update.getAmount() != null ? update.getAmount() : current.getAmount();
            UUID debitId = update.getDebitId() != null ? update.getDebitId() : current.getDebitAccountId();
            UUID creditId = update.getCreditId() != null ? update.getCreditId() : current.getCreditAccountId();
            String notes = update.getNotes() != null ? update.getNotes() : current.getNotes();

            OperationResult<LocalDate> posting = checkPosting(transactionId, date, amount, debitId, creditId, notes);
            if (posting.isFailure()) {
                log.warn("Modify rejected: {} - {}", posting.getErrorKind(), posting.getMessage());
                return record("modify", posting.propagate());
            }
            LocalDate newDate = posting.getValue();

            if (periodLockService.isLocked(newDate)) {
                log.warn("Modify rejected: target period {} is locked", Validation.PERIOD_FORMAT.format(newDate));
                return record("modify", OperationResult.failure(ErrorKind.PERIOD_LOCKED,
                    "Period " + Validation.PERIOD_FORMAT.format(newDate) + " is locked"));
            }

            transactionStore.update(transactionId, newDate, amount, debitId, creditId, notes);
            log.info("Transaction modified: date={}, amount={}", newDate, amount.toPlainString());

            return record("modify", OperationResult.ok(transactionStore.findById(transactionId).orElseThrow()));
        } finally {
            MDC.remove("transactionId");
        }
    }

    @Transactional
    public OperationResult<UUID> deleteTransaction(UUID transactionId) {
        if (transactionId == null) {
            return record("delete", OperationResult.failure(ErrorKind.INVALID_INPUT, "Transaction id is required"));
        }
        MDC.put("transactionId", transactionId.toString());
        try {
            Optional<LedgerTransaction> found = transactionStore.findById(transactionId);
            if (found.isEmpty()) {
                log.warn("Delete rejected: transaction not found");
                return record("delete", OperationResult.failure(ErrorKind.NOT_FOUND,
                    "Transaction not found: " + transactionId));
            }
            if (periodLockService.isLocked(found.get().getDate())) {
                log.warn("Delete rejected: period {} is locked", found.get().getPeriod());
                return record("delete", OperationResult.failure(ErrorKind.PERIOD_LOCKED,
                    "Period " + found.get().getPeriod() + " is locked"));
            }

            transactionStore.delete(transactionId);
            log.info("Transaction deleted");
            return record("delete", OperationResult.ok(transactionId));
        } finally {
            MDC.remove("transactionId");
        }
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findTransaction(UUID transactionId) {
        if (transactionId == null) {
            return Optional.empty();
        }
        return transactionStore.findById(transactionId);
    }

    /**
     * Searches posted transactions, ordered by date and then by insertion order.
     * A missing limit means the configured default; larger limits are capped.
     */
    @Transactional(readOnly = true)
    public OperationResult<List<LedgerTransaction>> searchTransactions(TransactionQuery query) {
        TransactionQuery criteria = query != null ? query : TransactionQuery.all();

        if (criteria.getDateFrom() != null && criteria.getDateTo() != null
                && criteria.getDateFrom().isAfter(criteria.getDateTo())) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT,
                "Date range is inverted: " + criteria.getDateFrom() + " > " + criteria.getDateTo());
        }
        if (criteria.getLimit() != null && criteria.getLimit() < 0) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "Limit must not be negative");
        }
        if (criteria.getOffset() != null && criteria.getOffset() < 0) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "Offset must not be negative");
        }

        int limit = criteria.getLimit() != null ? Math.min(criteria.getLimit(), maxLimit) : defaultLimit;
        int offset = criteria.getOffset() != null ? criteria.getOffset() : 0;

        List<LedgerTransaction> rows = transactionStore.search(criteria, limit, offset);
        log.debug("Search returned {} transactions (limit={}, offset={})", rows.size(), limit, offset);
        return OperationResult.ok(rows);
    }

    /**
     * Every transaction matching the criteria, read page by page. Limit and offset of
     * the query are ignored.
     */
    @Transactional(readOnly = true)
    public OperationResult<List<LedgerTransaction>> searchAllTransactions(TransactionQuery query) {
        TransactionQuery criteria = query != null ? query : TransactionQuery.all();
        List<LedgerTransaction> all = new ArrayList<>();
        int pageSize = Math.max(maxLimit, 1);
        int offset = 0;
        while (true) {
            OperationResult<List<LedgerTransaction>> page = searchTransactions(
                criteria.toBuilder().limit(pageSize).offset(offset).build());
            if (page.isFailure()) {
                return page;
            }
            all.addAll(page.getValue());
            if (page.getValue().size() < pageSize) {
                return OperationResult.ok(List.copyOf(all));
            }
            offset += pageSize;
        }
    }

    /**
     * Sum of all debits and sum of all credits. Equal on a healthy ledger.
     */
    @Transactional(readOnly = true)
    public LedgerTotals ledgerTotals() {
        return transactionStore.totals();
    }

    private OperationResult<UUID> post(String operation, String date, BigDecimal amount, UUID debitId,
                                       UUID creditId, String notes) {
        UUID transactionId = UUID.randomUUID();
        MDC.put("transactionId", transactionId.toString());
        try {
            OperationResult<LocalDate> posting = checkPosting(null, date, amount, debitId, creditId, notes);
            if (posting.isFailure()) {
                log.warn("Posting rejected ({}): {} - {}", operation, posting.getErrorKind(), posting.getMessage());
                return posting.propagate();
            }
            LocalDate postingDate = posting.getValue();

            if (periodLockService.isLocked(postingDate)) {
                String period = Validation.PERIOD_FORMAT.format(postingDate);
                log.warn("Posting rejected ({}): period {} is locked", operation, period);
                return OperationResult.failure(ErrorKind.PERIOD_LOCKED, "Period " + period + " is locked");
            }

            long sequenceNumber = transactionStore.nextSequenceNumber();
            transactionStore.insert(transactionId, sequenceNumber, postingDate, amount, debitId, creditId, notes);

            log.info("Transaction posted: date={}, amount={}, debit={}, credit={}",
                postingDate, amount.toPlainString(), debitId, creditId);
            return OperationResult.ok(transactionId);
        } finally {
            MDC.remove("transactionId");
        }
    }

    /**
     * Validates a posting in rule order and returns its parsed date.
     *
     * @param existingId transaction being modified, or null for a new posting
     */
    private OperationResult<LocalDate> checkPosting(UUID existingId, String date, BigDecimal amount,
                                                    UUID debitId, UUID creditId, String notes) {
        if (debitId == null || creditId == null) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "Debit and credit accounts are required");
        }
        if (debitId.equals(creditId)) {
            return OperationResult.failure(ErrorKind.INVALID_POSTING,
                "Debit and credit accounts must be different");
        }

        Optional<AccountEntity> debit = accountRepository.findById(debitId);
        if (debit.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Debit account not found: " + debitId);
        }
        Optional<AccountEntity> credit = accountRepository.findById(creditId);
        if (credit.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Credit account not found: " + creditId);
        }

        ValidationResult dateCheck = Validation.date(date);
        if (dateCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, dateCheck.getReason());
        }
        ValidationResult amountCheck = Validation.positiveAmount(amount);
        if (amountCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, amountCheck.getReason());
        }
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT,
                "Notes are longer than " + MAX_NOTES_LENGTH + " characters");
        }

        boolean creditsExpense = credit.get().getCategory() == AccountCategory.EXPENSE;
        boolean debitsIncome = debit.get().getCategory() == AccountCategory.INCOME;
        if ((creditsExpense || debitsIncome) && !isReversal(existingId, debitId, creditId, amount)) {
            String reason = creditsExpense
                ? "Expense account cannot be credited: " + credit.get().getName()
                : "Income account cannot be debited: " + debit.get().getName();
            return OperationResult.failure(ErrorKind.INVALID_POSTING, reason);
        }

        return OperationResult.ok(Validation.parseDate(date));
    }

    private boolean isReversal(UUID existingId, UUID debitId, UUID creditId, BigDecimal amount) {
        // Each earlier posting with the accounts swapped can be offset by at most one mirror entry
        int originals = transactionStore.countPostings(creditId, debitId, amount, existingId);
        if (originals == 0) {
            return false;
        }
        int mirrors = transactionStore.countPostings(debitId, creditId, amount, existingId);
        return mirrors < originals;
    }

    private static String reversalNote(LedgerTransaction source) {
        String note = "Reversal of " + source.getDate();
        if (source.getNotes() != null && !source.getNotes().isBlank()) {
            note = note + ": " + source.getNotes();
        }
        return note.length() > MAX_NOTES_LENGTH ? note.substring(0, MAX_NOTES_LENGTH) : note;
    }

    private <T> OperationResult<T> record(String operation, OperationResult<T> result) {
        ledgerMetrics.recordTransaction(operation, result);
        return result;
    }
}
