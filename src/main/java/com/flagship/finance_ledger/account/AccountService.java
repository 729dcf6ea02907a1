package com.flagship.finance_ledger.account;

import com.flagship.finance_ledger.common.ErrorKind;
import com.flagship.finance_ledger.common.ItemError;
import com.flagship.finance_ledger.common.OperationResult;
import com.flagship.finance_ledger.ledger.AccountMovement;
import com.flagship.finance_ledger.ledger.TransactionStore;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.validation.Validation;
import com.flagship.finance_ledger.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Chart of accounts lifecycle: seeding, import, manual add, opening balances and
 * balance computation.
 *
 * Balances are derived, never stored: opening balance plus the account's postings,
 * signed by {@link AccountCategory}.
 */
@Service
@Slf4j
public class AccountService {

    static final Comparator<Account> CHART_ORDER = Comparator
        .comparing(Account::getCategory)
        .thenComparing(Account::getName, String.CASE_INSENSITIVE_ORDER)
        .thenComparing(Account::getName);

    private final AccountRepository accountRepository;
    private final TransactionStore transactionStore;
    private final TransactionTemplate rowTransaction;
    private final LedgerMetrics ledgerMetrics;

    public AccountService(AccountRepository accountRepository,
                          TransactionStore transactionStore,
                          PlatformTransactionManager transactionManager,
                          LedgerMetrics ledgerMetrics) {
        this.accountRepository = accountRepository;
        this.transactionStore = transactionStore;
        this.rowTransaction = new TransactionTemplate(transactionManager);
        this.ledgerMetrics = ledgerMetrics;
    }

    /**
     * Seeds the built-in chart. Running it again adds nothing.
     *
     * @return summary with accounts added and accounts already present (skipped)
     */
    public OperationResult<ImportSummary> initializeDefaultChart() {
        OperationResult<ImportSummary> result = importChart(DefaultChart.rows());
        if (result.isSuccess()) {
            log.info("Default chart initialized: added={}, alreadyPresent={}",
                result.getValue().getAdded(), result.getValue().getSkipped());
        }
        return result;
    }

    /**
     * Imports candidate rows one by one.
     *
     * Each row is validated independently and committed in its own transaction, so a bad
     * or failing row never undoes rows already imported. Invalid rows are reported with
     * their 1-based position; existing (name, category) pairs are skipped silently.
     *
     * @return summary of added/skipped rows; failure {@link ErrorKind#NO_VALID_ACCOUNTS}
     *         (still carrying the summary) when the input holds no valid row
     */
    public OperationResult<ImportSummary> importChart(List<ChartRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return OperationResult.failure(ErrorKind.NO_VALID_ACCOUNTS, "No valid accounts found",
                new ImportSummary(0, 0, List.of()));
        }

        int added = 0;
        int duplicates = 0;
        List<ItemError> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            ChartRow row = rows.get(i);
            if (row == null) {
                errors.add(ItemError.of(rowNumber, ErrorKind.INVALID_INPUT, "Empty row"));
                continue;
            }

            ValidationResult nameCheck = Validation.accountName(row.getName());
            if (nameCheck.isInvalid()) {
                errors.add(ItemError.of(rowNumber, ErrorKind.INVALID_INPUT, nameCheck.getReason()));
                continue;
            }
            ValidationResult categoryCheck = Validation.category(row.getType());
            if (categoryCheck.isInvalid()) {
                errors.add(ItemError.of(rowNumber, ErrorKind.INVALID_INPUT, categoryCheck.getReason()));
                continue;
            }

            String name = row.getName().trim();
            AccountCategory category = AccountCategory.fromText(row.getType()).orElseThrow();
            String key = category + "|" + name;

            if (!seen.add(key) || accountRepository.existsByNameAndCategory(name, category)) {
                log.debug("Skipping existing account: row={}, name={}, category={}", rowNumber, name, category);
                duplicates++;
                continue;
            }

            try {
                rowTransaction.executeWithoutResult(status ->
                    accountRepository.save(AccountEntity.fromDomain(Account.create(name, category))));
                added++;
            } catch (DataIntegrityViolationException e) {
                // Unique (name, category) constraint: the account appeared since the existence check
                log.debug("Account already present on insert: row={}, name={}", rowNumber, name);
                duplicates++;
            }
        }

        ImportSummary summary = new ImportSummary(added, duplicates + errors.size(), List.copyOf(errors));
        ledgerMetrics.recordImport(summary.getAdded(), summary.getSkipped());

        if (added + duplicates == 0) {
            log.warn("Chart import rejected: no valid rows among {}", rows.size());
            return OperationResult.failure(ErrorKind.NO_VALID_ACCOUNTS, "No valid accounts found", summary);
        }

        log.info("Chart import finished: added={}, skipped={}, errors={}",
            summary.getAdded(), summary.getSkipped(), errors.size());
        return OperationResult.ok(summary);
    }

    /**
     * Adds one account by hand. An existing (name, category) pair is returned as is.
     */
    @Transactional
    public OperationResult<Account> addAccount(String name, String category) {
        ValidationResult nameCheck = Validation.accountName(name);
        if (nameCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, nameCheck.getReason());
        }
        ValidationResult categoryCheck = Validation.category(category);
        if (categoryCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, categoryCheck.getReason());
        }

        String trimmed = name.trim();
        AccountCategory resolved = AccountCategory.fromText(category).orElseThrow();

        Optional<AccountEntity> existing = accountRepository.findByNameAndCategory(trimmed, resolved);
        if (existing.isPresent()) {
            log.info("Account already exists: name={}, category={}", trimmed, resolved);
            return OperationResult.ok(existing.get().toDomain());
        }

        AccountEntity saved = accountRepository.save(AccountEntity.fromDomain(Account.create(trimmed, resolved)));
        log.info("Account created: id={}, name={}, category={}", saved.getId(), trimmed, resolved);
        return OperationResult.ok(saved.toDomain());
    }

    /**
     * Overwrites an account's opening balance.
     *
     * Any sign is accepted: a negative opening balance expresses an overdrawn or contra
     * account in its category's natural sign.
     */
    @Transactional
    public OperationResult<Account> setOpeningBalance(UUID accountId, BigDecimal amount) {
        if (accountId == null) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "Account id is required");
        }
        MDC.put("accountId", accountId.toString());
        try {
            Optional<AccountEntity> entity = accountRepository.findById(accountId);
            if (entity.isEmpty()) {
                log.warn("Opening balance rejected: account not found");
                return OperationResult.failure(ErrorKind.NOT_FOUND, "Account not found: " + accountId);
            }

            ValidationResult amountCheck = Validation.openingAmount(amount);
            if (amountCheck.isInvalid()) {
                log.warn("Opening balance rejected: {}", amountCheck.getReason());
                return OperationResult.failure(ErrorKind.INVALID_AMOUNT, amountCheck.getReason());
            }

            AccountEntity account = entity.get();
            account.changeOpeningBalance(amount);
            AccountEntity saved = accountRepository.save(account);

            log.info("Opening balance set: amount={}", amount.toPlainString());
            return OperationResult.ok(saved.toDomain());
        } finally {
            MDC.remove("accountId");
        }
    }

    /**
     * Current balance of an account in its category's natural sign.
     */
    @Transactional(readOnly = true)
    public OperationResult<BigDecimal> getBalance(UUID accountId) {
        return balance(accountId, null);
    }

    /**
     * Balance including only postings dated on or before {@code date} (yyyy-MM-dd).
     */
    @Transactional(readOnly = true)
    public OperationResult<BigDecimal> getBalanceAsOf(UUID accountId, String date) {
        ValidationResult dateCheck = Validation.date(date);
        if (dateCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, dateCheck.getReason());
        }
        return balance(accountId, Validation.parseDate(date));
    }

    @Transactional(readOnly = true)
    public Optional<Account> findAccount(UUID accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return accountRepository.findById(accountId).map(AccountEntity::toDomain);
    }

    /**
     * All accounts ordered by category, then name.
     */
    @Transactional(readOnly = true)
    public List<Account> listAccounts() {
        return accountRepository.findAll().stream()
            .map(AccountEntity::toDomain)
            .sorted(CHART_ORDER)
            .toList();
    }

    /**
     * Accounts of one category ordered by name; {@code null} means every category.
     */
    @Transactional(readOnly = true)
    public List<Account> listAccounts(AccountCategory category) {
        if (category == null) {
            return listAccounts();
        }
        return accountRepository.findByCategory(category).stream()
            .map(AccountEntity::toDomain)
            .sorted(CHART_ORDER)
            .toList();
    }

    /**
     * Every account with its current balance, in chart order.
     */
    @Transactional(readOnly = true)
    public List<AccountBalance> listBalances() {
        return listAccounts().stream()
            .map(account -> new AccountBalance(account, balanceOf(account, null)))
            .toList();
    }

    /**
     * Net movement of an account within one month, in its category's natural sign.
     * The opening balance is not included.
     */
    @Transactional(readOnly = true)
    public BigDecimal periodActivity(Account account, YearMonth period) {
        AccountMovement movement = transactionStore.movement(account.getId(), period.atDay(1), period.atEndOfMonth());
        return account.getCategory().movement(movement.getDebits(), movement.getCredits());
    }

    private OperationResult<BigDecimal> balance(UUID accountId, LocalDate asOf) {
        Optional<Account> account = findAccount(accountId);
        if (account.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Account not found: " + accountId);
        }
        return OperationResult.ok(balanceOf(account.get(), asOf));
    }

    private BigDecimal balanceOf(Account account, LocalDate asOf) {
        AccountMovement movement = transactionStore.movement(account.getId(), null, asOf);
        return account.getCategory().balance(account.getOpeningBalance(), movement.getDebits(), movement.getCredits());
    }
}
