package com.flagship.finance_ledger.budget;

import com.flagship.finance_ledger.account.Account;
import com.flagship.finance_ledger.account.AccountCategory;
import com.flagship.finance_ledger.account.AccountService;
import com.flagship.finance_ledger.common.ErrorKind;
import com.flagship.finance_ledger.common.OperationResult;
import com.flagship.finance_ledger.ledger.LedgerTransaction;
import com.flagship.finance_ledger.ledger.TransactionQuery;
import com.flagship.finance_ledger.ledger.TransactionService;
import com.flagship.finance_ledger.validation.Validation;
import com.flagship.finance_ledger.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Budget-vs-actual reporting. Read only: figures come from the account and
 * transaction services, nothing is persisted here.
 *
 * The actual amount of a category is the natural-sign movement, within the month,
 * of the expense and income accounts carrying the category's name.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetReportService {

    private static final Set<AccountCategory> BUDGETABLE = Set.of(AccountCategory.EXPENSE, AccountCategory.INCOME);

    static final Comparator<BudgetVarianceRow> LARGEST_OVERSPEND_FIRST = Comparator
        .comparing(BudgetVarianceRow::getVariance)
        .thenComparing(BudgetVarianceRow::getCategory);

    private final BudgetService budgetService;
    private final AccountService accountService;
    private final TransactionService transactionService;

    /**
     * One row per budgeted category, plus one per expense account that saw activity
     * in the month without a budget (reported as budgeted at zero).
     */
    @Transactional(readOnly = true)
    public OperationResult<List<BudgetVarianceRow>> budgetVsActual(String period) {
        ValidationResult periodCheck = Validation.period(period);
        if (periodCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, periodCheck.getReason());
        }
        YearMonth month = Validation.parsePeriod(period);

        Map<String, BigDecimal> actuals = actualsByCategory(month);
        Map<String, BigDecimal> budgeted = new LinkedHashMap<>();
        for (Budget budget : budgetService.budgets(month)) {
            budgeted.put(budget.getCategory(), budget.getAmount());
        }

        List<BudgetVarianceRow> rows = new ArrayList<>();
        for (Map.Entry<String, BigDecimal> entry : budgeted.entrySet()) {
            rows.add(row(entry.getKey(), entry.getValue(), actuals.getOrDefault(entry.getKey(), BigDecimal.ZERO)));
        }
        for (Account account : accountService.listAccounts(AccountCategory.EXPENSE)) {
            if (budgeted.containsKey(account.getName())) {
                continue;
            }
            BigDecimal actual = actuals.getOrDefault(account.getName(), BigDecimal.ZERO);
            if (actual.signum() != 0) {
                rows.add(row(account.getName(), BigDecimal.ZERO, actual));
            }
        }

        rows.sort(LARGEST_OVERSPEND_FIRST);
        log.debug("Budget report for {}: {} rows", month, rows.size());
        return OperationResult.ok(List.copyOf(rows));
    }

    /**
     * Transactions of the month that touch an account named {@code category}, in date order.
     */
    @Transactional(readOnly = true)
    public OperationResult<List<LedgerTransaction>> categoryTransactions(String category, String period) {
        if (category == null || category.isBlank()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "Category is required");
        }
        ValidationResult periodCheck = Validation.period(period);
        if (periodCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, periodCheck.getReason());
        }
        YearMonth month = Validation.parsePeriod(period);
        String name = category.trim();

        Map<UUID, LedgerTransaction> matches = new LinkedHashMap<>();
        for (Account account : categoryAccounts(name)) {
            OperationResult<List<LedgerTransaction>> found = transactionService.searchAllTransactions(
                TransactionQuery.builder()
                    .accountId(account.getId())
                    .dateFrom(month.atDay(1))
                    .dateTo(month.atEndOfMonth())
                    .build());
            if (found.isFailure()) {
                return found;
            }
            found.getValue().forEach(txn -> matches.putIfAbsent(txn.getId(), txn));
        }

        return OperationResult.ok(matches.values().stream()
            .sorted(Comparator.comparing(LedgerTransaction::getDate)
                .thenComparingLong(LedgerTransaction::getSequenceNumber))
            .toList());
    }

    /**
     * Total income, total expense and their difference for the month.
     */
    @Transactional(readOnly = true)
    public OperationResult<PeriodSummary> periodSummary(String period) {
        ValidationResult periodCheck = Validation.period(period);
        if (periodCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, periodCheck.getReason());
        }
        YearMonth month = Validation.parsePeriod(period);

        BigDecimal income = totalActivity(AccountCategory.INCOME, month);
        BigDecimal expense = totalActivity(AccountCategory.EXPENSE, month);
        return OperationResult.ok(new PeriodSummary(month, income, expense));
    }

    private Map<String, BigDecimal> actualsByCategory(YearMonth month) {
        Map<String, BigDecimal> actuals = new LinkedHashMap<>();
        for (AccountCategory category : BUDGETABLE) {
            for (Account account : accountService.listAccounts(category)) {
                actuals.merge(account.getName(), accountService.periodActivity(account, month), BigDecimal::add);
            }
        }
        return actuals;
    }

    private List<Account> categoryAccounts(String name) {
        return accountService.listAccounts().stream()
            .filter(account -> BUDGETABLE.contains(account.getCategory()))
            .filter(account -> account.getName().equals(name))
            .toList();
    }

    private BigDecimal totalActivity(AccountCategory category, YearMonth month) {
        return accountService.listAccounts(category).stream()
            .map(account -> accountService.periodActivity(account, month))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BudgetVarianceRow row(String category, BigDecimal budgeted, BigDecimal actual) {
        return new BudgetVarianceRow(
            category,
            budgeted,
            actual,
            budgeted.subtract(actual),
            PercentOfBudget.of(actual, budgeted)
        );
    }
}
