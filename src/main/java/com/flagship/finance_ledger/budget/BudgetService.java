package com.flagship.finance_ledger.budget;

import com.flagship.finance_ledger.common.ErrorKind;
import com.flagship.finance_ledger.common.OperationResult;
import com.flagship.finance_ledger.validation.Validation;
import com.flagship.finance_ledger.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

/**
 * Monthly budgets per category.
 *
 * Budgets are keyed by (category, month). Setting a budget twice overwrites the amount;
 * copying a month forward never does.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetService {

    private final BudgetRepository budgetRepository;

    /**
     * Creates or replaces the budget of a category for a month.
     *
     * @param category account name the budget applies to
     * @param period   yyyy-MM
     */
    @Transactional
    public OperationResult<Budget> setBudget(String category, String period, BigDecimal amount) {
        if (category == null || category.isBlank()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "Budget category is required");
        }
        if (category.trim().length() > Validation.MAX_ACCOUNT_NAME_LENGTH) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT,
                "Budget category is longer than " + Validation.MAX_ACCOUNT_NAME_LENGTH + " characters");
        }
        ValidationResult periodCheck = Validation.period(period);
        if (periodCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, periodCheck.getReason());
        }
        ValidationResult amountCheck = Validation.budgetAmount(amount);
        if (amountCheck.isInvalid()) {
            log.warn("Budget rejected: category={}, period={}, reason={}", category, period, amountCheck.getReason());
            return OperationResult.failure(ErrorKind.INVALID_AMOUNT, amountCheck.getReason());
        }

        String name = category.trim();
        YearMonth month = Validation.parsePeriod(period);

        Optional<BudgetEntity> existing = budgetRepository.findByCategoryAndBudgetMonth(name, month.toString());
        BudgetEntity saved;
        if (existing.isPresent()) {
            BudgetEntity entity = existing.get();
            entity.changeAmount(amount);
            saved = budgetRepository.save(entity);
            log.info("Budget updated: category={}, period={}, amount={}", name, month, amount.toPlainString());
        } else {
            saved = budgetRepository.save(BudgetEntity.fromDomain(Budget.create(name, month, amount)));
            log.info("Budget created: category={}, period={}, amount={}", name, month, amount.toPlainString());
        }
        return OperationResult.ok(saved.toDomain());
    }

    /**
     * Budgets of one month, ordered by category.
     */
    @Transactional(readOnly = true)
    public OperationResult<List<Budget>> listBudgets(String period) {
        ValidationResult periodCheck = Validation.period(period);
        if (periodCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, periodCheck.getReason());
        }
        return OperationResult.ok(budgets(Validation.parsePeriod(period)));
    }

    /**
     * Copies every budget of {@code from} into {@code to}. Categories already budgeted
     * in {@code to} keep their amount and are counted as skipped.
     */
    @Transactional
    public OperationResult<BudgetCopySummary> copyBudgetForward(String from, String to) {
        ValidationResult fromCheck = Validation.period(from);
        if (fromCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, fromCheck.getReason());
        }
        ValidationResult toCheck = Validation.period(to);
        if (toCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, toCheck.getReason());
        }
        YearMonth source = Validation.parsePeriod(from);
        YearMonth target = Validation.parsePeriod(to);
        if (source.equals(target)) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "Source and target month are the same: " + source);
        }

        int copied = 0;
        int skipped = 0;
        for (Budget budget : budgets(source)) {
            if (budgetRepository.existsByCategoryAndBudgetMonth(budget.getCategory(), target.toString())) {
                log.debug("Keeping existing budget: category={}, period={}", budget.getCategory(), target);
                skipped++;
                continue;
            }
            budgetRepository.save(BudgetEntity.fromDomain(
                Budget.create(budget.getCategory(), target, budget.getAmount())));
            copied++;
        }

        log.info("Budgets copied from {} to {}: copied={}, skipped={}", source, target, copied, skipped);
        return OperationResult.ok(new BudgetCopySummary(copied, skipped));
    }

    @Transactional
    public OperationResult<BudgetCopySummary> copyBudgetToNextMonth(String from) {
        ValidationResult fromCheck = Validation.period(from);
        if (fromCheck.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, fromCheck.getReason());
        }
        YearMonth next = Validation.parsePeriod(from).plusMonths(1);
        return copyBudgetForward(from, next.toString());
    }

    List<Budget> budgets(YearMonth period) {
        return budgetRepository.findByBudgetMonthOrderByCategoryAsc(period.toString()).stream()
            .map(BudgetEntity::toDomain)
            .toList();
    }
}
