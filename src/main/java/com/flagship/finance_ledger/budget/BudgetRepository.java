package com.flagship.finance_ledger.budget;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BudgetRepository extends JpaRepository<BudgetEntity, UUID> {

    Optional<BudgetEntity> findByCategoryAndBudgetMonth(String category, String budgetMonth);

    boolean existsByCategoryAndBudgetMonth(String category, String budgetMonth);

    List<BudgetEntity> findByBudgetMonthOrderByCategoryAsc(String budgetMonth);
}
