package com.flagship.finance_ledger.budget;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.UUID;

@Entity
@Table(
    name = "budgets",
    uniqueConstraints = @UniqueConstraint(name = "uq_budgets_category_month", columnNames = {"category", "budget_month"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BudgetEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 100)
    private String category;

    @Column(name = "budget_month", nullable = false, updatable = false, length = 7)
    private String budgetMonth;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static BudgetEntity fromDomain(Budget budget) {
        return new BudgetEntity(
            budget.getId(),
            budget.getCategory(),
            budget.getPeriod().toString(),
            budget.getAmount(),
            null,
            null
        );
    }

    public Budget toDomain() {
        return new Budget(id, category, YearMonth.parse(budgetMonth), amount);
    }

    void changeAmount(BigDecimal amount) {
        this.amount = amount;
    }
}
