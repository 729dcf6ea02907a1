package com.flagship.finance_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.YearMonth;

/**
 * Lock flag for one calendar month, keyed by {@code yyyy-MM}.
 */
@Entity
@Table(name = "period_locks")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PeriodLockEntity {

    @Id
    @Column(name = "period_key", nullable = false, updatable = false, length = 7)
    private String periodKey;

    @Column(nullable = false)
    private boolean locked;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    private PeriodLockEntity(String periodKey, boolean locked) {
        this.periodKey = periodKey;
        this.locked = locked;
    }

    static PeriodLockEntity forPeriod(YearMonth period, boolean locked) {
        return new PeriodLockEntity(period.toString(), locked);
    }

    @PrePersist
    @PreUpdate
    void touch() {
        this.updatedAt = Instant.now();
    }

    void setLocked(boolean locked) {
        this.locked = locked;
    }

    public YearMonth getPeriod() {
        return YearMonth.parse(periodKey);
    }
}
