package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.common.ErrorKind;
import com.flagship.finance_ledger.common.OperationResult;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.validation.Validation;
import com.flagship.finance_ledger.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

/**
 * Administrative period locks.
 *
 * Locking is pure metadata: it never inspects or changes transactions. Once a month
 * is locked, no transaction dated in it can be posted or touched;
 * corrections go through a reversal dated in an open month.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodLockService {

    private final PeriodLockRepository repository;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public OperationResult<YearMonth> lockPeriod(String yearMonth) {
        return setLocked(yearMonth, true);
    }

    @Transactional
    public OperationResult<YearMonth> unlockPeriod(String yearMonth) {
        return setLocked(yearMonth, false);
    }

    /**
     * Malformed input is reported as not locked.
     */
    @Transactional(readOnly = true)
    public boolean isPeriodLocked(String yearMonth) {
        if (Validation.period(yearMonth).isInvalid()) {
            return false;
        }
        return isLocked(Validation.parsePeriod(yearMonth));
    }

    @Transactional(readOnly = true)
    public boolean isLocked(YearMonth period) {
        return repository.findById(period.toString())
            .map(PeriodLockEntity::isLocked)
            .orElse(false);
    }

    @Transactional(readOnly = true)
    public boolean isLocked(LocalDate date) {
        return isLocked(YearMonth.from(date));
    }

    @Transactional(readOnly = true)
    public List<YearMonth> lockedPeriods() {
        return repository.findByLockedTrueOrderByPeriodKeyAsc().stream()
            .map(PeriodLockEntity::getPeriod)
            .toList();
    }

    private OperationResult<YearMonth> setLocked(String yearMonth, boolean locked) {
        ValidationResult check = Validation.period(yearMonth);
        if (check.isInvalid()) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, check.getReason());
        }
        YearMonth period = Validation.parsePeriod(yearMonth);

        PeriodLockEntity entity = repository.findById(period.toString())
            .orElseGet(() -> PeriodLockEntity.forPeriod(period, locked));
        entity.setLocked(locked);
        repository.save(entity);
        if (locked) {
            ledgerMetrics.incrementPeriodsLocked();
        }

        log.info("Period {} {}", period, locked ? "locked" : "unlocked");
        return OperationResult.ok(period);
    }
}
