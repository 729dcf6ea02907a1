package com.flagship.finance_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PeriodLockRepository extends JpaRepository<PeriodLockEntity, String> {

    List<PeriodLockEntity> findByLockedTrueOrderByPeriodKeyAsc();
}
