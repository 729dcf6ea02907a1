package com.flagship.finance_ledger.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    Optional<AccountEntity> findByNameAndCategory(String name, AccountCategory category);

    boolean existsByNameAndCategory(String name, AccountCategory category);

    List<AccountEntity> findByCategory(AccountCategory category);

    List<AccountEntity> findByNameContainingIgnoreCase(String text);
}
