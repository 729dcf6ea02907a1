package com.flagship.finance_ledger.search;

import com.flagship.finance_ledger.account.Account;
import com.flagship.finance_ledger.account.AccountEntity;
import com.flagship.finance_ledger.account.AccountRepository;
import com.flagship.finance_ledger.common.OperationResult;
import com.flagship.finance_ledger.ledger.LedgerTransaction;
import com.flagship.finance_ledger.ledger.TransactionQuery;
import com.flagship.finance_ledger.ledger.TransactionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

/**
 * One search box over the whole ledger: accounts by name, transactions by notes or
 * account name. Matching ignores case.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerSearchService {

    private static final Comparator<Account> BY_CATEGORY_THEN_NAME = Comparator
        .comparing(Account::getCategory)
        .thenComparing(Account::getName, String.CASE_INSENSITIVE_ORDER);

    private final AccountRepository accountRepository;
    private final TransactionService transactionService;

    /**
     * Blank text matches nothing. Transactions are limited to the configured default
     * search size.
     */
    @Transactional(readOnly = true)
    public OperationResult<SearchResults> search(String text) {
        if (text == null || text.isBlank()) {
            return OperationResult.ok(SearchResults.EMPTY);
        }
        String needle = text.trim();

        List<Account> accounts = accountRepository.findByNameContainingIgnoreCase(needle).stream()
            .map(AccountEntity::toDomain)
            .sorted(BY_CATEGORY_THEN_NAME)
            .toList();

        OperationResult<List<LedgerTransaction>> transactions =
            transactionService.searchTransactions(TransactionQuery.text(needle));
        if (transactions.isFailure()) {
            return transactions.propagate();
        }

        log.debug("Search '{}': {} accounts, {} transactions", needle, accounts.size(), transactions.getValue().size());
        return OperationResult.ok(new SearchResults(needle, accounts, transactions.getValue()));
    }
}
