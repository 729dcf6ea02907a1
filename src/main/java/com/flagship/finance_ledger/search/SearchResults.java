package com.flagship.finance_ledger.search;

import com.flagship.finance_ledger.account.Account;
import com.flagship.finance_ledger.ledger.LedgerTransaction;
import lombok.Value;

import java.util.List;

@Value
public class SearchResults {

    public static final SearchResults EMPTY = new SearchResults("", List.of(), List.of());

    String text;
    List<Account> accounts;
    List<LedgerTransaction> transactions;

    public boolean isEmpty() {
        return accounts.isEmpty() && transactions.isEmpty();
    }
}
