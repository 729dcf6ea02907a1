package com.flagship.finance_ledger.config;

import com.flagship.finance_ledger.account.AccountService;
import com.flagship.finance_ledger.account.ImportSummary;
import com.flagship.finance_ledger.common.OperationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Seeds the default chart of accounts at startup.
 *
 * Configuration:
 * - ledger.bootstrap.seed-default-chart: enable/disable (default: true)
 */
@Component
@ConditionalOnProperty(name = "ledger.bootstrap.seed-default-chart", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerBootstrap implements CommandLineRunner {

    private final AccountService accountService;

    @Override
    public void run(String... args) {
        OperationResult<ImportSummary> result = accountService.initializeDefaultChart();
        if (result.isFailure()) {
            log.error("Default chart not seeded: {} - {}", result.getErrorKind(), result.getMessage());
            return;
        }
        log.info("Ledger ready: {} accounts added, {} already present",
            result.getValue().getAdded(), result.getValue().getSkipped());
    }
}
