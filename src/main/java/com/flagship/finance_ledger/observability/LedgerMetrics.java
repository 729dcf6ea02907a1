package com.flagship.finance_ledger.observability;

import com.flagship.finance_ledger.common.ErrorKind;
import com.flagship.finance_ledger.common.OperationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Counters for ledger operations.
 *
 * Metrics exposed:
 * - ledger.transactions: postings, tagged by operation (add, modify, delete, reverse)
 *   and outcome (success or the lower-case error kind)
 * - ledger.accounts.imported: chart rows, tagged by result (added, skipped)
 * - ledger.periods.locked: lock operations
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter periodsLocked;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.periodsLocked = Counter.builder("ledger.periods.locked")
                .description("Number of period lock operations")
                .register(registry);
    }

    public void recordTransaction(String operation, OperationResult<?> result) {
        String outcome = result.isSuccess() ? "success" : tag(result.getErrorKind());
        registry.counter("ledger.transactions",
                "operation", operation,
                "outcome", outcome
        ).increment();
    }

    public void recordImport(int added, int skipped) {
        registry.counter("ledger.accounts.imported", "result", "added").increment(added);
        registry.counter("ledger.accounts.imported", "result", "skipped").increment(skipped);
    }

    public void incrementPeriodsLocked() {
        periodsLocked.increment();
    }

    public double transactionCount(String operation, String outcome) {
        Counter counter = registry.find("ledger.transactions")
                .tags("operation", operation, "outcome", outcome)
                .counter();
        return counter != null ? counter.count() : 0.0;
    }

    private static String tag(ErrorKind kind) {
        return kind == null ? "unknown" : kind.name().toLowerCase(Locale.ROOT);
    }
}
