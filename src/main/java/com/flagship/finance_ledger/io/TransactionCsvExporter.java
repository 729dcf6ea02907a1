package com.flagship.finance_ledger.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.finance_ledger.common.OperationResult;
import com.flagship.finance_ledger.ledger.LedgerTransaction;
import com.flagship.finance_ledger.ledger.TransactionQuery;
import com.flagship.finance_ledger.ledger.TransactionService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes transactions as CSV: {@code date,amount,debit_account,credit_account,notes},
 * in search order. The writer is left open.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionCsvExporter {

    private final TransactionService transactionService;
    private final CsvMapper csvMapper;

    /**
     * @return number of transactions written
     */
    public OperationResult<Integer> export(TransactionQuery query, Writer out) throws IOException {
        OperationResult<List<LedgerTransaction>> found = query != null && query.getLimit() != null
            ? transactionService.searchTransactions(query)
            : transactionService.searchAllTransactions(query);
        if (found.isFailure()) {
            return found.propagate();
        }

        CsvSchema schema = csvMapper.schemaFor(Row.class).withHeader();
        try (SequenceWriter rows = csvMapper.writer(schema)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(out)) {
            for (LedgerTransaction txn : found.getValue()) {
                rows.write(Row.of(txn));
            }
        }

        log.info("Exported {} transactions", found.getValue().size());
        return OperationResult.ok(found.getValue().size());
    }

    @Value
    @JsonPropertyOrder({"date", "amount", "debit_account", "credit_account", "notes"})
    public static class Row {
        @JsonProperty("date")
        String date;

        @JsonProperty("amount")
        String amount;

        @JsonProperty("debit_account")
        String debitAccount;

        @JsonProperty("credit_account")
        String creditAccount;

        @JsonProperty("notes")
        String notes;

        static Row of(LedgerTransaction txn) {
            return new Row(
                txn.getDate().toString(),
                txn.getAmount().stripTrailingZeros().toPlainString(),
                txn.getDebitAccountName(),
                txn.getCreditAccountName(),
                txn.getNotes() != null ? txn.getNotes() : ""
            );
        }
    }
}
