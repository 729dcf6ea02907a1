package com.flagship.finance_ledger.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.finance_ledger.account.Account;
import com.flagship.finance_ledger.account.AccountService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes the chart of accounts as CSV ({@code name,type,opening_balance}) in chart
 * order. The output can be imported back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccountCsvExporter {

    private final AccountService accountService;
    private final CsvMapper csvMapper;

    public int export(Writer out) throws IOException {
        List<Account> accounts = accountService.listAccounts();

        CsvSchema schema = csvMapper.schemaFor(Row.class).withHeader();
        try (SequenceWriter rows = csvMapper.writer(schema)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(out)) {
            for (Account account : accounts) {
                rows.write(new Row(
                    account.getName(),
                    account.getCategory().label(),
                    account.getOpeningBalance().stripTrailingZeros().toPlainString()
                ));
            }
        }

        log.info("Exported {} accounts", accounts.size());
        return accounts.size();
    }

    @Value
    @JsonPropertyOrder({"name", "type", "opening_balance"})
    public static class Row {
        @JsonProperty("name")
        String name;

        @JsonProperty("type")
        String type;

        @JsonProperty("opening_balance")
        String openingBalance;
    }
}
