package com.flagship.finance_ledger.io;

import com.flagship.finance_ledger.account.AccountService;
import com.flagship.finance_ledger.account.ChartRow;
import com.flagship.finance_ledger.account.ImportSummary;
import com.flagship.finance_ledger.common.ErrorKind;
import com.flagship.finance_ledger.common.OperationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Imports a chart of accounts file. {@code .csv} files are read as CSV, anything
 * else as JSON.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChartImportService {

    private final ChartFileReader chartFileReader;
    private final AccountService accountService;

    public OperationResult<ImportSummary> importFile(Path file) {
        if (file == null) {
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "File is required");
        }
        if (!Files.isRegularFile(file)) {
            log.warn("Chart file not found: {}", file);
            return OperationResult.failure(ErrorKind.INVALID_INPUT, "File not found: " + file);
        }

        List<ChartRow> rows;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            rows = isCsv(file) ? chartFileReader.readCsv(reader) : chartFileReader.readJson(reader);
        } catch (IOException e) {
            log.warn("Chart file unreadable: {}", file, e);
            return OperationResult.failure(ErrorKind.INVALID_INPUT,
                "Cannot read chart file " + file.getFileName() + ": " + e.getMessage());
        }

        log.info("Importing {} chart rows from {}", rows.size(), file.getFileName());
        return accountService.importChart(rows);
    }

    private static boolean isCsv(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv");
    }
}
