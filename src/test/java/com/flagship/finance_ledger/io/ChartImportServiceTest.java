package com.flagship.finance_ledger.io;

import com.flagship.finance_ledger.account.AccountService;
import com.flagship.finance_ledger.account.ImportSummary;
import com.flagship.finance_ledger.common.ErrorKind;
import com.flagship.finance_ledger.common.OperationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ChartImportServiceTest {

    @Autowired
    private ChartImportService chartImportService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM transactions");
        jdbcTemplate.update("DELETE FROM budgets");
        jdbcTemplate.update("DELETE FROM accounts");
    }

    @Test
    @DisplayName("CSV file import reports bad rows by position")
    void testImportCsv() throws Exception {
        Path file = tempDir.resolve("chart.csv");
        Files.writeString(file, "name,type\nCash,asset\nBroken,money\nRent,expense\n", StandardCharsets.UTF_8);

        OperationResult<ImportSummary> result = chartImportService.importFile(file);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getValue().getAdded());
        assertEquals(1, result.getValue().getSkipped());
        assertEquals(2, result.getValue().getErrors().get(0).getRow());
        assertEquals(2, accountService.listAccounts().size());
    }

    @Test
    @DisplayName("Non-CSV files are read as JSON")
    void testImportJson() throws Exception {
        Path file = tempDir.resolve("chart.json");
        Files.writeString(file, "[{\"name\":\"Cash\",\"type\":\"asset\"},{\"name\":\"Salary\",\"type\":\"INCOME\"}]",
            StandardCharsets.UTF_8);

        OperationResult<ImportSummary> result = chartImportService.importFile(file);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getValue().getAdded());
    }

    @Test
    @DisplayName("Missing or unreadable files are INVALID_INPUT")
    void testUnreadableFiles() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{oops", StandardCharsets.UTF_8);

        assertEquals(ErrorKind.INVALID_INPUT, chartImportService.importFile(tempDir.resolve("missing.csv")).getErrorKind());
        assertEquals(ErrorKind.INVALID_INPUT, chartImportService.importFile(broken).getErrorKind());
        assertEquals(ErrorKind.INVALID_INPUT, chartImportService.importFile(null).getErrorKind());
    }

    @Test
    @DisplayName("A CSV with only a header has no valid accounts")
    void testHeaderOnly() throws Exception {
        Path file = tempDir.resolve("empty.csv");
        Files.writeString(file, "name,type\n", StandardCharsets.UTF_8);

        assertEquals(ErrorKind.NO_VALID_ACCOUNTS, chartImportService.importFile(file).getErrorKind());
    }
}
