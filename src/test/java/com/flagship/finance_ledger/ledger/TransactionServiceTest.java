package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.account.AccountService;
import com.flagship.finance_ledger.common.ErrorKind;
import com.flagship.finance_ledger.common.OperationResult;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the posting rules: same-account postings, unknown accounts,
 * disallowed category combinations and mutations of locked months.
 */
@SpringBootTest
class TransactionServiceTest {

    @Autowired
    private TransactionService transactionService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private PeriodLockService periodLockService;

    @Autowired
    private LedgerMetrics ledgerMetrics;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID cash;
    private UUID bank;
    private UUID salary;
    private UUID groceries;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM transactions");
        jdbcTemplate.update("DELETE FROM budgets");
        jdbcTemplate.update("DELETE FROM period_locks");
        jdbcTemplate.update("DELETE FROM accounts");

        cash = accountService.addAccount("Cash", "asset").getValue().getId();
        bank = accountService.addAccount("Bank - KBank", "asset").getValue().getId();
        salary = accountService.addAccount("Salary", "income").getValue().getId();
        groceries = accountService.addAccount("Groceries", "expense").getValue().getId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printExpectedFailure(OperationResult<?> result) {
        System.out.println("⚠ EXPECTED FAILURE: " + result.getErrorKind());
        System.out.println("  Reason: " + result.getMessage());
    }

    private UUID post(String date, String amount, UUID debit, UUID credit, String notes) {
        OperationResult<UUID> result = transactionService.addTransaction(date, new BigDecimal(amount), debit, credit, notes);
        assertTrue(result.isSuccess(), () -> "Posting failed: " + result.getMessage());
        return result.getValue();
    }

    private BigDecimal balance(UUID accountId) {
        return accountService.getBalance(accountId).getValue();
    }

    @Test
    @DisplayName("Valid posting is stored with resolved account names")
    void testValidPosting() {
        printTestHeader("Valid Posting");

        UUID id = post("2025-10-05", "120.50", groceries, cash, "weekly shop");

        LedgerTransaction txn = transactionService.findTransaction(id).orElseThrow();
        printOutput("Transaction", txn);
        assertEquals(LocalDate.of(2025, 10, 5), txn.getDate());
        assertEquals(0, new BigDecimal("120.50").compareTo(txn.getAmount()));
        assertEquals("Groceries", txn.getDebitAccountName());
        assertEquals("Cash", txn.getCreditAccountName());
        assertEquals("weekly shop", txn.getNotes());
    }

    @Test
    @DisplayName("Same debit and credit account fails INVALID_POSTING, even with a bad amount")
    void testSameAccount() {
        printTestHeader("Same Account");

        OperationResult<UUID> result = transactionService.addTransaction(
            "2025-10-05", new BigDecimal("-1"), cash, cash, null);
        printExpectedFailure(result);

        assertEquals(ErrorKind.INVALID_POSTING, result.getErrorKind());
        assertEquals(0L, transactionService.ledgerTotals().getTransactionCount());
    }

    @Test
    @DisplayName("Unknown account fails NOT_FOUND")
    void testUnknownAccount() {
        OperationResult<UUID> result = transactionService.addTransaction(
            "2025-10-05", BigDecimal.TEN, UUID.randomUUID(), cash, null);

        assertEquals(ErrorKind.NOT_FOUND, result.getErrorKind());
    }

    @Test
    @DisplayName("Bad dates and amounts fail INVALID_INPUT")
    void testInvalidInput() {
        assertEquals(ErrorKind.INVALID_INPUT,
            transactionService.addTransaction("2025-02-30", BigDecimal.TEN, groceries, cash, null).getErrorKind());
        assertEquals(ErrorKind.INVALID_INPUT,
            transactionService.addTransaction("2025-10-05", BigDecimal.ZERO, groceries, cash, null).getErrorKind());
        assertEquals(ErrorKind.INVALID_INPUT,
            transactionService.addTransaction("2025-10-05", null, groceries, cash, null).getErrorKind());
        assertEquals(ErrorKind.INVALID_INPUT,
            transactionService.addTransaction("2025-10-05", BigDecimal.TEN, null, cash, null).getErrorKind());
    }

    @Test
    @DisplayName("Crediting an expense or debiting an income account fails INVALID_POSTING")
    void testCategoryRule() {
        printTestHeader("Category Rule");

        OperationResult<UUID> creditedExpense = transactionService.addTransaction(
            "2025-10-05", BigDecimal.TEN, cash, groceries, null);
        OperationResult<UUID> debitedIncome = transactionService.addTransaction(
            "2025-10-05", BigDecimal.TEN, salary, cash, null);
        printExpectedFailure(creditedExpense);
        printExpectedFailure(debitedIncome);

        assertEquals(ErrorKind.INVALID_POSTING, creditedExpense.getErrorKind());
        assertEquals(ErrorKind.INVALID_POSTING, debitedIncome.getErrorKind());
    }

    @Test
    @DisplayName("Locked October blocks modify and delete; a November reversal succeeds")
    void testLockEnforcement() {
        printTestHeader("Lock Enforcement");

        // Given: An October expense, then October locked
        UUID original = post("2025-10-15", "500", groceries, cash, "groceries");
        assertTrue(periodLockService.lockPeriod("2025-10").isSuccess());
        printInput("Locked periods", periodLockService.lockedPeriods());

        // When: Trying to change October
        OperationResult<LedgerTransaction> modify = transactionService.modifyTransaction(
            original, TransactionUpdate.builder().amount(new BigDecimal("450")).build());
        OperationResult<UUID> delete = transactionService.deleteTransaction(original);
        OperationResult<UUID> backdated = transactionService.addTransaction(
            "2025-10-31", BigDecimal.ONE, groceries, cash, null);
        printExpectedFailure(modify);

        // Then
        assertEquals(ErrorKind.PERIOD_LOCKED, modify.getErrorKind());
        assertEquals(ErrorKind.PERIOD_LOCKED, delete.getErrorKind());
        assertEquals(ErrorKind.PERIOD_LOCKED, backdated.getErrorKind());
        assertTrue(transactionService.findTransaction(original).isPresent());

        // When: Reversing in November with swapped accounts
        OperationResult<UUID> reversal = transactionService.addTransaction(
            "2025-11-02", new BigDecimal("500"), cash, groceries, "reversal");
        printOutput("Reversal", reversal);

        // Then
        assertTrue(reversal.isSuccess());
        assertEquals(0, BigDecimal.ZERO.compareTo(balance(groceries)));
        assertEquals(0, BigDecimal.ZERO.compareTo(balance(cash)));
    }

    @Test
    @DisplayName("reverseTransaction posts the swapped entry with a generated note")
    void testReverseTransaction() {
        UUID original = post("2025-10-15", "80", groceries, cash, "snacks");
        periodLockService.lockPeriod("2025-10");

        OperationResult<UUID> reversal = transactionService.reverseTransaction(original, "2025-11-01", null);

        assertTrue(reversal.isSuccess());
        LedgerTransaction posted = transactionService.findTransaction(reversal.getValue()).orElseThrow();
        assertEquals(cash, posted.getDebitAccountId());
        assertEquals(groceries, posted.getCreditAccountId());
        assertEquals(0, new BigDecimal("80").compareTo(posted.getAmount()));
        assertTrue(posted.getNotes().startsWith("Reversal of 2025-10-15"));
        assertEquals(0, BigDecimal.ZERO.compareTo(balance(groceries)));
    }

    @Test
    @DisplayName("A reversal dated in a locked month is rejected")
    void testReversalIntoLockedMonth() {
        UUID original = post("2025-10-15", "80", groceries, cash, null);
        periodLockService.lockPeriod("2025-10");

        assertEquals(ErrorKind.PERIOD_LOCKED,
            transactionService.reverseTransaction(original, "2025-10-20", null).getErrorKind());
        assertEquals(ErrorKind.NOT_FOUND,
            transactionService.reverseTransaction(UUID.randomUUID(), "2025-11-01", null).getErrorKind());
    }

    @Test
    @DisplayName("Crediting an expense with a different amount is not a reversal")
    void testPartialSwapIsNotReversal() {
        post("2025-10-15", "80", groceries, cash, null);

        OperationResult<UUID> result = transactionService.addTransaction(
            "2025-10-16", new BigDecimal("30"), cash, groceries, null);

        assertEquals(ErrorKind.INVALID_POSTING, result.getErrorKind());
    }

    @Test
    @DisplayName("A posting can be reversed once; further mirror entries are INVALID_POSTING")
    void testRepeatedReversal() {
        printTestHeader("Repeated Reversal");

        // Given: One expense and its reversal
        post("2025-10-15", "80", groceries, cash, "snacks");
        OperationResult<UUID> first = transactionService.addTransaction(
            "2025-11-01", new BigDecimal("80"), cash, groceries, "refund");
        assertTrue(first.isSuccess());

        // When: Mirroring the same posting again
        OperationResult<UUID> second = transactionService.addTransaction(
            "2025-11-02", new BigDecimal("80"), cash, groceries, "refund again");
        printExpectedFailure(second);

        // Then
        assertEquals(ErrorKind.INVALID_POSTING, second.getErrorKind());
        assertEquals(0, BigDecimal.ZERO.compareTo(balance(groceries)));

        // A second matching expense opens room for one more reversal
        post("2025-11-05", "80", groceries, cash, "snacks");
        assertTrue(transactionService.addTransaction(
            "2025-11-06", new BigDecimal("80"), cash, groceries, null).isSuccess());
        assertEquals(0, BigDecimal.ZERO.compareTo(balance(groceries)));
    }

    @Test
    @DisplayName("A reversal can be modified without losing its exemption")
    void testModifyReversal() {
        post("2025-10-15", "80", groceries, cash, null);
        UUID reversal = transactionService.addTransaction(
            "2025-11-01", new BigDecimal("80"), cash, groceries, null).getValue();

        OperationResult<LedgerTransaction> result = transactionService.modifyTransaction(
            reversal, TransactionUpdate.builder().date("2025-11-03").notes("refund").build());

        assertTrue(result.isSuccess());
        assertEquals(LocalDate.parse("2025-11-03"), result.getValue().getDate());
        assertEquals(0, BigDecimal.ZERO.compareTo(balance(groceries)));
    }

    @Test
    @DisplayName("Amounts beyond fifteen integer digits fail INVALID_INPUT without a posting")
    void testOversizedAmount() {
        OperationResult<UUID> result = transactionService.addTransaction(
            "2025-10-15", new BigDecimal("10000000000000000"), groceries, cash, null);
        printExpectedFailure(result);

        assertEquals(ErrorKind.INVALID_INPUT, result.getErrorKind());
        assertEquals(0L, transactionService.ledgerTotals().getTransactionCount());
    }

    @Test
    @DisplayName("Modify rejects unknown field names with INVALID_FIELD")
    void testModifyUnknownField() {
        UUID id = post("2025-10-15", "80", groceries, cash, null);

        OperationResult<LedgerTransaction> result = transactionService.modifyTransaction(
            id, Map.of("account", "Cash"));

        assertEquals(ErrorKind.INVALID_FIELD, result.getErrorKind());
    }

    @Test
    @DisplayName("Modify revalidates merged fields and applies valid changes")
    void testModify() {
        printTestHeader("Modify");
        UUID id = post("2025-10-15", "80", groceries, cash, "snacks");

        // Invalid changes leave the transaction untouched
        assertEquals(ErrorKind.INVALID_INPUT, transactionService.modifyTransaction(
            id, Map.of("amount", "-3")).getErrorKind());
        assertEquals(ErrorKind.INVALID_POSTING, transactionService.modifyTransaction(
            id, Map.of("creditId", groceries.toString())).getErrorKind());
        assertEquals(ErrorKind.INVALID_POSTING, transactionService.modifyTransaction(
            id, TransactionUpdate.builder().debitId(salary).creditId(cash).build()).getErrorKind());

        // A valid change
        OperationResult<LedgerTransaction> result = transactionService.modifyTransaction(id, Map.of(
            "amount", "95.25",
            "creditId", bank.toString(),
            "notes", "snacks and drinks"
        ));
        printOutput("Modified", result.getValue());

        assertTrue(result.isSuccess());
        assertEquals(0, new BigDecimal("95.25").compareTo(result.getValue().getAmount()));
        assertEquals(bank, result.getValue().getCreditAccountId());
        assertEquals("snacks and drinks", result.getValue().getNotes());
        assertEquals(0, BigDecimal.ZERO.compareTo(balance(cash)));
        assertEquals(0, new BigDecimal("-95.25").compareTo(balance(bank)));
    }

    @Test
    @DisplayName("Moving a transaction into a locked month fails PERIOD_LOCKED")
    void testModifyIntoLockedMonth() {
        UUID id = post("2025-11-15", "80", groceries, cash, null);
        periodLockService.lockPeriod("2025-10");

        OperationResult<LedgerTransaction> result = transactionService.modifyTransaction(
            id, TransactionUpdate.builder().date("2025-10-30").build());

        assertEquals(ErrorKind.PERIOD_LOCKED, result.getErrorKind());
        assertEquals(LocalDate.of(2025, 11, 15), transactionService.findTransaction(id).orElseThrow().getDate());
    }

    @Test
    @DisplayName("Empty update is a no-op; unknown id is NOT_FOUND")
    void testModifyEdgeCases() {
        UUID id = post("2025-10-15", "80", groceries, cash, "snacks");

        OperationResult<LedgerTransaction> noop = transactionService.modifyTransaction(
            id, TransactionUpdate.builder().build());

        assertTrue(noop.isSuccess());
        assertEquals(id, noop.getValue().getId());
        assertEquals(ErrorKind.NOT_FOUND, transactionService.modifyTransaction(
            UUID.randomUUID(), TransactionUpdate.builder().notes("x").build()).getErrorKind());
    }

    @Test
    @DisplayName("Delete removes the transaction and its effect on balances")
    void testDelete() {
        UUID id = post("2025-10-15", "80", groceries, cash, null);

        assertTrue(transactionService.deleteTransaction(id).isSuccess());

        assertTrue(transactionService.findTransaction(id).isEmpty());
        assertEquals(0, BigDecimal.ZERO.compareTo(balance(groceries)));
        assertEquals(ErrorKind.NOT_FOUND, transactionService.deleteTransaction(id).getErrorKind());
    }

    @Test
    @DisplayName("Search orders by date, then insertion order, and matches text in notes or account names")
    void testSearch() {
        UUID late = post("2025-10-20", "30", groceries, cash, "market");
        UUID firstOfDay = post("2025-10-05", "10", groceries, cash, "Coffee beans");
        UUID secondOfDay = post("2025-10-05", "20", cash, salary, "pay");

        List<LedgerTransaction> all = transactionService.searchTransactions(TransactionQuery.all()).getValue();
        assertEquals(List.of(firstOfDay, secondOfDay, late), all.stream().map(LedgerTransaction::getId).toList());

        List<LedgerTransaction> coffee = transactionService.searchTransactions(TransactionQuery.text("COFFEE")).getValue();
        assertEquals(List.of(firstOfDay), coffee.stream().map(LedgerTransaction::getId).toList());

        List<LedgerTransaction> salaryHits = transactionService.searchTransactions(TransactionQuery.text("salary")).getValue();
        assertEquals(List.of(secondOfDay), salaryHits.stream().map(LedgerTransaction::getId).toList());

        List<LedgerTransaction> debitGroceries = transactionService.searchTransactions(
            TransactionQuery.builder().debitAccountId(groceries).dateFrom(LocalDate.of(2025, 10, 10)).build()).getValue();
        assertEquals(List.of(late), debitGroceries.stream().map(LedgerTransaction::getId).toList());

        assertEquals(1, transactionService.searchTransactions(
            TransactionQuery.builder().limit(1).offset(1).build()).getValue().size());
        assertTrue(transactionService.searchTransactions(TransactionQuery.text("100%")).getValue().isEmpty());
    }

    @Test
    @DisplayName("Inverted date range and negative paging are INVALID_INPUT")
    void testSearchInvalid() {
        assertEquals(ErrorKind.INVALID_INPUT, transactionService.searchTransactions(TransactionQuery.builder()
            .dateFrom(LocalDate.of(2025, 10, 31))
            .dateTo(LocalDate.of(2025, 10, 1))
            .build()).getErrorKind());
        assertEquals(ErrorKind.INVALID_INPUT, transactionService.searchTransactions(
            TransactionQuery.builder().limit(-1).build()).getErrorKind());
    }

    @Test
    @DisplayName("Ledger totals: debits always equal credits")
    void testLedgerTotals() {
        post("2025-10-01", "30000", bank, salary, "salary");
        post("2025-10-02", "1200.75", groceries, bank, null);
        post("2025-10-03", "500", cash, bank, "ATM");

        LedgerTotals totals = transactionService.ledgerTotals();

        assertTrue(totals.isBalanced());
        assertEquals(3L, totals.getTransactionCount());
        assertEquals(0, new BigDecimal("31700.75").compareTo(totals.getTotalDebits()));
    }

    @Test
    @DisplayName("Rejected postings are counted by error kind")
    void testMetrics() {
        double before = ledgerMetrics.transactionCount("add", "invalid_posting");

        transactionService.addTransaction("2025-10-05", BigDecimal.TEN, cash, cash, null);

        assertEquals(before + 1, ledgerMetrics.transactionCount("add", "invalid_posting"));
    }
}
