package com.flagship.finance_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the transactions table.
 *
 * Balances are never stored: every balance and report figure is summed from
 * these rows. The schema backs the posting invariants with CHECK constraints
 * (positive amount, distinct debit and credit accounts) and foreign keys.
 */
@Repository
@Slf4j
public class TransactionStore {

    private static final String SELECT_WITH_NAMES =
        "SELECT t.id, t.sequence_number, t.txn_date, t.amount, " +
        "       t.debit_account_id, da.name AS debit_account_name, " +
        "       t.credit_account_id, ca.name AS credit_account_name, " +
        "       t.notes, t.created_at, t.updated_at " +
        "FROM transactions t " +
        "JOIN accounts da ON da.id = t.debit_account_id " +
        "JOIN accounts ca ON ca.id = t.credit_account_id ";

    private final JdbcTemplate jdbcTemplate;

    public TransactionStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Next insertion-order number. Callers hold the surrounding transaction;
     * the ledger has a single writer.
     */
    public long nextSequenceNumber() {
        Long max = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(sequence_number), 0) FROM transactions",
            Long.class
        );
        return (max != null ? max : 0L) + 1;
    }

    public void insert(UUID id, long sequenceNumber, LocalDate date, BigDecimal amount,
                       UUID debitAccountId, UUID creditAccountId, String notes) {
        jdbcTemplate.update(
            "INSERT INTO transactions (id, sequence_number, txn_date, amount, debit_account_id, " +
            "credit_account_id, notes, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            id,
            sequenceNumber,
            date,
            amount,
            debitAccountId,
            creditAccountId,
            notes
        );
        log.debug("Inserted transaction row: id={}, seq={}", id, sequenceNumber);
    }

    public void update(UUID id, LocalDate date, BigDecimal amount,
                       UUID debitAccountId, UUID creditAccountId, String notes) {
        jdbcTemplate.update(
            "UPDATE transactions SET txn_date = ?, amount = ?, debit_account_id = ?, credit_account_id = ?, " +
            "notes = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            date,
            amount,
            debitAccountId,
            creditAccountId,
            notes,
            id
        );
    }

    public boolean delete(UUID id) {
        return jdbcTemplate.update("DELETE FROM transactions WHERE id = ?", id) > 0;
    }

    public Optional<LedgerTransaction> findById(UUID id) {
        List<LedgerTransaction> rows = jdbcTemplate.query(
            SELECT_WITH_NAMES + "WHERE t.id = ?",
            transactionRowMapper(),
            id
        );
        return rows.stream().findFirst();
    }

    /**
     * Runs a search. Limit and offset must already be resolved by the caller.
     */
    public List<LedgerTransaction> search(TransactionQuery query, int limit, int offset) {
        StringBuilder sql = new StringBuilder(SELECT_WITH_NAMES).append("WHERE 1=1 ");
        List<Object> params = new ArrayList<>();

        if (query.getText() != null && !query.getText().isBlank()) {
            String pattern = "%" + escapeLike(query.getText().trim().toLowerCase(Locale.ROOT)) + "%";
            sql.append("AND (LOWER(COALESCE(t.notes, '')) LIKE ? OR LOWER(da.name) LIKE ? OR LOWER(ca.name) LIKE ?) ");
            params.add(pattern);
            params.add(pattern);
            params.add(pattern);
        }
        if (query.getDateFrom() != null) {
            sql.append("AND t.txn_date >= ? ");
            params.add(query.getDateFrom());
        }
        if (query.getDateTo() != null) {
            sql.append("AND t.txn_date <= ? ");
            params.add(query.getDateTo());
        }
        if (query.getAccountId() != null) {
            sql.append("AND (t.debit_account_id = ? OR t.credit_account_id = ?) ");
            params.add(query.getAccountId());
            params.add(query.getAccountId());
        }
        if (query.getDebitAccountId() != null) {
            sql.append("AND t.debit_account_id = ? ");
            params.add(query.getDebitAccountId());
        }
        if (query.getCreditAccountId() != null) {
            sql.append("AND t.credit_account_id = ? ");
            params.add(query.getCreditAccountId());
        }

        sql.append("ORDER BY t.txn_date ASC, t.sequence_number ASC LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);

        return jdbcTemplate.query(sql.toString(), transactionRowMapper(), params.toArray());
    }

    /**
     * Debits and credits posted to an account, optionally bounded by dates (inclusive).
     */
    public AccountMovement movement(UUID accountId, LocalDate from, LocalDate to) {
        StringBuilder sql = new StringBuilder(
            "SELECT COALESCE(SUM(CASE WHEN debit_account_id = ? THEN amount ELSE 0 END), 0) AS debits, " +
            "       COALESCE(SUM(CASE WHEN credit_account_id = ? THEN amount ELSE 0 END), 0) AS credits " +
            "FROM transactions WHERE (debit_account_id = ? OR credit_account_id = ?) ");
        List<Object> params = new ArrayList<>(List.of(accountId, accountId, accountId, accountId));
        if (from != null) {
            sql.append("AND txn_date >= ? ");
            params.add(from);
        }
        if (to != null) {
            sql.append("AND txn_date <= ? ");
            params.add(to);
        }

        AccountMovement movement = jdbcTemplate.queryForObject(
            sql.toString(),
            (rs, rowNum) -> new AccountMovement(rs.getBigDecimal("debits"), rs.getBigDecimal("credits")),
            params.toArray()
        );
        return movement != null ? movement : AccountMovement.NONE;
    }

    /**
     * Counts postings with exactly these accounts and amount, leaving out
     * {@code excludedId} when it is not null.
     */
    public int countPostings(UUID debitAccountId, UUID creditAccountId, BigDecimal amount, UUID excludedId) {
        StringBuilder sql = new StringBuilder(
            "SELECT COUNT(*) FROM transactions WHERE debit_account_id = ? AND credit_account_id = ? AND amount = ? ");
        List<Object> params = new ArrayList<>(List.of(debitAccountId, creditAccountId, amount));
        if (excludedId != null) {
            sql.append("AND id <> ?");
            params.add(excludedId);
        }
        Integer count = jdbcTemplate.queryForObject(sql.toString(), Integer.class, params.toArray());
        return count != null ? count : 0;
    }

    /**
     * Totals each side of the ledger separately: debit-side amounts and credit-side amounts.
     */
    public LedgerTotals totals() {
        BigDecimal debits = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(t.amount), 0) FROM transactions t " +
            "JOIN accounts a ON a.id = t.debit_account_id",
            BigDecimal.class
        );
        BigDecimal credits = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(t.amount), 0) FROM transactions t " +
            "JOIN accounts a ON a.id = t.credit_account_id",
            BigDecimal.class
        );
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Long.class);
        return new LedgerTotals(
            debits != null ? debits : BigDecimal.ZERO,
            credits != null ? credits : BigDecimal.ZERO,
            count != null ? count : 0L
        );
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getObject("id", UUID.class),
            rs.getLong("sequence_number"),
            rs.getObject("txn_date", LocalDate.class),
            rs.getBigDecimal("amount"),
            rs.getObject("debit_account_id", UUID.class),
            rs.getString("debit_account_name"),
            rs.getObject("credit_account_id", UUID.class),
            rs.getString("credit_account_name"),
            rs.getString("notes"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant(),
            rs.getObject("updated_at", OffsetDateTime.class).toInstant()
        );
    }
}
