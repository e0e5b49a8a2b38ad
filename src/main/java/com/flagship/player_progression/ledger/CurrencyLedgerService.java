package com.flagship.player_progression.ledger;

import com.flagship.player_progression.event.CurrencyChangedEvent;
import com.flagship.player_progression.observability.ProgressionMetrics;
import com.flagship.player_progression.outbox.OutboxService;
import com.flagship.player_progression.progression.ProgressionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Currency balance plus its append-only transaction log.
 *
 * Invariants:
 * 1. The balance never goes negative. The debit check and the write are one
 *    conditional UPDATE, so two concurrent debits cannot both pass.
 * 2. Every non-zero change appends exactly one currency_transactions row in
 *    the same transaction as the balance update.
 * 3. currency_transactions rows are never updated or deleted (database trigger).
 */
@Service
@Slf4j
public class CurrencyLedgerService {

    private final JdbcTemplate jdbcTemplate;
    private final ProgressionStore progressionStore;
    private final OutboxService outboxService;
    private final ProgressionMetrics metrics;

    public CurrencyLedgerService(JdbcTemplate jdbcTemplate,
                                 ProgressionStore progressionStore,
                                 OutboxService outboxService,
                                 ProgressionMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.progressionStore = progressionStore;
        this.outboxService = outboxService;
        this.metrics = metrics;
    }

    /**
     * Applies a signed balance change and logs it.
     *
     * Joins the caller's transaction when there is one. A zero amount is a
     * no-op and returns empty.
     *
     * @throws InsufficientCurrencyException if a debit exceeds the balance; nothing is written
     */
    @Transactional
    public Optional<CurrencyTransaction> applyCurrencyDelta(Long playerId, long amount,
                                                            TransactionKind kind, String referenceId) {
        if (amount == 0) {
            log.debug("Ignoring zero currency delta: playerId={}, kind={}", playerId, kind);
            return Optional.empty();
        }

        progressionStore.ensureExists(playerId);

        List<Long> updated = jdbcTemplate.query(
            "UPDATE player_progression SET currency_balance = currency_balance + ?, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE player_id = ? AND currency_balance + ? >= 0 RETURNING currency_balance",
            (rs, rowNum) -> rs.getLong("currency_balance"),
            amount, playerId, amount
        );

        if (updated.isEmpty()) {
            long balance = getBalance(playerId);
            log.info("Rejected debit: playerId={}, amount={}, balance={}, kind={}",
                    playerId, amount, balance, kind);
            throw new InsufficientCurrencyException(playerId, -amount, balance);
        }

        long balanceAfter = updated.get(0);
        CurrencyTransaction transaction = jdbcTemplate.queryForObject(
            "INSERT INTO currency_transactions (player_id, amount, balance_after, transaction_type, reference_id) " +
            "VALUES (?, ?, ?, ?, ?) " +
            "RETURNING transaction_id, player_id, amount, balance_after, transaction_type, reference_id, created_at",
            transactionRowMapper(),
            playerId, amount, balanceAfter, kind.getDbValue(), referenceId
        );

        outboxService.saveEvent(CurrencyChangedEvent.of(
                playerId, transaction.getTransactionId(), amount, balanceAfter,
                kind.getDbValue(), referenceId));
        metrics.recordCurrencyDelta(kind.getDbValue(), amount);

        log.info("Currency {}: playerId={}, amount={}, balanceAfter={}, kind={}, reference={}",
                amount > 0 ? "credited" : "debited", playerId, amount, balanceAfter, kind, referenceId);
        return Optional.of(transaction);
    }

    /**
     * Operator adjustment. Only {@link TransactionKind#MANUAL_KINDS} are accepted.
     */
    @Transactional
    public Optional<CurrencyTransaction> adjustBalance(Long playerId, long amount,
                                                       TransactionKind kind, String referenceId) {
        if (!TransactionKind.MANUAL_KINDS.contains(kind)) {
            throw new IllegalArgumentException("Transaction type " + kind.getDbValue()
                    + " cannot be posted manually");
        }
        return applyCurrencyDelta(playerId, amount, kind, referenceId);
    }

    /**
     * Current balance; 0 for a player without a progression row.
     */
    public long getBalance(Long playerId) {
        List<Long> rows = jdbcTemplate.query(
            "SELECT currency_balance FROM player_progression WHERE player_id = ?",
            (rs, rowNum) -> rs.getLong("currency_balance"),
            playerId
        );
        return rows.isEmpty() ? 0L : rows.get(0);
    }

    /**
     * The player's log in append order.
     */
    public List<CurrencyTransaction> getTransactions(Long playerId) {
        return jdbcTemplate.query(
            "SELECT transaction_id, player_id, amount, balance_after, transaction_type, reference_id, created_at " +
            "FROM currency_transactions WHERE player_id = ? ORDER BY transaction_id",
            transactionRowMapper(),
            playerId
        );
    }

    private RowMapper<CurrencyTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new CurrencyTransaction(
            rs.getLong("transaction_id"),
            rs.getLong("player_id"),
            rs.getLong("amount"),
            rs.getLong("balance_after"),
            TransactionKind.fromDbValue(rs.getString("transaction_type")),
            rs.getString("reference_id"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
